package work.pollochang.mosaic.extract;

import work.pollochang.mosaic.core.TileRecord;

import java.util.List;

/**
 * 磁磚池的整體統計。
 *
 * @param tileCount         成功擷取的磁磚數
 * @param averageBrightness 各磁磚亮度的平均
 * @param averageContrast   各磁磚對比的平均
 */
public record TileStatistics(int tileCount, double averageBrightness, double averageContrast) {

    public static final TileStatistics EMPTY = new TileStatistics(0, 0, 0);

    public static TileStatistics of(List<TileRecord> records) {
        if (records.isEmpty()) {
            return EMPTY;
        }
        double brightness = 0;
        double contrast = 0;
        for (TileRecord record : records) {
            brightness += record.brightness();
            contrast += record.contrast();
        }
        return new TileStatistics(records.size(), brightness / records.size(), contrast / records.size());
    }
}
