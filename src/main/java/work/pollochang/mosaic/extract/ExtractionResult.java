package work.pollochang.mosaic.extract;

import work.pollochang.mosaic.core.TileRecord;

import java.util.List;

/**
 * @param records  成功擷取的磁磚，順序與輸入相同
 * @param failures 失敗的磁磚
 */
public record ExtractionResult(List<TileRecord> records, List<TileFailure> failures) {

    public ExtractionResult {
        records = List.copyOf(records);
        failures = List.copyOf(failures);
    }

    public TileStatistics statistics() {
        return TileStatistics.of(records);
    }
}
