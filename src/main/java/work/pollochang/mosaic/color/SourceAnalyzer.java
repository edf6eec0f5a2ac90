package work.pollochang.mosaic.color;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.core.PixelBuffer;
import work.pollochang.mosaic.core.Rgb;
import work.pollochang.mosaic.core.SourceCell;
import work.pollochang.mosaic.progress.ProgressController;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 將來源圖片切成 gridSize x gridSize 的格子並計算每格的代表色。
 *
 * <p>格子邊界依比例計算 ({@code floor(i * width / gridSize)})，
 * 因此不能整除時邊緣像素也會被涵蓋；網格比圖片還細時，每格至少取 1 個像素。
 */
@Slf4j
public final class SourceAnalyzer {

    private SourceAnalyzer() {}

    /**
     * @param source     來源像素
     * @param gridSize   每邊格數
     * @param conversion Lab 轉換方式，須與磁磚使用同一種
     * @param progress   可為 null；不為 null 時每列更新進度並經過檢查點
     * @return 依列優先排列的格子，數量為 gridSize²
     */
    public static List<SourceCell> analyze(PixelBuffer source, int gridSize, LabConversion conversion,
                                           ProgressController progress) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(conversion, "conversion must not be null");
        if (gridSize < 1) {
            throw new IllegalArgumentException("gridSize must be positive: " + gridSize);
        }

        List<SourceCell> cells = new ArrayList<>(gridSize * gridSize);
        for (int y = 0; y < gridSize; y++) {
            int y0 = lowerBound(y, source.height(), gridSize);
            int y1 = upperBound(y, y0, source.height(), gridSize);
            for (int x = 0; x < gridSize; x++) {
                int x0 = lowerBound(x, source.width(), gridSize);
                int x1 = upperBound(x, x0, source.width(), gridSize);
                Rgb color = cellColor(source, x0, y0, x1, y1);
                cells.add(new SourceCell(x, y, color, conversion.convert(color)));
            }
            if (progress != null) {
                progress.updateStage(100.0 * (y + 1) / gridSize);
                progress.checkpoint();
            }
        }
        log.debug("來源圖片 {}x{} 已切成 {}x{} 格", source.width(), source.height(), gridSize, gridSize);
        return cells;
    }

    /**
     * 區塊 [x0, x1) x [y0, y1) 內所有像素的算術平均。
     */
    static Rgb cellColor(PixelBuffer source, int x0, int y0, int x1, int y1) {
        long r = 0, g = 0, b = 0;
        int count = 0;
        for (int y = y0; y < y1; y++) {
            int row = y * source.width();
            for (int x = x0; x < x1; x++) {
                int index = row + x;
                r += source.red(index);
                g += source.green(index);
                b += source.blue(index);
                count++;
            }
        }
        if (count == 0) {
            return Rgb.BLACK;
        }
        return new Rgb(
                (int) Math.round((double) r / count),
                (int) Math.round((double) g / count),
                (int) Math.round((double) b / count));
    }

    private static int lowerBound(int index, int length, int gridSize) {
        return Math.min(length - 1, (int) ((long) index * length / gridSize));
    }

    private static int upperBound(int index, int lower, int length, int gridSize) {
        int upper = (int) ((long) (index + 1) * length / gridSize);
        return Math.min(length, Math.max(lower + 1, upper));
    }
}
