package work.pollochang.mosaic.color;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.core.ColorSignature;
import work.pollochang.mosaic.core.SourceCell;
import work.pollochang.mosaic.progress.ProgressController;

import java.util.List;

/**
 * 比對來源格子與磁磚的色彩分布，產生 {@link ColorAnalysis}。
 */
@Slf4j
public final class ColorAnalyzer {

    /** 判斷色彩範圍涵蓋時，每個通道容許的差距。 */
    public static final int COVERAGE_MARGIN = 32;

    private ColorAnalyzer() {}

    /**
     * @param progress 可為 null；不為 null 時每列更新進度並經過檢查點
     */
    public static ColorAnalysis analyze(List<SourceCell> cells, List<? extends ColorSignature> tiles,
                                        DistanceMetric metric, int gridSize, ProgressController progress) {
        ColorRange sourceRange = ColorRange.of(cells);
        ColorRange tileRange = ColorRange.of(tiles);

        double sum = 0;
        double max = 0;
        int rowLength = Math.max(1, gridSize);
        for (int i = 0; i < cells.size(); i++) {
            double best = tiles.isEmpty() ? 0 : Double.MAX_VALUE;
            for (ColorSignature tile : tiles) {
                best = Math.min(best, ColorMath.distance(cells.get(i), tile, metric));
            }
            sum += best;
            max = Math.max(max, best);

            if (progress != null && (i + 1) % rowLength == 0) {
                progress.updateStage(100.0 * (i + 1) / cells.size());
                progress.checkpoint();
            }
        }
        double mean = cells.isEmpty() ? 0 : sum / cells.size();
        boolean covers = tileRange.covers(sourceRange, COVERAGE_MARGIN);

        if (!covers) {
            log.warn("磁磚色彩範圍 {} ~ {} 未涵蓋來源色彩範圍 {} ~ {}，部分區域可能無法貼近原色",
                    tileRange.min(), tileRange.max(), sourceRange.min(), sourceRange.max());
        }
        log.info("色彩分析完成，平均最佳色差 {}，最大最佳色差 {}",
                String.format("%.2f", mean), String.format("%.2f", max));
        return new ColorAnalysis(sourceRange, tileRange, mean, max, covers);
    }
}
