package work.pollochang.mosaic.color;

/**
 * 來源與磁磚色彩分布的摘要，僅供報告與日誌使用，不影響磁磚分配。
 *
 * @param sourceRange         來源格子的色彩範圍
 * @param tileRange           磁磚平均色的色彩範圍
 * @param meanBestDistance    每格與最接近磁磚的平均色差
 * @param maxBestDistance     每格與最接近磁磚的最大色差
 * @param paletteCoversSource 磁磚色彩範圍是否涵蓋來源
 */
public record ColorAnalysis(ColorRange sourceRange, ColorRange tileRange, double meanBestDistance,
                            double maxBestDistance, boolean paletteCoversSource) {
}
