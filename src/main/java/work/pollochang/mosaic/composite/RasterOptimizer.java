package work.pollochang.mosaic.composite;

import java.awt.image.BufferedImage;

/**
 * 最終畫布的色彩調整。
 */
public final class RasterOptimizer {

    /** 高品質模式的對比強化倍率。 */
    public static final double HIGH_QUALITY_FACTOR = 1.1;

    private RasterOptimizer() {}

    /**
     * 每個 RGB 通道乘上 {@code factor} 並截斷在 255，直接修改傳入的畫布，alpha 不變。
     */
    public static void enhance(BufferedImage raster, double factor) {
        if (factor <= 0) {
            throw new IllegalArgumentException("factor must be positive: " + factor);
        }
        int width = raster.getWidth();
        int height = raster.getHeight();
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            raster.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int p = row[x];
                int a = p & 0xFF000000;
                int r = scale((p >> 16) & 0xFF, factor);
                int g = scale((p >> 8) & 0xFF, factor);
                int b = scale(p & 0xFF, factor);
                row[x] = a | (r << 16) | (g << 8) | b;
            }
            raster.setRGB(0, y, width, 1, row, 0, width);
        }
    }

    private static int scale(int channel, double factor) {
        return Math.min(255, (int) Math.round(channel * factor));
    }
}
