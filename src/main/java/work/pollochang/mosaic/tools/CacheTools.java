package work.pollochang.mosaic.tools;

import work.pollochang.mosaic.cache.TileCacheKey;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;

public class CacheTools {

    private static final int DEFAULT_ESTIMATE = 1024;

    /**
     * 輔助方法來產生 Key
     * @param tileId 磁磚識別碼
     * @param renderSize 繪製邊長 (px)
     * @return 快取鍵
     */
    public static TileCacheKey createKey(String tileId, int renderSize) {
        return new TileCacheKey(tileId, renderSize);
    }

    /**
     * 估算繪製結果佔用的位元組數：寬 x 高 x 每像素位元組數。
     * @param surface 已繪製的磁磚
     * @return 估計大小 (bytes)
     */
    public static long estimateByteSize(BufferedImage surface) {
        if (surface == null) {
            return DEFAULT_ESTIMATE;
        }
        int bitsPerPixel = surface.getColorModel().getPixelSize();
        // TYPE_INT_RGB 的 pixelSize 為 24，但實際以 int 儲存
        int bytesPerPixel = surface.getRaster().getDataBuffer().getDataType() == DataBuffer.TYPE_INT
                ? 4
                : Math.max(1, (bitsPerPixel + 7) / 8);
        return (long) surface.getWidth() * surface.getHeight() * bytesPerPixel;
    }
}
