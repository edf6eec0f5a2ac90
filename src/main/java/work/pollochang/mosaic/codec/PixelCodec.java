package work.pollochang.mosaic.codec;

import work.pollochang.mosaic.core.PixelBuffer;

import java.awt.image.BufferedImage;
import java.util.Objects;

import static work.pollochang.mosaic.tools.ImageTools.resizeImage;

/**
 * 磁磚像素的有損壓縮與縮圖工具。
 *
 * <p>壓縮格式為 RGB565：紅 5 bit、綠 6 bit、藍 5 bit，捨棄 alpha，
 * 記憶體用量為原始 RGBA 的一半。解壓後每個通道與原值的差距小於一個量化階
 * (紅/藍 8，綠 4)，且相同輸入永遠得到相同輸出。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class PixelCodec {

    /** 磁磚縮圖固定邊長。 */
    public static final int THUMBNAIL_SIZE = 64;

    private PixelCodec() {}

    public static CompressedPixels compress(PixelBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        short[] data = new short[buffer.pixelCount()];
        for (int i = 0; i < data.length; i++) {
            int r = buffer.red(i) >> 3;
            int g = buffer.green(i) >> 2;
            int b = buffer.blue(i) >> 3;
            data[i] = (short) ((r << 11) | (g << 5) | b);
        }
        return new CompressedPixels(buffer.width(), buffer.height(), data);
    }

    public static PixelBuffer decompress(CompressedPixels compressed) {
        Objects.requireNonNull(compressed, "compressed must not be null");
        short[] data = compressed.data();
        byte[] rgba = new byte[data.length * PixelBuffer.BYTES_PER_PIXEL];
        for (int i = 0; i < data.length; i++) {
            int pixel = data[i] & 0xFFFF;
            int offset = i * PixelBuffer.BYTES_PER_PIXEL;
            rgba[offset] = (byte) ((pixel >> 11) << 3);
            rgba[offset + 1] = (byte) (((pixel >> 5) & 0x3F) << 2);
            rgba[offset + 2] = (byte) ((pixel & 0x1F) << 3);
            rgba[offset + 3] = (byte) 0xFF;
        }
        return new PixelBuffer(compressed.width(), compressed.height(), rgba);
    }

    /**
     * 等比例縮小，使長邊不超過 {@code maxDimension}。不會放大。
     *
     * @param buffer       原始像素
     * @param maxDimension 長邊上限
     * @return 原物件 (已在範圍內時) 或縮小後的新緩衝
     */
    public static PixelBuffer downscale(PixelBuffer buffer, int maxDimension) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        if (maxDimension <= 0) {
            throw new IllegalArgumentException("maxDimension must be positive: " + maxDimension);
        }
        int longest = Math.max(buffer.width(), buffer.height());
        if (longest <= maxDimension) {
            return buffer;
        }
        double scale = (double) maxDimension / longest;
        int newWidth = Math.max(1, (int) Math.floor(buffer.width() * scale));
        int newHeight = Math.max(1, (int) Math.floor(buffer.height() * scale));
        return resize(buffer, newWidth, newHeight);
    }

    /**
     * 產生固定 64x64 的縮圖：先等比例縮小以限制記憶體，再拉伸成正方形。
     */
    public static PixelBuffer thumbnail(PixelBuffer buffer) {
        PixelBuffer reduced = downscale(buffer, THUMBNAIL_SIZE);
        if (reduced.width() == THUMBNAIL_SIZE && reduced.height() == THUMBNAIL_SIZE) {
            return reduced;
        }
        return resize(reduced, THUMBNAIL_SIZE, THUMBNAIL_SIZE);
    }

    static PixelBuffer resize(PixelBuffer buffer, int width, int height) {
        BufferedImage source = buffer.toBufferedImage();
        BufferedImage resized = resizeImage(source, width, height);
        try {
            return PixelBuffer.fromBufferedImage(resized);
        } finally {
            source.flush();
            resized.flush();
        }
    }
}
