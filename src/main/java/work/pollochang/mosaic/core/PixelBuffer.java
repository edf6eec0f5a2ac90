package work.pollochang.mosaic.core;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Objects;

/**
 * 引擎內部唯一使用的像素表示：RGBA 各 8 bit，依列優先 (row-major) 排列。
 * <p>
 * 為避免大型緩衝區的複製，{@code rgba} 陣列直接共用而不做防禦性複製；
 * 建構後呼叫端不得再修改該陣列。相等性依像素內容比較。
 *
 * @param width  寬度 (px)
 * @param height 高度 (px)
 * @param rgba   長度必須為 {@code width * height * 4}
 */
public record PixelBuffer(int width, int height, byte[] rgba) {

    public static final int BYTES_PER_PIXEL = 4;

    public PixelBuffer {
        Objects.requireNonNull(rgba, "rgba must not be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("無效的像素尺寸: " + width + "x" + height);
        }
        if (rgba.length != width * height * BYTES_PER_PIXEL) {
            throw new IllegalArgumentException("像素資料長度 " + rgba.length + " 與尺寸 " + width + "x" + height + " 不符");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PixelBuffer other = (PixelBuffer) o;
        return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgba);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }

    public int pixelCount() {
        return width * height;
    }

    public long byteSize() {
        return rgba.length;
    }

    public int red(int index) {
        return rgba[index * BYTES_PER_PIXEL] & 0xFF;
    }

    public int green(int index) {
        return rgba[index * BYTES_PER_PIXEL + 1] & 0xFF;
    }

    public int blue(int index) {
        return rgba[index * BYTES_PER_PIXEL + 2] & 0xFF;
    }

    public int alpha(int index) {
        return rgba[index * BYTES_PER_PIXEL + 3] & 0xFF;
    }

    /**
     * 轉成 {@link BufferedImage#TYPE_INT_ARGB}，供 Graphics2D 繪製使用。
     */
    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] argb = new int[pixelCount()];
        for (int i = 0; i < argb.length; i++) {
            argb[i] = (alpha(i) << 24) | (red(i) << 16) | (green(i) << 8) | blue(i);
        }
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    /**
     * 從任意型別的 {@link BufferedImage} 讀出 RGBA 像素。
     */
    public static PixelBuffer fromBufferedImage(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        byte[] rgba = new byte[w * h * BYTES_PER_PIXEL];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            int offset = i * BYTES_PER_PIXEL;
            rgba[offset] = (byte) ((p >> 16) & 0xFF);
            rgba[offset + 1] = (byte) ((p >> 8) & 0xFF);
            rgba[offset + 2] = (byte) (p & 0xFF);
            rgba[offset + 3] = (byte) ((p >>> 24) & 0xFF);
        }
        return new PixelBuffer(w, h, rgba);
    }
}
