package work.pollochang.mosaic.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * RGB565 壓縮後的像素，每像素 16 bit。
 * <p>
 * {@code data} 陣列共用不複製，建構後不得再修改。相等性依內容比較。
 *
 * @param width  寬度
 * @param height 高度
 * @param data   長度為 {@code width * height}
 */
public record CompressedPixels(int width, int height, short[] data) {

    public static final int BYTES_PER_PIXEL = 2;

    public CompressedPixels {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length != width * height) {
            throw new IllegalArgumentException("壓縮資料長度 " + data.length + " 與尺寸 " + width + "x" + height + " 不符");
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
        CompressedPixels other = (CompressedPixels) o;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "CompressedPixels[" + width + "x" + height + "]";
    }

    public long byteSize() {
        return (long) data.length * BYTES_PER_PIXEL;
    }
}
