package work.pollochang.mosaic.core;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * 呼叫端提供的影像來源，在引擎邊界解析一次成 {@link PixelBuffer}。
 * <p>
 * 引擎內部只處理原始像素，不做任何格式解碼。
 */
@FunctionalInterface
public interface PixelSource {

    /**
     * 解析成像素緩衝。
     *
     * @return 非 null 的像素緩衝
     * @throws IllegalArgumentException 像素資料不合法時
     */
    PixelBuffer resolve();

    static PixelSource ofBuffer(PixelBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        return () -> buffer;
    }

    static PixelSource ofImage(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        return () -> PixelBuffer.fromBufferedImage(image);
    }

    /**
     * 延遲驗證的原始 RGBA 資料，長度不符時在 {@link #resolve()} 才拋出。
     */
    static PixelSource ofRgba(int width, int height, byte[] rgba) {
        return () -> new PixelBuffer(width, height, rgba);
    }
}
