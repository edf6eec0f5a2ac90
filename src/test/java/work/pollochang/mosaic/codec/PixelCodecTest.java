package work.pollochang.mosaic.codec;

import org.junit.jupiter.api.Test;
import work.pollochang.mosaic.core.PixelBuffer;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PixelCodecTest {

    /**
     * 產生隨機像素的測試緩衝
     */
    private PixelBuffer createRandomBuffer(int width, int height, long seed) {
        byte[] rgba = new byte[width * height * PixelBuffer.BYTES_PER_PIXEL];
        new Random(seed).nextBytes(rgba);
        return new PixelBuffer(width, height, rgba);
    }

    private PixelBuffer createSolidBuffer(int width, int height, int r, int g, int b) {
        byte[] rgba = new byte[width * height * PixelBuffer.BYTES_PER_PIXEL];
        for (int i = 0; i < width * height; i++) {
            rgba[i * 4] = (byte) r;
            rgba[i * 4 + 1] = (byte) g;
            rgba[i * 4 + 2] = (byte) b;
            rgba[i * 4 + 3] = (byte) 255;
        }
        return new PixelBuffer(width, height, rgba);
    }

    /**
     * 壓縮再解壓後，每個通道的誤差小於一個量化階 (紅/藍 8，綠 4)
     */
    @Test
    void testRoundTrip_ShouldStayWithinOneQuantizationStep() {
        PixelBuffer original = createRandomBuffer(64, 64, 42L);
        PixelBuffer restored = PixelCodec.decompress(PixelCodec.compress(original));

        assertEquals(original.width(), restored.width());
        assertEquals(original.height(), restored.height());
        for (int i = 0; i < original.pixelCount(); i++) {
            assertTrue(Math.abs(original.red(i) - restored.red(i)) < 8, "red at " + i);
            assertTrue(Math.abs(original.green(i) - restored.green(i)) < 4, "green at " + i);
            assertTrue(Math.abs(original.blue(i) - restored.blue(i)) < 8, "blue at " + i);
            assertEquals(255, restored.alpha(i));
        }
    }

    @Test
    void testCompress_ShouldBeDeterministicAndHalfTheSize() {
        PixelBuffer buffer = createRandomBuffer(64, 64, 7L);
        CompressedPixels first = PixelCodec.compress(buffer);
        CompressedPixels second = PixelCodec.compress(buffer);

        assertArrayEquals(first.data(), second.data());
        assertEquals(buffer.byteSize() / 2, first.byteSize());
    }

    @Test
    void testCompress_KnownColor_ShouldPackRgb565() {
        CompressedPixels compressed = PixelCodec.compress(createSolidBuffer(1, 1, 255, 255, 255));
        assertEquals(0xFFFF, compressed.data()[0] & 0xFFFF);

        PixelBuffer restored = PixelCodec.decompress(PixelCodec.compress(createSolidBuffer(1, 1, 0, 0, 255)));
        assertEquals(0, restored.red(0));
        assertEquals(0, restored.green(0));
        assertEquals(248, restored.blue(0));
    }

    @Test
    void testDownscale_ShouldPreserveAspectRatio() {
        PixelBuffer scaled = PixelCodec.downscale(createSolidBuffer(256, 128, 10, 20, 30), 64);
        assertEquals(64, scaled.width());
        assertEquals(32, scaled.height());
    }

    @Test
    void testDownscale_SmallImage_ShouldNotUpscale() {
        PixelBuffer small = createSolidBuffer(20, 10, 10, 20, 30);
        assertSame(small, PixelCodec.downscale(small, 64));
    }

    /**
     * 極端長寬比時短邊至少保留 1 px
     */
    @Test
    void testDownscale_ThinImage_ShouldKeepAtLeastOnePixel() {
        PixelBuffer scaled = PixelCodec.downscale(createSolidBuffer(1024, 2, 10, 20, 30), 64);
        assertEquals(64, scaled.width());
        assertEquals(1, scaled.height());
    }

    @Test
    void testThumbnail_ShouldAlwaysBe64Square() {
        PixelBuffer thumb = PixelCodec.thumbnail(createSolidBuffer(30, 90, 200, 100, 50));
        assertEquals(PixelCodec.THUMBNAIL_SIZE, thumb.width());
        assertEquals(PixelCodec.THUMBNAIL_SIZE, thumb.height());
    }

    @Test
    void testCompressedPixels_LengthMismatch_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new CompressedPixels(2, 2, new short[3]));
    }

    @Test
    void testEquals_ShouldCompareContents() {
        PixelBuffer first = createSolidBuffer(4, 4, 10, 20, 30);
        PixelBuffer second = createSolidBuffer(4, 4, 10, 20, 30);

        assertNotSame(first.rgba(), second.rgba());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, createSolidBuffer(4, 4, 10, 20, 31));

        assertEquals(PixelCodec.compress(first), PixelCodec.compress(second));
        assertEquals(new CompressedPixels(1, 1, new short[]{7}).hashCode(),
                new CompressedPixels(1, 1, new short[]{7}).hashCode());
        assertNotEquals(new CompressedPixels(1, 1, new short[]{7}), new CompressedPixels(1, 1, new short[]{8}));
    }
}
