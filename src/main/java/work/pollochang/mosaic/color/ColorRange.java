package work.pollochang.mosaic.color;

import work.pollochang.mosaic.core.ColorSignature;
import work.pollochang.mosaic.core.Rgb;

import java.util.Collection;

/**
 * 一組顏色在各 RGB 通道上的最小值與最大值。
 */
public record ColorRange(Rgb min, Rgb max) {

    public static final ColorRange FULL = new ColorRange(new Rgb(0, 0, 0), new Rgb(255, 255, 255));

    /**
     * 空集合回傳 {@link #FULL}。
     */
    public static ColorRange of(Collection<? extends ColorSignature> colors) {
        if (colors.isEmpty()) {
            return FULL;
        }
        int minR = 255, minG = 255, minB = 255;
        int maxR = 0, maxG = 0, maxB = 0;
        for (ColorSignature signature : colors) {
            Rgb c = signature.rgb();
            minR = Math.min(minR, c.r());
            minG = Math.min(minG, c.g());
            minB = Math.min(minB, c.b());
            maxR = Math.max(maxR, c.r());
            maxG = Math.max(maxG, c.g());
            maxB = Math.max(maxB, c.b());
        }
        return new ColorRange(new Rgb(minR, minG, minB), new Rgb(maxR, maxG, maxB));
    }

    /**
     * @param other   要比較的範圍
     * @param margin  每個通道容許的差距
     * @return 此範圍是否 (在容許差距內) 涵蓋 other
     */
    public boolean covers(ColorRange other, int margin) {
        return min.r() - margin <= other.min.r() && max.r() + margin >= other.max.r()
                && min.g() - margin <= other.min.g() && max.g() + margin >= other.max.g()
                && min.b() - margin <= other.min.b() && max.b() + margin >= other.max.b();
    }
}
