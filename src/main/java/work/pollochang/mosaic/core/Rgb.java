package work.pollochang.mosaic.core;

/**
 * 8-bit RGB 色彩。
 */
public record Rgb(int r, int g, int b) {

    public static final Rgb BLACK = new Rgb(0, 0, 0);

    public Rgb {
        if (r < 0 || r > 255 || g < 0 || g > 255 || b < 0 || b > 255) {
            throw new IllegalArgumentException("RGB 分量超出範圍: (" + r + ", " + g + ", " + b + ")");
        }
    }

    public int toArgb() {
        return 0xFF000000 | (r << 16) | (g << 8) | b;
    }

    public static Rgb fromArgb(int argb) {
        return new Rgb((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }
}
