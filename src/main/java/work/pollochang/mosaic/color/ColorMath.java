package work.pollochang.mosaic.color;

import work.pollochang.mosaic.core.ColorSignature;
import work.pollochang.mosaic.core.Lab;
import work.pollochang.mosaic.core.Rgb;

/**
 * 色彩空間轉換與色差計算。全部為無副作用的純函式。
 *
 * <p>提供兩種 Lab 轉換：
 * <ul>
 *   <li>{@link #rgbToLab(Rgb)}：標準 sRGB → XYZ → CIE-Lab (D65)，需要準確度時使用。</li>
 *   <li>{@link #rgbToLabFast(Rgb)}：亮度加兩個色度代理值的線性近似，速度優先時使用。</li>
 * </ul>
 *
 * <p>以及三種色差：加權 RGB、CIE76 (Lab 歐氏距離)、CIEDE2000。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class ColorMath {

    // D65 參考白點
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private static final double EPSILON = 0.008856;
    private static final double KAPPA_SLOPE = 7.787;
    private static final double POW25_7 = Math.pow(25, 7);

    private ColorMath() {}

    /**
     * 標準 sRGB → CIE-Lab 轉換，含 gamma 線性化，參考白點為 D65/2°。
     *
     * @param rgb 8-bit sRGB 色彩
     * @return L 範圍約 0~100 的 Lab 值
     */
    public static Lab rgbToLab(Rgb rgb) {
        double r = linearize(rgb.r() / 255.0);
        double g = linearize(rgb.g() / 255.0);
        double b = linearize(rgb.b() / 255.0);

        double x = (r * 0.4124564 + g * 0.3575761 + b * 0.1804375) / XN;
        double y = (r * 0.2126729 + g * 0.7151522 + b * 0.0721750) / YN;
        double z = (r * 0.0193339 + g * 0.1191920 + b * 0.9503041) / ZN;

        double fx = labF(x);
        double fy = labF(y);
        double fz = labF(z);

        return new Lab(116 * fy - 16, 500 * (fx - fy), 200 * (fy - fz));
    }

    /**
     * 快速近似：L 取亮度 (luma)，a/b 取兩個色度差值，皆縮放到 0~100 的量級。
     */
    public static Lab rgbToLabFast(Rgb rgb) {
        double r = rgb.r() / 255.0;
        double g = rgb.g() / 255.0;
        double b = rgb.b() / 255.0;

        double l = 0.299 * r + 0.587 * g + 0.114 * b;
        double a = 0.5 * (r - g);
        double bVal = 0.5 * (g - b);
        return new Lab(l * 100, a * 100, bVal * 100);
    }

    /**
     * CIE76：Lab 空間的歐氏距離。
     */
    public static double deltaE76(Lab lab1, Lab lab2) {
        double dl = lab1.l() - lab2.l();
        double da = lab1.a() - lab2.a();
        double db = lab1.b() - lab2.b();
        return Math.sqrt(dl * dl + da * da + db * db);
    }

    /**
     * CIEDE2000 色差 (kL = kC = kH = 1)。
     */
    public static double deltaE2000(Lab lab1, Lab lab2) {
        double l1 = lab1.l(), a1 = lab1.a(), b1 = lab1.b();
        double l2 = lab2.l(), a2 = lab2.a(), b2 = lab2.b();

        double deltaL = l2 - l1;
        double lBar = (l1 + l2) / 2;

        double c1 = Math.hypot(a1, b1);
        double c2 = Math.hypot(a2, b2);
        double cBar = (c1 + c2) / 2;
        double cBar7 = Math.pow(cBar, 7);
        double g = 0.5 * (1 - Math.sqrt(cBar7 / (cBar7 + POW25_7)));

        double a1Prime = a1 * (1 + g);
        double a2Prime = a2 * (1 + g);
        double c1Prime = Math.hypot(a1Prime, b1);
        double c2Prime = Math.hypot(a2Prime, b2);
        double cBarPrime = (c1Prime + c2Prime) / 2;
        double deltaCPrime = c2Prime - c1Prime;

        double h1Prime = hueAngle(b1, a1Prime);
        double h2Prime = hueAngle(b2, a2Prime);

        double deltaHPrime;
        if (c1Prime * c2Prime == 0) {
            deltaHPrime = 0;
        } else if (Math.abs(h2Prime - h1Prime) <= 180) {
            deltaHPrime = h2Prime - h1Prime;
        } else if (h2Prime - h1Prime > 180) {
            deltaHPrime = h2Prime - h1Prime - 360;
        } else {
            deltaHPrime = h2Prime - h1Prime + 360;
        }
        double deltaH = 2 * Math.sqrt(c1Prime * c2Prime) * Math.sin(Math.toRadians(deltaHPrime / 2));

        double hBarPrime;
        if (c1Prime * c2Prime == 0) {
            hBarPrime = h1Prime + h2Prime;
        } else if (Math.abs(h1Prime - h2Prime) <= 180) {
            hBarPrime = (h1Prime + h2Prime) / 2;
        } else if (h1Prime + h2Prime < 360) {
            hBarPrime = (h1Prime + h2Prime + 360) / 2;
        } else {
            hBarPrime = (h1Prime + h2Prime - 360) / 2;
        }

        double t = 1
                - 0.17 * Math.cos(Math.toRadians(hBarPrime - 30))
                + 0.24 * Math.cos(Math.toRadians(2 * hBarPrime))
                + 0.32 * Math.cos(Math.toRadians(3 * hBarPrime + 6))
                - 0.20 * Math.cos(Math.toRadians(4 * hBarPrime - 63));

        double deltaTheta = 30 * Math.exp(-Math.pow((hBarPrime - 275) / 25, 2));
        double cBarPrime7 = Math.pow(cBarPrime, 7);
        double rc = 2 * Math.sqrt(cBarPrime7 / (cBarPrime7 + POW25_7));
        double lBarMinus50Sq = (lBar - 50) * (lBar - 50);
        double sl = 1 + (0.015 * lBarMinus50Sq) / Math.sqrt(20 + lBarMinus50Sq);
        double sc = 1 + 0.045 * cBarPrime;
        double sh = 1 + 0.015 * cBarPrime * t;
        double rt = -Math.sin(Math.toRadians(2 * deltaTheta)) * rc;

        double lTerm = deltaL / sl;
        double cTerm = deltaCPrime / sc;
        double hTerm = deltaH / sh;
        return Math.sqrt(lTerm * lTerm + cTerm * cTerm + hTerm * hTerm + rt * cTerm * hTerm);
    }

    /**
     * 以預設權重 (2:4:3) 計算的 RGB 加權歐氏距離。
     */
    public static double weightedRgbDistance(Rgb rgb1, Rgb rgb2) {
        return weightedRgbDistance(rgb1, rgb2, RgbWeights.DEFAULT);
    }

    public static double weightedRgbDistance(Rgb rgb1, Rgb rgb2, RgbWeights weights) {
        double dr = rgb1.r() - rgb2.r();
        double dg = rgb1.g() - rgb2.g();
        double db = rgb1.b() - rgb2.b();
        return Math.sqrt(weights.red() * dr * dr + weights.green() * dg * dg + weights.blue() * db * db);
    }

    /**
     * 依指定的色差方式比較兩個色彩。
     */
    public static double distance(ColorSignature first, ColorSignature second, DistanceMetric metric) {
        return switch (metric) {
            case WEIGHTED_RGB -> weightedRgbDistance(first.rgb(), second.rgb());
            case CIE76 -> deltaE76(first.lab(), second.lab());
            case CIEDE2000 -> deltaE2000(first.lab(), second.lab());
        };
    }

    private static double linearize(double channel) {
        return channel > 0.04045 ? Math.pow((channel + 0.055) / 1.055, 2.4) : channel / 12.92;
    }

    private static double labF(double t) {
        return t > EPSILON ? Math.cbrt(t) : (KAPPA_SLOPE * t + 16.0 / 116.0);
    }

    private static double hueAngle(double b, double aPrime) {
        if (b == 0 && aPrime == 0) {
            return 0;
        }
        double degrees = Math.toDegrees(Math.atan2(b, aPrime));
        return degrees < 0 ? degrees + 360 : degrees;
    }
}
