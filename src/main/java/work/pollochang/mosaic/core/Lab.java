package work.pollochang.mosaic.core;

/**
 * CIE-L*a*b* 色彩 (或其快速近似)。
 */
public record Lab(double l, double a, double b) {
}
