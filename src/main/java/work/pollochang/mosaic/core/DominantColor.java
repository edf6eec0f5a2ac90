package work.pollochang.mosaic.core;

/**
 * 主色。
 *
 * @param rgb    量化後的色彩 (每分量為 32 的倍數)
 * @param weight 佔計入像素的比例 (0.0 ~ 1.0)
 */
public record DominantColor(Rgb rgb, double weight) {
}
