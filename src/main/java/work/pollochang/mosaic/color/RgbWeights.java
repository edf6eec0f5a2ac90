package work.pollochang.mosaic.color;

/**
 * RGB 色差的各通道權重。預設 2:4:3 為經驗值，近似人眼對亮度的敏感度。
 */
public record RgbWeights(double red, double green, double blue) {

    public static final RgbWeights DEFAULT = new RgbWeights(2, 4, 3);
}
