package work.pollochang.mosaic.engine;

/**
 * 品質等級：LOW 使用快速 Lab 近似，HIGH 使用 CIEDE2000 並做最終對比強化。
 */
public enum Quality {
    LOW,
    MEDIUM,
    HIGH
}
