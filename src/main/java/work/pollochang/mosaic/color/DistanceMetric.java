package work.pollochang.mosaic.color;

/**
 * 色差計算方式。
 */
public enum DistanceMetric {
    /** RGB 加權歐氏距離，最快。 */
    WEIGHTED_RGB,
    /** Lab 歐氏距離。 */
    CIE76,
    /** CIEDE2000，最準確也最慢。 */
    CIEDE2000
}
