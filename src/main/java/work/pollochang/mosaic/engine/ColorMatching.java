package work.pollochang.mosaic.engine;

public enum ColorMatching {
    /** 加權 RGB 距離，速度優先。 */
    RGB,
    /** Lab 距離，感知準確度優先。 */
    LAB
}
