package work.pollochang.mosaic.assign;

/**
 * 一個格子的放置結果。
 *
 * @param x      網格欄
 * @param y      網格列
 * @param tileId 放置的磁磚
 */
public record Placement(int x, int y, String tileId) {}
