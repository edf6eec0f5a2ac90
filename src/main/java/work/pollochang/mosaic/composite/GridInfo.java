package work.pollochang.mosaic.composite;

/**
 * @param gridSize 每邊格數
 * @param tileSize 實際繪製的磁磚邊長 (px)
 */
public record GridInfo(int gridSize, int tileSize) {}
