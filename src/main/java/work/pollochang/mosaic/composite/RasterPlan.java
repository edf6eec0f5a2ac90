package work.pollochang.mosaic.composite;

/**
 * 輸出畫布的尺寸規劃。
 *
 * @param gridSize          每邊格數
 * @param requestedTileSize 呼叫端要求的磁磚邊長
 * @param tileSize          實際使用的磁磚邊長
 * @param adjusted          是否因畫布上限而縮小
 */
public record RasterPlan(int gridSize, int requestedTileSize, int tileSize, boolean adjusted) {

    public int width() {
        return gridSize * tileSize;
    }

    public int height() {
        return gridSize * tileSize;
    }
}
