package work.pollochang.mosaic.assign;

import work.pollochang.mosaic.core.TileRecord;

/**
 * 每放置一格後呼叫，用於繪製、進度回報、預覽與取消檢查。
 */
@FunctionalInterface
public interface CellPlacedCallback {

    CellPlacedCallback NONE = (placement, tile, placedCount, totalCells) -> {};

    void onPlaced(Placement placement, TileRecord tile, int placedCount, int totalCells);
}
