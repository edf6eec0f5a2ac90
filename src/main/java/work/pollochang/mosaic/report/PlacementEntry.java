package work.pollochang.mosaic.report;

import work.pollochang.mosaic.composite.PlacedTile;
import work.pollochang.mosaic.core.Rgb;

/**
 * 報告中的一格，不含像素資料。
 */
public record PlacementEntry(int x, int y, String tileId, String filename, Rgb averageColor) {

    public static PlacementEntry of(PlacedTile placed) {
        return new PlacementEntry(placed.x(), placed.y(), placed.tileId(), placed.filename(), placed.averageColor());
    }
}
