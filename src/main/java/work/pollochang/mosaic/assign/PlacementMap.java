package work.pollochang.mosaic.assign;

import java.util.Objects;

/**
 * 格子座標到磁磚識別碼的對照，只能新增：同一格不可放置第二次。
 */
public class PlacementMap {

    private final int gridSize;
    private final String[] cells;
    private int placed;

    public PlacementMap(int gridSize) {
        if (gridSize < 1) {
            throw new IllegalArgumentException("gridSize must be positive: " + gridSize);
        }
        this.gridSize = gridSize;
        this.cells = new String[gridSize * gridSize];
    }

    /**
     * @throws IllegalStateException 該格已有磁磚
     */
    public void place(int x, int y, String tileId) {
        Objects.requireNonNull(tileId, "tileId must not be null");
        int index = indexOf(x, y);
        if (cells[index] != null) {
            throw new IllegalStateException("格子 (" + x + ", " + y + ") 已放置 " + cells[index]);
        }
        cells[index] = tileId;
        placed++;
    }

    /**
     * @return 該格的磁磚，尚未放置或超出網格時為 null
     */
    public String get(int x, int y) {
        if (x < 0 || y < 0 || x >= gridSize || y >= gridSize) {
            return null;
        }
        return cells[y * gridSize + x];
    }

    public int gridSize() {
        return gridSize;
    }

    public int placedCount() {
        return placed;
    }

    public boolean isComplete() {
        return placed == cells.length;
    }

    private int indexOf(int x, int y) {
        if (x < 0 || y < 0 || x >= gridSize || y >= gridSize) {
            throw new IndexOutOfBoundsException("格子 (" + x + ", " + y + ") 超出 " + gridSize + "x" + gridSize + " 網格");
        }
        return y * gridSize + x;
    }
}
