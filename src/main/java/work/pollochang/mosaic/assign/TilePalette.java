package work.pollochang.mosaic.assign;

import work.pollochang.mosaic.core.TileRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 分配時使用的磁磚索引：保留輸入順序 (作為同色差時的排序依據)，並可依識別碼查詢。
 * 識別碼重複時只保留第一張。
 */
public class TilePalette {

    private final List<TileRecord> tiles;
    private final Map<String, TileRecord> byId;

    private TilePalette(Map<String, TileRecord> byId) {
        this.byId = Collections.unmodifiableMap(byId);
        this.tiles = List.copyOf(byId.values());
    }

    public static TilePalette build(List<TileRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        Map<String, TileRecord> byId = new LinkedHashMap<>();
        for (TileRecord record : records) {
            byId.putIfAbsent(record.id(), record);
        }
        return new TilePalette(byId);
    }

    public List<TileRecord> tiles() {
        return tiles;
    }

    public TileRecord get(String tileId) {
        return byId.get(tileId);
    }

    public Map<String, TileRecord> asMap() {
        return byId;
    }

    public int size() {
        return tiles.size();
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }
}
