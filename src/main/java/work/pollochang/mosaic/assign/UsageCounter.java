package work.pollochang.mosaic.assign;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 單次分配中每張磁磚的使用次數，只增不減。
 */
public class UsageCounter {

    private final Map<String, Integer> counts = new LinkedHashMap<>();
    private int total;

    public int get(String tileId) {
        return counts.getOrDefault(tileId, 0);
    }

    public int increment(String tileId) {
        total++;
        return counts.merge(tileId, 1, Integer::sum);
    }

    /**
     * @return 所有使用次數的總和，等於已放置的格子數
     */
    public int total() {
        return total;
    }

    public int distinctTiles() {
        return counts.size();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }
}
