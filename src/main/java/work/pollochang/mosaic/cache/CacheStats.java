package work.pollochang.mosaic.cache;

/**
 * 快取統計快照。
 */
public record CacheStats(int size, int maxEntries, long currentBytes, long maxBytes,
                         long hits, long misses, long evictions) {

    public double memoryRatio() {
        return maxBytes == 0 ? 0.0 : (double) currentBytes / maxBytes;
    }

    public double hitRatio() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
