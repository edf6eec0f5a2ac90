package work.pollochang.mosaic.cache;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.tools.FileTools;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static work.pollochang.mosaic.tools.CacheTools.estimateByteSize;

/**
 * 已繪製磁磚的 LRU 快取，同時限制筆數與估計記憶體用量。
 *
 * <p>每次 {@link #get(TileCacheKey)} 命中都會更新使用順序；
 * {@link #put(TileCacheKey, BufferedImage)} 會從最久未使用的項目開始淘汰，
 * 直到 {@code currentBytes + incoming <= maxBytes} 且 {@code size < maxEntries} 同時成立。
 *
 * <p>淘汰的簿記在並行寫入下並不安全，因此所有方法皆以 {@code synchronized} 序列化。
 * 快取只存在於單一行程中，不做任何持久化。
 */
@Slf4j
public class TileCache {

    public static final int DEFAULT_MAX_ENTRIES = 100;
    public static final long DEFAULT_MAX_BYTES = 64L * 1024 * 1024;

    private static final double PRESSURE_THRESHOLD = 0.8;
    private static final double PRESSURE_EVICT_RATIO = 0.3;

    private final int maxEntries;
    private final long maxBytes;
    // accessOrder = true：迭代順序即為 LRU 順序 (最舊在前)
    private final LinkedHashMap<TileCacheKey, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);

    private long currentBytes;
    private long hits;
    private long misses;
    private long evictions;

    public TileCache() {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_MAX_BYTES);
    }

    public TileCache(int maxEntries, long maxBytes) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
    }

    /**
     * @return 命中時的磁磚，未命中為 null
     */
    public synchronized BufferedImage get(TileCacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return null;
        }
        hits++;
        return entry.surface();
    }

    /**
     * 存入快取。單筆大小超過整體位元組上限時不存入。
     *
     * @return 是否已存入
     */
    public synchronized boolean put(TileCacheKey key, BufferedImage surface) {
        long incoming = estimateByteSize(surface);
        if (incoming > maxBytes) {
            log.warn("{} - 單筆大小 {} 超過快取上限 {}，不存入快取", key, FileTools.formatFileSize(incoming), FileTools.formatFileSize(maxBytes));
            return false;
        }

        CacheEntry previous = entries.remove(key);
        if (previous != null) {
            currentBytes -= previous.estimatedByteSize();
        }

        while (!entries.isEmpty() && (currentBytes + incoming > maxBytes || entries.size() >= maxEntries)) {
            evictEldest();
        }

        entries.put(key, new CacheEntry(key, surface, incoming));
        currentBytes += incoming;
        return true;
    }

    /**
     * 檢查是否存在，不影響 LRU 順序。
     */
    public synchronized boolean contains(TileCacheKey key) {
        return entries.containsKey(key);
    }

    public synchronized boolean remove(TileCacheKey key) {
        CacheEntry removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        currentBytes -= removed.estimatedByteSize();
        return true;
    }

    public synchronized void clear() {
        entries.clear();
        currentBytes = 0;
    }

    /**
     * 記憶體壓力處理：筆數超過上限的 80% 時，淘汰最舊的 30%。
     *
     * @return 被淘汰的筆數
     */
    public synchronized int relievePressure() {
        if (entries.size() <= maxEntries * PRESSURE_THRESHOLD) {
            return 0;
        }
        int toEvict = (int) Math.floor(maxEntries * PRESSURE_EVICT_RATIO);
        int evicted = 0;
        while (evicted < toEvict && !entries.isEmpty()) {
            evictEldest();
            evicted++;
        }
        log.debug("記憶體壓力處理：淘汰 {} 筆快取，剩餘 {} 筆", evicted, entries.size());
        return evicted;
    }

    /**
     * @return 由最久未使用到最近使用的鍵
     */
    public synchronized List<TileCacheKey> keysInAccessOrder() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long currentBytes() {
        return currentBytes;
    }

    public synchronized CacheStats stats() {
        return new CacheStats(entries.size(), maxEntries, currentBytes, maxBytes, hits, misses, evictions);
    }

    private void evictEldest() {
        Iterator<Map.Entry<TileCacheKey, CacheEntry>> it = entries.entrySet().iterator();
        Map.Entry<TileCacheKey, CacheEntry> eldest = it.next();
        it.remove();
        currentBytes -= eldest.getValue().estimatedByteSize();
        evictions++;
    }
}
