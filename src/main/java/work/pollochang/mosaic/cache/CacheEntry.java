package work.pollochang.mosaic.cache;

import java.awt.image.BufferedImage;

/**
 * 快取中的一筆資料。
 *
 * @param key               快取鍵
 * @param surface           已縮放完成、可直接繪製的磁磚
 * @param estimatedByteSize 估計佔用記憶體 (bytes)
 */
public record CacheEntry(TileCacheKey key, BufferedImage surface, long estimatedByteSize) {}
