package work.pollochang.mosaic.cache;

/**
 * 快取鍵：同一張磁磚在不同繪製尺寸下各自快取。
 *
 * @param tileId     磁磚識別碼
 * @param renderSize 繪製邊長 (px)
 */
public record TileCacheKey(String tileId, int renderSize) {}
