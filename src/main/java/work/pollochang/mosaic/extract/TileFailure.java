package work.pollochang.mosaic.extract;

/**
 * 單張磁磚的失敗報告。
 *
 * @param tileId   磁磚識別碼
 * @param filename 原始檔名
 * @param outcome  失敗類型
 * @param reason   錯誤訊息
 */
public record TileFailure(String tileId, String filename, TileOutcome outcome, String reason) {}
