package work.pollochang.mosaic.core;

import java.util.Objects;

/**
 * 呼叫端提供的一張磁磚圖片。
 *
 * @param id       同一來源檔案穩定不變的識別碼
 * @param filename 原始檔名，僅用於報告與日誌
 * @param source   像素來源
 */
public record TileInput(String id, String filename, PixelSource source) {

    public TileInput {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (filename == null) {
            filename = id;
        }
    }
}
