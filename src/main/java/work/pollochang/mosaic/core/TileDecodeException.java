package work.pollochang.mosaic.core;

import lombok.Getter;

/**
 * 單張磁磚無法解析或擷取中繼資料。只影響該磁磚，不中止批次。
 */
@Getter
public class TileDecodeException extends MosaicException {

    private final String tileId;

    public TileDecodeException(String tileId, String message) {
        super(tileId + " - " + message);
        this.tileId = tileId;
    }

    public TileDecodeException(String tileId, String message, Throwable cause) {
        super(tileId + " - " + message, cause);
        this.tileId = tileId;
    }
}
