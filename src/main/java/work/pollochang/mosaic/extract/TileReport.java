package work.pollochang.mosaic.extract;

import work.pollochang.mosaic.core.TileRecord;

/**
 * 單張磁磚的處理結果：成功時帶 record，失敗時帶 failure。
 */
public record TileReport(TileOutcome outcome, TileRecord record, TileFailure failure) {

    public static TileReport success(TileRecord record) {
        return new TileReport(TileOutcome.EXTRACTED, record, null);
    }

    public static TileReport failure(TileFailure failure) {
        return new TileReport(failure.outcome(), null, failure);
    }

    public boolean isSuccess() {
        return outcome == TileOutcome.EXTRACTED;
    }
}
