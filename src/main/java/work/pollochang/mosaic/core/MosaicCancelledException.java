package work.pollochang.mosaic.core;

/**
 * 流程被取消。與失敗不同，不會產生結果也不會回報錯誤。
 */
public class MosaicCancelledException extends MosaicException {

    public MosaicCancelledException() {
        super("處理已取消");
    }
}
