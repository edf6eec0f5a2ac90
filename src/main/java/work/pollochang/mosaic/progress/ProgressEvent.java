package work.pollochang.mosaic.progress;

/**
 * 進度事件。
 *
 * @param stage         目前階段
 * @param stageProgress 階段內進度 0~100
 * @param totalProgress 依權重計算的總進度 0~100
 * @param elapsedMs     已經過時間 (不含暫停時間)
 * @param remainingMs   預估剩餘時間
 */
public record ProgressEvent(ProcessingStage stage, double stageProgress, double totalProgress,
                            long elapsedMs, long remainingMs) {

    public String stageId() {
        return stage.id();
    }
}
