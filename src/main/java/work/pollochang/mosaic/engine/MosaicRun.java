package work.pollochang.mosaic.engine;

import work.pollochang.mosaic.composite.MosaicResult;
import work.pollochang.mosaic.core.EngineFaultException;
import work.pollochang.mosaic.core.MosaicCancelledException;
import work.pollochang.mosaic.core.MosaicException;
import work.pollochang.mosaic.progress.ProgressController;
import work.pollochang.mosaic.progress.RunState;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 背景執行中的一次產生流程。控制方法可由任何執行緒呼叫。
 */
public class MosaicRun {

    private final ProgressController progress;
    private final CompletableFuture<MosaicResult> future;

    MosaicRun(ProgressController progress, CompletableFuture<MosaicResult> future) {
        this.progress = progress;
        this.future = future;
    }

    /**
     * @return 是否由執行中轉為暫停
     */
    public boolean pause() {
        return progress.pause();
    }

    /**
     * @return 是否由暫停轉為執行中
     */
    public boolean resume() {
        return progress.resume();
    }

    /**
     * 要求取消，流程會在下一個檢查點結束。
     *
     * @return 是否由非終止狀態轉為取消
     */
    public boolean cancel() {
        return progress.cancel();
    }

    public RunState state() {
        return progress.state();
    }

    /**
     * 以 {@link MosaicCancelledException} 或其他 {@link MosaicException} 異常完成的 future。
     */
    public CompletableFuture<MosaicResult> future() {
        return future;
    }

    /**
     * 等待流程結束。
     *
     * @throws MosaicCancelledException 流程被取消
     * @throws MosaicException          流程失敗
     */
    public MosaicResult await() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt(); // 恢復中斷狀態
            throw new EngineFaultException("等待結果時被中斷", e);
        } catch (CancellationException e) {
            throw new MosaicCancelledException();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MosaicException) {
                throw (MosaicException) cause;
            }
            throw new EngineFaultException("產生流程發生非預期錯誤", cause);
        }
    }
}
