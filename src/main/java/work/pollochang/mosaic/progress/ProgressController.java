package work.pollochang.mosaic.progress;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.core.MosaicCancelledException;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 單次產生流程的進度與控制狀態機。
 *
 * <pre>
 * IDLE → RUNNING → {PAUSED ⇄ RUNNING} → {COMPLETED | CANCELLED | FAILED}
 * </pre>
 *
 * <p>暫停為協作式：各階段在固定檢查點呼叫 {@link #checkpoint()}，
 * 暫停期間檢查點會停在 {@link Condition} 上等待，而非輪詢。
 * 取消可從任何非終止狀態觸發，並會喚醒所有等待中的檢查點。
 *
 * <p>已經過時間不含暫停的時間；剩餘時間 = {@code elapsed / total * (100 - total)}，
 * 總進度為 0 時為 0。
 */
@Slf4j
public class ProgressController {

    private final ProgressListener listener;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    private RunState state = RunState.IDLE;
    private ProcessingStage stage = ProcessingStage.LOADING_SOURCE;
    private double stageProgress;
    private double totalProgress;
    private long startMillis;
    private long pausedAtMillis;
    private long pausedTotalMillis;

    public ProgressController(ProgressListener listener) {
        this(listener, Clock.systemUTC());
    }

    public ProgressController(ProgressListener listener, Clock clock) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * IDLE → RUNNING，重設計數並立即送出 0% 事件。
     *
     * @throws MosaicCancelledException 開始前就已被取消
     */
    public void start() {
        ProgressEvent event;
        lock.lock();
        try {
            if (state == RunState.CANCELLED) {
                throw new MosaicCancelledException();
            }
            if (state != RunState.IDLE) {
                throw new IllegalStateException("無法從 " + state + " 狀態開始");
            }
            state = RunState.RUNNING;
            stage = ProcessingStage.LOADING_SOURCE;
            stageProgress = 0;
            totalProgress = 0;
            startMillis = clock.millis();
            pausedAtMillis = 0;
            pausedTotalMillis = 0;
            event = snapshot();
        } finally {
            lock.unlock();
        }
        listener.onProgress(event);
    }

    public void enterStage(ProcessingStage next) {
        ProgressEvent event;
        lock.lock();
        try {
            stage = Objects.requireNonNull(next, "stage must not be null");
            stageProgress = 0;
            recompute();
            event = snapshot();
        } finally {
            lock.unlock();
        }
        log.debug("進入階段 {} (總進度 {}%)", next.id(), Math.round(event.totalProgress()));
        listener.onProgress(event);
    }

    /**
     * 更新目前階段的進度，超出 0~100 的值會被截斷。
     */
    public void updateStage(double percent) {
        ProgressEvent event;
        lock.lock();
        try {
            stageProgress = Math.max(0, Math.min(100, percent));
            recompute();
            event = snapshot();
        } finally {
            lock.unlock();
        }
        listener.onProgress(event);
    }

    /**
     * RUNNING → PAUSED。
     *
     * @return 狀態是否改變
     */
    public boolean pause() {
        lock.lock();
        try {
            if (state != RunState.RUNNING) {
                return false;
            }
            state = RunState.PAUSED;
            pausedAtMillis = clock.millis();
        } finally {
            lock.unlock();
        }
        log.info("處理已暫停");
        listener.onPaused();
        return true;
    }

    /**
     * PAUSED → RUNNING。
     *
     * @return 狀態是否改變
     */
    public boolean resume() {
        lock.lock();
        try {
            if (state != RunState.PAUSED) {
                return false;
            }
            pausedTotalMillis += clock.millis() - pausedAtMillis;
            pausedAtMillis = 0;
            state = RunState.RUNNING;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("處理已繼續");
        listener.onResumed();
        return true;
    }

    /**
     * 任何非終止狀態 → CANCELLED。
     *
     * @return 狀態是否改變
     */
    public boolean cancel() {
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            if (state == RunState.PAUSED) {
                pausedTotalMillis += clock.millis() - pausedAtMillis;
                pausedAtMillis = 0;
            }
            state = RunState.CANCELLED;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("已要求取消處理");
        return true;
    }

    /**
     * 協作式檢查點：已取消時拋出 {@link MosaicCancelledException}；暫停時阻塞直到繼續或取消。
     */
    public void checkpoint() {
        lock.lock();
        try {
            while (state == RunState.PAUSED) {
                stateChanged.await();
            }
            if (state == RunState.CANCELLED) {
                throw new MosaicCancelledException();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt(); // 恢復中斷狀態
            state = RunState.CANCELLED;
            stateChanged.signalAll();
            throw new MosaicCancelledException();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 進入 COMPLETED 並送出 100% 事件。
     *
     * @throws MosaicCancelledException 在最後一個檢查點之後才被取消
     */
    public void complete() {
        ProgressEvent event;
        lock.lock();
        try {
            if (state == RunState.CANCELLED) {
                throw new MosaicCancelledException();
            }
            if (state.isTerminal()) {
                throw new IllegalStateException("流程已結束: " + state);
            }
            stage = ProcessingStage.FINALIZING;
            stageProgress = 100;
            totalProgress = 100;
            state = RunState.COMPLETED;
            event = snapshot();
        } finally {
            lock.unlock();
        }
        listener.onProgress(event);
    }

    /**
     * 標記失敗，已處於終止狀態時不變。
     */
    public void fail() {
        lock.lock();
        try {
            if (!state.isTerminal()) {
                state = RunState.FAILED;
                stateChanged.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public RunState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelled() {
        return state() == RunState.CANCELLED;
    }

    public ProgressEvent current() {
        lock.lock();
        try {
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    private void recompute() {
        double computed = stage.completedWeightBefore() + stage.weight() * stageProgress / 100.0;
        // 總進度不倒退
        totalProgress = Math.min(100, Math.max(totalProgress, computed));
    }

    private ProgressEvent snapshot() {
        long elapsed = elapsedMillis();
        return new ProgressEvent(stage, stageProgress, totalProgress, elapsed, estimateRemaining(elapsed));
    }

    private long elapsedMillis() {
        if (state == RunState.IDLE) {
            return 0;
        }
        long now = state == RunState.PAUSED ? pausedAtMillis : clock.millis();
        return Math.max(0, now - startMillis - pausedTotalMillis);
    }

    private long estimateRemaining(long elapsed) {
        if (totalProgress <= 0) {
            return 0;
        }
        return Math.max(0, Math.round(elapsed / totalProgress * (100 - totalProgress)));
    }
}
