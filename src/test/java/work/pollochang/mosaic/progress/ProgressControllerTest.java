package work.pollochang.mosaic.progress;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.pollochang.mosaic.core.MosaicCancelledException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProgressControllerTest {

    private MutableClock clock;
    private RecordingListener listener;
    private ProgressController controller;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        listener = new RecordingListener();
        controller = new ProgressController(listener, clock);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testStageWeights_ShouldSumToHundred() {
        int sum = 0;
        for (ProcessingStage stage : ProcessingStage.values()) {
            sum += stage.weight();
        }
        assertEquals(100, sum);
        assertEquals(55, ProcessingStage.GENERATING_MOSAIC.completedWeightBefore());
        assertEquals(0, ProcessingStage.LOADING_SOURCE.completedWeightBefore());
    }

    @Test
    void testUpdateStage_ShouldWeightTotalProgress() {
        controller.start();
        controller.enterStage(ProcessingStage.LOADING_TILES);
        controller.updateStage(50);

        ProgressEvent event = controller.current();
        assertEquals("loading-tiles", event.stageId());
        assertEquals(50.0, event.stageProgress(), 1e-9);
        assertEquals(20.0, event.totalProgress(), 1e-9);
    }

    /**
     * 剩餘時間 = elapsed / total * (100 - total)
     */
    @Test
    void testRemainingTime_ShouldExtrapolateFromElapsed() {
        controller.start();
        controller.enterStage(ProcessingStage.GENERATING_MOSAIC);
        clock.advance(10_000);
        controller.updateStage(50);

        ProgressEvent event = controller.current();
        assertEquals(75.0, event.totalProgress(), 1e-9);
        assertEquals(10_000, event.elapsedMs());
        assertEquals(3333, event.remainingMs());
    }

    @Test
    void testRemainingTime_AtZeroProgress_ShouldBeZero() {
        controller.start();
        clock.advance(5000);
        assertEquals(0, controller.current().remainingMs());
    }

    /**
     * 暫停期間的時間不計入已經過時間
     */
    @Test
    void testElapsed_ShouldExcludePausedTime() {
        controller.start();
        clock.advance(1000);
        assertTrue(controller.pause());

        clock.advance(4000);
        assertEquals(1000, controller.current().elapsedMs());

        assertTrue(controller.resume());
        clock.advance(1000);
        assertEquals(2000, controller.current().elapsedMs());
    }

    @Test
    void testPauseResume_InvalidTransitions_ShouldReturnFalse() {
        assertFalse(controller.pause());
        controller.start();
        assertFalse(controller.resume());
        assertTrue(controller.pause());
        assertFalse(controller.pause());
        assertTrue(controller.resume());

        assertEquals(1, listener.paused.get());
        assertEquals(1, listener.resumed.get());
        assertEquals(RunState.RUNNING, controller.state());
    }

    @Test
    void testCheckpoint_WhilePausedThenCancelled_ShouldThrowCancelled() throws Exception {
        controller.start();
        controller.pause();
        Future<?> waiting = executor.submit(() -> controller.checkpoint());

        assertThrows(TimeoutException.class, () -> waiting.get(200, TimeUnit.MILLISECONDS));
        assertTrue(controller.cancel());

        ExecutionException thrown = assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
        assertInstanceOf(MosaicCancelledException.class, thrown.getCause());
        assertEquals(RunState.CANCELLED, controller.state());
    }

    @Test
    void testCheckpoint_WhilePausedThenResumed_ShouldReturn() throws Exception {
        controller.start();
        controller.pause();
        Future<?> waiting = executor.submit(() -> controller.checkpoint());

        assertThrows(TimeoutException.class, () -> waiting.get(200, TimeUnit.MILLISECONDS));
        controller.resume();

        assertDoesNotThrow(() -> waiting.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testTotalProgress_ShouldBeMonotonicAndClamped() {
        controller.start();
        controller.enterStage(ProcessingStage.ANALYZING_COLORS);
        controller.updateStage(150);
        assertEquals(100.0, controller.current().stageProgress(), 1e-9);
        controller.updateStage(-20);
        assertEquals(0.0, controller.current().stageProgress(), 1e-9);

        double previous = -1;
        for (ProgressEvent event : listener.events) {
            assertTrue(event.totalProgress() >= previous, "總進度不可倒退");
            previous = event.totalProgress();
        }
        assertEquals(45.0, controller.current().totalProgress(), 1e-9);
    }

    @Test
    void testComplete_ShouldEmitHundredPercent() {
        controller.start();
        controller.complete();

        ProgressEvent last = listener.events.get(listener.events.size() - 1);
        assertEquals(100.0, last.totalProgress(), 1e-9);
        assertEquals(RunState.COMPLETED, controller.state());
        assertFalse(controller.cancel());
    }

    /**
     * 最後一個檢查點之後才取消，仍應以取消結束
     */
    @Test
    void testComplete_AfterCancel_ShouldThrowCancelled() {
        controller.start();
        controller.cancel();
        assertThrows(MosaicCancelledException.class, () -> controller.complete());
    }

    @Test
    void testStart_Twice_ShouldThrow() {
        controller.start();
        assertThrows(IllegalStateException.class, () -> controller.start());
    }

    @Test
    void testStart_AfterCancel_ShouldThrowCancelled() {
        controller.cancel();
        assertThrows(MosaicCancelledException.class, () -> controller.start());
    }

    private static class RecordingListener implements ProgressListener {
        private final List<ProgressEvent> events = new ArrayList<>();
        private final AtomicInteger paused = new AtomicInteger();
        private final AtomicInteger resumed = new AtomicInteger();

        @Override
        public void onProgress(ProgressEvent event) {
            events.add(event);
        }

        @Override
        public void onPaused() {
            paused.incrementAndGet();
        }

        @Override
        public void onResumed() {
            resumed.incrementAndGet();
        }
    }

    private static class MutableClock extends Clock {
        private volatile long millis;

        void advance(long delta) {
            millis += delta;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
