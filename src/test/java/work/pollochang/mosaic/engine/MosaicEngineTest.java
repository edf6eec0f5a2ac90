package work.pollochang.mosaic.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import work.pollochang.mosaic.composite.MosaicResult;
import work.pollochang.mosaic.composite.PlacedTile;
import work.pollochang.mosaic.core.EngineFaultException;
import work.pollochang.mosaic.core.MosaicCancelledException;
import work.pollochang.mosaic.core.MosaicException;
import work.pollochang.mosaic.core.PixelBuffer;
import work.pollochang.mosaic.core.PixelSource;
import work.pollochang.mosaic.core.Rgb;
import work.pollochang.mosaic.core.TileInput;
import work.pollochang.mosaic.extract.TileFailure;
import work.pollochang.mosaic.progress.ProcessingStage;
import work.pollochang.mosaic.progress.ProgressEvent;
import work.pollochang.mosaic.progress.RunState;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MosaicEngineTest {

    /**
     * 建立四個象限各為不同顏色的測試圖片
     */
    private BufferedImage createTestImage(int size) {
        BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = image.createGraphics();
        int half = size / 2;
        g2d.setColor(Color.RED);
        g2d.fillRect(0, 0, half, half);
        g2d.setColor(Color.GREEN);
        g2d.fillRect(half, 0, half, half);
        g2d.setColor(Color.BLUE);
        g2d.fillRect(0, half, half, half);
        g2d.setColor(Color.WHITE);
        g2d.fillRect(half, half, half, half);
        g2d.dispose();
        return image;
    }

    private BufferedImage createSolidImage(int size, Color color) {
        BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = image.createGraphics();
        g2d.setColor(color);
        g2d.fillRect(0, 0, size, size);
        g2d.dispose();
        return image;
    }

    private List<TileInput> colorTiles() {
        List<TileInput> tiles = new ArrayList<>();
        Color[] colors = {Color.RED, Color.GREEN, Color.BLUE, Color.WHITE, Color.BLACK, Color.YELLOW};
        for (int i = 0; i < colors.length; i++) {
            tiles.add(new TileInput("tile-" + i, "tile-" + i + ".png", PixelSource.ofImage(createSolidImage(16, colors[i]))));
        }
        return tiles;
    }

    private TileInput transparentTile() {
        return new TileInput("clear", "clear.png", PixelSource.ofBuffer(new PixelBuffer(4, 4, new byte[64])));
    }

    private MosaicSettings.MosaicSettingsBuilder smallSettings() {
        return MosaicSettings.builder()
                .gridSize(4)
                .tileSize(8)
                .seed(42L)
                .batchSize(2)
                .concurrency(2)
                .previewInterval(4);
    }

    @Test
    void testGenerate_ShouldCompleteWithResultAndEvents() {
        RecordingListener listener = new RecordingListener();

        MosaicResult result = new MosaicEngine().generate(PixelSource.ofImage(createTestImage(32)),
                smallSettings().build(), colorTiles(), listener);

        assertEquals(32, result.width());
        assertEquals(32, result.height());
        assertEquals(4, result.gridInfo().gridSize());
        assertEquals(8, result.gridInfo().tileSize());
        assertEquals(16, result.tileCount());
        assertEquals(16, result.usage().values().stream().mapToInt(Integer::intValue).sum());
        assertTrue(result.failures().isEmpty());
        assertNotNull(result.colorAnalysis());

        assertEquals(4, listener.previews.size());
        assertEquals(16, listener.previews.get(3).placedCells());
        assertEquals(1, listener.completed.get());
        assertEquals(0, listener.cancelled.get());
        assertEquals(0, listener.errors.size());

        double previous = -1;
        for (ProgressEvent event : listener.events) {
            assertTrue(event.totalProgress() >= previous, "總進度不可倒退");
            previous = event.totalProgress();
        }
        assertEquals(100.0, previous, 1e-9);
    }

    /**
     * 左上角格子為紅色來源，應放上紅色磁磚
     */
    @Test
    void testGenerate_ShouldMatchClosestColors() {
        MosaicResult result = new MosaicEngine().generate(PixelSource.ofImage(createTestImage(32)),
                smallSettings().neighborDiversity(NeighborDiversity.DISABLED).tieBreakShare(0.0).build(), colorTiles(), null);

        assertEquals("tile-0", result.placements().get(0).tileId());
        Rgb topLeft = Rgb.fromArgb(result.raster().getRGB(4, 4));
        assertTrue(topLeft.r() > 200 && topLeft.g() < 30 && topLeft.b() < 30, "topLeft = " + topLeft);
    }

    @Test
    void testGenerate_InvalidTile_ShouldBeReportedNotFatal() {
        RecordingListener listener = new RecordingListener();
        List<TileInput> tiles = new ArrayList<>(colorTiles());
        tiles.add(1, transparentTile());

        MosaicResult result = new MosaicEngine().generate(PixelSource.ofImage(createTestImage(32)),
                smallSettings().build(), tiles, listener);

        assertEquals(1, result.failures().size());
        assertEquals("clear", result.failures().get(0).tileId());
        assertEquals(1, listener.tileFailures.size());
        assertFalse(result.usage().containsKey("clear"));
    }

    @Test
    void testGenerate_AllTilesInvalid_ShouldFailWithEngineFault() {
        RecordingListener listener = new RecordingListener();

        assertThrows(EngineFaultException.class, () -> new MosaicEngine().generate(
                PixelSource.ofImage(createTestImage(32)), smallSettings().build(), List.of(transparentTile()), listener));

        assertEquals(1, listener.errors.size());
        assertEquals(0, listener.completed.get());
    }

    @Test
    void testGenerate_InvalidSource_ShouldFailWithEngineFault() {
        RecordingListener listener = new RecordingListener();

        assertThrows(EngineFaultException.class, () -> new MosaicEngine().generate(
                PixelSource.ofRgba(2, 2, new byte[5]), smallSettings().build(), colorTiles(), listener));
        assertEquals(1, listener.errors.size());
    }

    @Test
    void testStart_InvalidSettings_ShouldThrowImmediately() {
        MosaicSettings settings = smallSettings().gridSize(0).build();
        assertThrows(IllegalArgumentException.class, () -> new MosaicEngine().start(
                PixelSource.ofImage(createTestImage(32)), settings, colorTiles(), null));
    }

    @Test
    void testGenerate_HighQuality_ShouldEnhanceContrast() {
        Color gray = new Color(100, 100, 100);
        List<TileInput> tiles = List.of(new TileInput("gray", "gray.png", PixelSource.ofImage(createSolidImage(16, gray))));
        PixelSource source = PixelSource.ofImage(createSolidImage(32, gray));

        MosaicResult medium = new MosaicEngine().generate(source, smallSettings().build(), tiles, null);
        MosaicResult high = new MosaicEngine().generate(source, smallSettings().quality(Quality.HIGH).build(), tiles, null);

        assertEquals(100, Rgb.fromArgb(medium.raster().getRGB(4, 4)).g());
        assertEquals(110, Rgb.fromArgb(high.raster().getRGB(4, 4)).g());
    }

    @Test
    @Timeout(30)
    void testStart_Cancel_ShouldEndWithCancelled() throws Exception {
        AtomicReference<MosaicRun> runRef = new AtomicReference<>();
        CountDownLatch runReady = new CountDownLatch(1);
        AtomicBoolean cancelRequested = new AtomicBoolean();
        RecordingListener listener = new RecordingListener() {
            @Override
            public void onProgress(ProgressEvent event) {
                super.onProgress(event);
                if (event.stage() == ProcessingStage.LOADING_TILES && cancelRequested.compareAndSet(false, true)) {
                    awaitQuietly(runReady);
                    runRef.get().cancel();
                }
            }
        };

        MosaicRun run = new MosaicEngine().start(PixelSource.ofImage(createTestImage(32)),
                smallSettings().build(), colorTiles(), listener);
        runRef.set(run);
        runReady.countDown();

        assertThrows(MosaicCancelledException.class, run::await);
        assertEquals(RunState.CANCELLED, run.state());
        assertEquals(1, listener.cancelled.get());
        assertEquals(0, listener.completed.get());
        assertEquals(0, listener.errors.size());
        assertTrue(run.future().isCompletedExceptionally());
    }

    /**
     * 相同 seed 應得到相同的放置結果
     */
    @Test
    void testGenerate_SameSeed_ShouldReproducePlacements() {
        PixelSource source = PixelSource.ofImage(createTestImage(32));

        MosaicResult first = new MosaicEngine().generate(source, smallSettings().seed(7L).build(), colorTiles(), null);
        MosaicResult second = new MosaicEngine().generate(source, smallSettings().seed(7L).build(), colorTiles(), null);

        assertEquals(tileIds(first), tileIds(second));
        assertEquals(first.usage(), second.usage());
    }

    /**
     * 繪製途中取消，應在下一個格子的檢查點停止
     */
    @Test
    @Timeout(30)
    void testStart_CancelWhileGenerating_ShouldStopAtNextCell() throws Exception {
        AtomicReference<MosaicRun> runRef = new AtomicReference<>();
        CountDownLatch runReady = new CountDownLatch(1);
        AtomicBoolean cancelRequested = new AtomicBoolean();
        double cancelAt = 100.0 * 5 / 16;
        RecordingListener listener = new RecordingListener() {
            @Override
            public void onProgress(ProgressEvent event) {
                super.onProgress(event);
                if (event.stage() == ProcessingStage.GENERATING_MOSAIC && event.stageProgress() >= cancelAt
                        && cancelRequested.compareAndSet(false, true)) {
                    awaitQuietly(runReady);
                    runRef.get().cancel();
                }
            }
        };

        MosaicRun run = new MosaicEngine().start(PixelSource.ofImage(createTestImage(32)),
                smallSettings().build(), colorTiles(), listener);
        runRef.set(run);
        runReady.countDown();

        assertThrows(MosaicCancelledException.class, run::await);
        assertEquals(RunState.CANCELLED, run.state());
        assertEquals(1, listener.cancelled.get());
        assertEquals(0, listener.completed.get());

        double maxGenerating = 0;
        for (ProgressEvent event : listener.events) {
            assertNotEquals(ProcessingStage.OPTIMIZING, event.stage());
            if (event.stage() == ProcessingStage.GENERATING_MOSAIC) {
                maxGenerating = Math.max(maxGenerating, event.stageProgress());
            }
        }
        assertEquals(cancelAt, maxGenerating, 1e-9);
        assertEquals(1, listener.previews.size());
    }

    @Test
    @Timeout(30)
    void testStart_PauseResume_ShouldComplete() throws Exception {
        AtomicReference<MosaicRun> runRef = new AtomicReference<>();
        CountDownLatch runReady = new CountDownLatch(1);
        CountDownLatch pausedLatch = new CountDownLatch(1);
        AtomicBoolean pauseRequested = new AtomicBoolean();
        RecordingListener listener = new RecordingListener() {
            @Override
            public void onProgress(ProgressEvent event) {
                super.onProgress(event);
                if (event.stage() == ProcessingStage.ANALYZING_COLORS && pauseRequested.compareAndSet(false, true)) {
                    awaitQuietly(runReady);
                    runRef.get().pause();
                    pausedLatch.countDown();
                }
            }
        };

        MosaicRun run = new MosaicEngine().start(PixelSource.ofImage(createTestImage(32)),
                smallSettings().build(), colorTiles(), listener);
        runRef.set(run);
        runReady.countDown();

        assertTrue(pausedLatch.await(10, TimeUnit.SECONDS));
        assertEquals(RunState.PAUSED, run.state());
        assertTrue(run.resume());

        MosaicResult result = run.await();
        assertEquals(16, result.tileCount());
        assertEquals(RunState.COMPLETED, run.state());
        assertEquals(1, listener.paused.get());
        assertEquals(1, listener.resumed.get());
        assertEquals(1, listener.completed.get());
    }

    private static List<String> tileIds(MosaicResult result) {
        List<String> ids = new ArrayList<>();
        for (PlacedTile placed : result.placements()) {
            ids.add(placed.tileId());
        }
        return ids;
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static class RecordingListener implements MosaicListener {
        final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
        final List<PreviewEvent> previews = new CopyOnWriteArrayList<>();
        final List<TileFailure> tileFailures = new CopyOnWriteArrayList<>();
        final List<MosaicException> errors = new CopyOnWriteArrayList<>();
        final AtomicInteger completed = new AtomicInteger();
        final AtomicInteger cancelled = new AtomicInteger();
        final AtomicInteger paused = new AtomicInteger();
        final AtomicInteger resumed = new AtomicInteger();

        @Override
        public void onProgress(ProgressEvent event) {
            events.add(event);
        }

        @Override
        public void onPreview(PreviewEvent event) {
            previews.add(event);
        }

        @Override
        public void onTileFailed(TileFailure failure) {
            tileFailures.add(failure);
        }

        @Override
        public void onCompleted(MosaicResult result) {
            completed.incrementAndGet();
        }

        @Override
        public void onCancelled() {
            cancelled.incrementAndGet();
        }

        @Override
        public void onError(MosaicException error) {
            errors.add(error);
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
}
