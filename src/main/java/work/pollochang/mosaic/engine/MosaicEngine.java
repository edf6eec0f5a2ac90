package work.pollochang.mosaic.engine;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.assign.Assignment;
import work.pollochang.mosaic.assign.AssignmentEngine;
import work.pollochang.mosaic.assign.AssignmentOptions;
import work.pollochang.mosaic.assign.CellPlacedCallback;
import work.pollochang.mosaic.assign.Placement;
import work.pollochang.mosaic.assign.TilePalette;
import work.pollochang.mosaic.cache.CacheStats;
import work.pollochang.mosaic.cache.MemoryMonitor;
import work.pollochang.mosaic.color.ColorAnalysis;
import work.pollochang.mosaic.color.ColorAnalyzer;
import work.pollochang.mosaic.color.SourceAnalyzer;
import work.pollochang.mosaic.composite.Compositor;
import work.pollochang.mosaic.composite.GridInfo;
import work.pollochang.mosaic.composite.MosaicResult;
import work.pollochang.mosaic.composite.PlacedTile;
import work.pollochang.mosaic.composite.RasterOptimizer;
import work.pollochang.mosaic.composite.RasterPlan;
import work.pollochang.mosaic.core.EngineFaultException;
import work.pollochang.mosaic.core.MosaicCancelledException;
import work.pollochang.mosaic.core.MosaicException;
import work.pollochang.mosaic.core.PixelBuffer;
import work.pollochang.mosaic.core.PixelSource;
import work.pollochang.mosaic.core.SourceCell;
import work.pollochang.mosaic.core.TileInput;
import work.pollochang.mosaic.core.TileRecord;
import work.pollochang.mosaic.extract.ExtractionResult;
import work.pollochang.mosaic.extract.MetadataExtractor;
import work.pollochang.mosaic.progress.ProcessingStage;
import work.pollochang.mosaic.progress.ProgressController;
import work.pollochang.mosaic.tools.FileTools;
import work.pollochang.mosaic.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 馬賽克產生流程的進入點。
 *
 * <p>每次流程依序經過：
 * <pre>
 * loading-source → loading-tiles → analyzing-colors → building-index
 *   → generating-mosaic → optimizing → finalizing
 * </pre>
 * 並保證恰好送出一個終止事件 (完成、取消或錯誤)。流程結束時一律清空磁磚快取。
 */
@Slf4j
public class MosaicEngine {

    private static final AtomicInteger RUN_SEQUENCE = new AtomicInteger();

    private final Clock clock;
    private final MemoryMonitor memoryMonitor;

    public MosaicEngine() {
        this(Clock.systemUTC(), new MemoryMonitor());
    }

    public MosaicEngine(Clock clock, MemoryMonitor memoryMonitor) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.memoryMonitor = Objects.requireNonNull(memoryMonitor, "memoryMonitor must not be null");
    }

    /**
     * 在專屬的背景執行緒上開始一次流程。
     *
     * @throws IllegalArgumentException 設定不合法 (同步拋出，不會開始流程)
     */
    public MosaicRun start(PixelSource source, MosaicSettings settings, List<TileInput> tiles, MosaicListener listener) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(tiles, "tiles must not be null");
        EngineContext context = new EngineContext(settings, listener, clock, memoryMonitor);

        String threadName = "mosaic-run-" + RUN_SEQUENCE.incrementAndGet();
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });

        CompletableFuture<MosaicResult> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                future.complete(execute(context, source, tiles));
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        });
        executor.shutdown();
        return new MosaicRun(context.getProgress(), future);
    }

    /**
     * 在呼叫端執行緒上同步執行一次流程。
     *
     * @throws MosaicCancelledException 流程被取消
     * @throws MosaicException          流程失敗
     */
    public MosaicResult generate(PixelSource source, MosaicSettings settings, List<TileInput> tiles, MosaicListener listener) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(tiles, "tiles must not be null");
        return execute(new EngineContext(settings, listener, clock, memoryMonitor), source, tiles);
    }

    MosaicResult execute(EngineContext context, PixelSource source, List<TileInput> tiles) {
        ProgressController progress = context.getProgress();
        MosaicListener listener = context.getListener();
        MosaicSettings settings = context.getSettings();
        long startMillis = clock.millis();

        MosaicResult result;
        try {
            log.info("開始產生馬賽克: 網格 {}x{}，磁磚 {}px，品質 {}，色彩比對 {}，鄰近多樣性 {}，磁磚數 {}",
                    settings.getGridSize(), settings.getGridSize(), settings.getTileSize(),
                    settings.getQuality(), settings.getColorMatching(), settings.getNeighborDiversity(), tiles.size());
            progress.start();
            result = runStages(context, source, tiles);
            progress.complete();
        } catch (MosaicCancelledException e) {
            progress.cancel();
            log.info("馬賽克產生已取消");
            listener.onCancelled();
            throw e;
        } catch (MosaicException e) {
            progress.fail();
            log.error("馬賽克產生失敗: {}", e.getMessage(), e);
            listener.onError(e);
            throw e;
        } catch (RuntimeException | OutOfMemoryError e) {
            progress.fail();
            EngineFaultException fault = new EngineFaultException("馬賽克產生時發生非預期錯誤: " + e.getMessage(), e);
            log.error("馬賽克產生失敗", e);
            listener.onError(fault);
            throw fault;
        } finally {
            CacheStats stats = context.getCache().stats();
            log.info("磁磚快取統計 -> 筆數: {}/{}, 記憶體: {}/{}, 命中率: {} %, 淘汰: {}",
                    stats.size(), stats.maxEntries(),
                    FileTools.formatFileSize(stats.currentBytes()), FileTools.formatFileSize(stats.maxBytes()),
                    Math.round(stats.hitRatio() * 100), stats.evictions());
            context.getCache().clear();
        }

        log.info("馬賽克產生完成: {}x{}，耗時 {}", result.width(), result.height(),
                FileTools.formatDuration(clock.millis() - startMillis));
        listener.onCompleted(result);
        return result;
    }

    private MosaicResult runStages(EngineContext context, PixelSource source, List<TileInput> tiles) {
        ProgressController progress = context.getProgress();
        MosaicSettings settings = context.getSettings();
        int gridSize = settings.getGridSize();

        // 1. 來源圖片
        progress.enterStage(ProcessingStage.LOADING_SOURCE);
        PixelBuffer sourcePixels = resolveSource(source);
        List<SourceCell> cells = SourceAnalyzer.analyze(sourcePixels, gridSize, context.getLabConversion(), progress);

        // 2. 磁磚中繼資料
        progress.enterStage(ProcessingStage.LOADING_TILES);
        MetadataExtractor extractor = new MetadataExtractor();
        extractor.setLabConversion(context.getLabConversion());
        extractor.setBatchSize(settings.getBatchSize());
        extractor.setConcurrency(settings.getConcurrency());
        extractor.setProgress(progress);
        extractor.setCache(context.getCache());
        extractor.setMemoryMonitor(context.getMemoryMonitor());
        extractor.setFailureListener(context.getListener()::onTileFailed);
        ExtractionResult extraction = extractor.extract(tiles);

        // 3. 色彩分析
        progress.enterStage(ProcessingStage.ANALYZING_COLORS);
        ColorAnalysis colorAnalysis = ColorAnalyzer.analyze(cells, extraction.records(),
                context.getDistanceMetric(), gridSize, progress);

        // 4. 磁磚索引
        progress.enterStage(ProcessingStage.BUILDING_INDEX);
        TilePalette palette = TilePalette.build(extraction.records());
        if (palette.size() < extraction.records().size()) {
            log.warn("有 {} 張磁磚識別碼重複，只保留第一張", extraction.records().size() - palette.size());
        }
        progress.updateStage(100);
        progress.checkpoint();

        // 5. 分配與繪製
        progress.enterStage(ProcessingStage.GENERATING_MOSAIC);
        Compositor compositor = new Compositor(context.getCache());
        RasterPlan plan = compositor.planRaster(gridSize, settings.getTileSize());
        BufferedImage canvas = compositor.newCanvas(plan);
        AssignmentOptions options = new AssignmentOptions(
                context.getDistanceMetric(), settings.isDiversityEnabled(), settings.getTieBreakShare());
        AssignmentEngine assignmentEngine = new AssignmentEngine(options, context.getRandom());
        Assignment assignment = assignmentEngine.assign(cells, gridSize, palette,
                drawingCallback(context, compositor, canvas, plan));

        // 6. 最佳化
        progress.enterStage(ProcessingStage.OPTIMIZING);
        if (settings.getQuality() == Quality.HIGH) {
            RasterOptimizer.enhance(canvas, RasterOptimizer.HIGH_QUALITY_FACTOR);
        }
        progress.updateStage(100);
        progress.checkpoint();

        // 7. 整理結果
        progress.enterStage(ProcessingStage.FINALIZING);
        List<PlacedTile> placed = new ArrayList<>(assignment.placements().size());
        for (Placement placement : assignment.placements()) {
            TileRecord tile = palette.get(placement.tileId());
            placed.add(new PlacedTile(placement.x(), placement.y(), tile.id(), tile.filename(),
                    tile.averageRgb(), tile.fullResPixels()));
        }
        MosaicResult result = new MosaicResult(canvas, new GridInfo(gridSize, plan.tileSize()), placed,
                assignment.usage().asMap(), extraction.failures(), colorAnalysis, extraction.statistics());
        progress.updateStage(100);
        return result;
    }

    private CellPlacedCallback drawingCallback(EngineContext context, Compositor compositor,
                                               BufferedImage canvas, RasterPlan plan) {
        ProgressController progress = context.getProgress();
        MosaicSettings settings = context.getSettings();
        int interval = settings.getPreviewInterval();
        return (placement, tile, placedCount, totalCells) -> {
            compositor.drawTile(canvas, tile, placement.x(), placement.y(), plan.tileSize());
            progress.updateStage(100.0 * placedCount / totalCells);
            if (interval > 0 && placedCount % interval == 0) {
                BufferedImage preview = preview(canvas, settings.getPreviewMaxDimension());
                context.getListener().onPreview(new PreviewEvent(preview, placedCount, totalCells, clock.millis()));
            }
            progress.checkpoint();
        };
    }

    private static BufferedImage preview(BufferedImage canvas, int maxDimension) {
        int longest = Math.max(canvas.getWidth(), canvas.getHeight());
        if (longest <= maxDimension) {
            return ImageTools.copyImage(canvas);
        }
        return ImageTools.resizeImage(canvas, (double) maxDimension / longest);
    }

    private static PixelBuffer resolveSource(PixelSource source) {
        try {
            PixelBuffer buffer = source.resolve();
            if (buffer == null) {
                throw new EngineFaultException("來源圖片沒有像素資料");
            }
            return buffer;
        } catch (IllegalArgumentException e) {
            throw new EngineFaultException("來源圖片無法解析: " + e.getMessage(), e);
        }
    }
}
