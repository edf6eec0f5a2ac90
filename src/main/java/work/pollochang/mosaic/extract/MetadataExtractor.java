package work.pollochang.mosaic.extract;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.cache.MemoryMonitor;
import work.pollochang.mosaic.cache.MemoryStatus;
import work.pollochang.mosaic.cache.TileCache;
import work.pollochang.mosaic.color.LabConversion;
import work.pollochang.mosaic.core.EngineFaultException;
import work.pollochang.mosaic.core.MosaicCancelledException;
import work.pollochang.mosaic.core.TileInput;
import work.pollochang.mosaic.core.TileRecord;
import work.pollochang.mosaic.progress.ProgressController;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 進行批次擷取磁磚中繼資料
 *
 * <p>輸入依 {@link #setBatchSize(int)} 切成記憶體批次，每批交給固定大小的執行緒池並行處理，
 * 結果依輸入索引寫回，因此輸出順序與輸入相同。每批結束後：
 * <ul>
 *   <li>更新階段進度 (已完成 / 總數)。</li>
 *   <li>每兩批檢查一次記憶體壓力，WARNING 時釋放部分快取，CRITICAL 時清空快取。</li>
 *   <li>經過暫停/取消檢查點。</li>
 * </ul>
 */
@Getter
@Setter
@Slf4j
public class MetadataExtractor {

    public static final int DEFAULT_BATCH_SIZE = 30;
    public static final int MAX_CONCURRENCY = 12;
    private static final long BATCH_TIMEOUT_MINUTES = 30;

    private LabConversion labConversion = LabConversion.PRECISE;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private int concurrency = Math.min(MAX_CONCURRENCY, Math.max(1, Runtime.getRuntime().availableProcessors()));
    private ProgressController progress;
    private TileCache cache;
    private MemoryMonitor memoryMonitor;
    private Consumer<TileFailure> failureListener = failure -> {};

    /**
     * @param tiles 依順序排列的磁磚輸入
     * @return 成功的中繼資料 (輸入順序) 與失敗清單
     * @throws EngineFaultException    沒有任何磁磚可用
     * @throws MosaicCancelledException 處理途中被取消
     */
    public ExtractionResult extract(List<TileInput> tiles) {
        Objects.requireNonNull(tiles, "tiles must not be null");
        if (batchSize < 1 || concurrency < 1) {
            throw new IllegalArgumentException("batchSize 與 concurrency 必須 >= 1");
        }

        int total = tiles.size();
        TileReport[] reports = new TileReport[total];

        // 使用 EnumMap 和 AtomicLong 進行線程安全的計數
        Map<TileOutcome, AtomicLong> counters = new EnumMap<>(TileOutcome.class);
        for (TileOutcome outcome : TileOutcome.values()) {
            counters.put(outcome, new AtomicLong(0));
        }

        int poolSize = Math.max(1, Math.min(concurrency, Math.min(batchSize, Math.max(1, total))));
        log.info("開始擷取 {} 張磁磚，批次大小 {}，執行緒池大小 {}", total, batchSize, poolSize);

        int batchIndex = 0;
        for (int start = 0; start < total; start += batchSize) {
            int end = Math.min(total, start + batchSize);
            runBatch(tiles, start, end, poolSize, reports, counters);
            batchIndex++;

            log.debug("第 {} 批完成 ({} / {})", batchIndex, end, total);
            if (progress != null) {
                progress.updateStage(100.0 * end / total);
            }
            if (batchIndex % 2 == 0) {
                checkMemory();
            }
            if (progress != null) {
                progress.checkpoint();
            }
        }

        List<TileRecord> records = new ArrayList<>(total);
        List<TileFailure> failures = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            TileReport report = reports[i];
            if (report == null) {
                TileInput input = tiles.get(i);
                report = TileReport.failure(new TileFailure(input.id(), input.filename(), TileOutcome.FAILED_UNKNOWN, "沒有處理結果"));
            }
            if (report.isSuccess()) {
                records.add(report.record());
            } else {
                failures.add(report.failure());
                failureListener.accept(report.failure());
            }
        }

        log.info("磁磚擷取完成 -> 總計: {}, 成功: {}, 無法解析: {}, 記憶體溢位: {}, 未知錯誤: {}",
                total,
                counters.get(TileOutcome.EXTRACTED).get(),
                counters.get(TileOutcome.FAILED_DECODE).get(),
                counters.get(TileOutcome.FAILED_OUT_OF_MEMORY).get(),
                counters.get(TileOutcome.FAILED_UNKNOWN).get());

        if (records.isEmpty()) {
            throw new EngineFaultException("沒有任何可用的磁磚 (輸入 " + total + " 張，失敗 " + failures.size() + " 張)");
        }
        ExtractionResult result = new ExtractionResult(records, failures);
        TileStatistics statistics = result.statistics();
        log.info("磁磚池統計 -> 磁磚數: {}, 平均亮度: {}, 平均對比: {}",
                statistics.tileCount(),
                String.format("%.1f", statistics.averageBrightness()),
                String.format("%.1f", statistics.averageContrast()));
        return result;
    }

    private void runBatch(List<TileInput> tiles, int start, int end, int poolSize,
                          TileReport[] reports, Map<TileOutcome, AtomicLong> counters) {
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            for (int i = start; i < end; i++) {
                final int index = i;
                final TileInput input = tiles.get(i);
                executor.submit(() -> {
                    TileReport report = TileAnalyzer.processTile(input, labConversion);
                    reports[index] = report;
                    counters.get(report.outcome()).incrementAndGet();
                });
            }
            executor.shutdown();
            if (!executor.awaitTermination(BATCH_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                log.warn("執行緒池等待逾時，部分任務可能未完成。");
                executor.shutdownNow();
                throw new EngineFaultException("磁磚批次處理逾時 (" + start + " ~ " + end + ")");
            }
        } catch (InterruptedException e) {
            log.error("執行緒池被中斷。", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt(); // 恢復中斷狀態
            throw new MosaicCancelledException();
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }
    }

    private void checkMemory() {
        if (memoryMonitor == null || cache == null) {
            return;
        }
        MemoryStatus status = memoryMonitor.status();
        if (status == MemoryStatus.CRITICAL) {
            log.warn("記憶體使用率 {}%，清空磁磚快取", Math.round(memoryMonitor.usageRatio() * 100));
            cache.clear();
        } else if (status == MemoryStatus.WARNING) {
            int evicted = cache.relievePressure();
            log.info("記憶體使用率偏高，釋放 {} 筆快取", evicted);
        }
    }
}
