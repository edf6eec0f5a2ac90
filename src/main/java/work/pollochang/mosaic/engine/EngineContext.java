package work.pollochang.mosaic.engine;

import lombok.Getter;
import work.pollochang.mosaic.cache.MemoryMonitor;
import work.pollochang.mosaic.cache.TileCache;
import work.pollochang.mosaic.color.DistanceMetric;
import work.pollochang.mosaic.color.LabConversion;
import work.pollochang.mosaic.progress.ProgressController;

import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * 單次流程擁有的所有可變狀態，依參考傳給各元件，不使用任何全域單例。
 */
@Getter
public class EngineContext {

    private final MosaicSettings settings;
    private final MosaicListener listener;
    private final ProgressController progress;
    private final TileCache cache;
    private final MemoryMonitor memoryMonitor;
    private final Random random;

    public EngineContext(MosaicSettings settings, MosaicListener listener, Clock clock, MemoryMonitor memoryMonitor) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null").validate();
        this.listener = listener != null ? listener : MosaicListener.NONE;
        this.progress = new ProgressController(this.listener, clock);
        this.cache = new TileCache(settings.getCacheMaxEntries(), settings.getCacheMaxBytes());
        this.memoryMonitor = Objects.requireNonNull(memoryMonitor, "memoryMonitor must not be null");
        this.random = settings.getSeed() != null ? new Random(settings.getSeed()) : new Random();
    }

    public DistanceMetric getDistanceMetric() {
        return settings.getDistanceMetric();
    }

    public LabConversion getLabConversion() {
        return settings.getLabConversion();
    }
}
