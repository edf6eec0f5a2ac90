package work.pollochang.mosaic.cache;

import java.util.function.LongSupplier;

/**
 * 以 JVM 堆積使用率判斷記憶體壓力：超過 80% 為 WARNING，超過 90% 為 CRITICAL。
 */
public class MemoryMonitor {

    public static final double WARNING_THRESHOLD = 0.8;
    public static final double CRITICAL_THRESHOLD = 0.9;

    private final LongSupplier usedBytes;
    private final LongSupplier maxBytes;

    public MemoryMonitor() {
        this(() -> {
            Runtime runtime = Runtime.getRuntime();
            return runtime.totalMemory() - runtime.freeMemory();
        }, () -> Runtime.getRuntime().maxMemory());
    }

    public MemoryMonitor(LongSupplier usedBytes, LongSupplier maxBytes) {
        this.usedBytes = usedBytes;
        this.maxBytes = maxBytes;
    }

    public double usageRatio() {
        long max = maxBytes.getAsLong();
        if (max <= 0 || max == Long.MAX_VALUE) {
            return 0.0;
        }
        return (double) usedBytes.getAsLong() / max;
    }

    public MemoryStatus status() {
        double ratio = usageRatio();
        if (ratio > CRITICAL_THRESHOLD) {
            return MemoryStatus.CRITICAL;
        }
        if (ratio > WARNING_THRESHOLD) {
            return MemoryStatus.WARNING;
        }
        return MemoryStatus.NORMAL;
    }
}
