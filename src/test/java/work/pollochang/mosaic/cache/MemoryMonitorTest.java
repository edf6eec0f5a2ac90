package work.pollochang.mosaic.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryMonitorTest {

    @Test
    void testStatus_ShouldFollowThresholds() {
        assertEquals(MemoryStatus.NORMAL, new MemoryMonitor(() -> 50, () -> 100).status());
        assertEquals(MemoryStatus.NORMAL, new MemoryMonitor(() -> 80, () -> 100).status());
        assertEquals(MemoryStatus.WARNING, new MemoryMonitor(() -> 85, () -> 100).status());
        assertEquals(MemoryStatus.CRITICAL, new MemoryMonitor(() -> 95, () -> 100).status());
    }

    /**
     * 無法取得上限時視為沒有壓力
     */
    @Test
    void testUsageRatio_UnknownMax_ShouldBeZero() {
        assertEquals(0.0, new MemoryMonitor(() -> 95, () -> Long.MAX_VALUE).usageRatio(), 1e-9);
    }
}
