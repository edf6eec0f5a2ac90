package work.pollochang.mosaic.cache;

public enum MemoryStatus {
    NORMAL,
    WARNING,
    CRITICAL
}
