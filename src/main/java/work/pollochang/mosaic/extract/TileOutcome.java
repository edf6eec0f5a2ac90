package work.pollochang.mosaic.extract;

public enum TileOutcome {
    EXTRACTED("擷取成功"),
    FAILED_DECODE("像素資料無法解析"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    TileOutcome(String description) { this.description = description; }
    public String getDescription() { return description; }
}
