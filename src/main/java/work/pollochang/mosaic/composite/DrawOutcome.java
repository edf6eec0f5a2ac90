package work.pollochang.mosaic.composite;

public enum DrawOutcome {
    TILE("繪製磁磚"),
    AVERAGE_FILL("以平均色填滿"),
    MARKER_FILL("以標記色填滿");

    private final String description;
    DrawOutcome(String description) { this.description = description; }
    public String getDescription() { return description; }
}
