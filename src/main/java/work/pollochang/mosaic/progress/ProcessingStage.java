package work.pollochang.mosaic.progress;

/**
 * 產生流程的各階段與其在總進度中的權重 (合計 100)。
 * <p>
 * {@link #id()} 為穩定識別字串，介面層自行翻譯成顯示文字。
 */
public enum ProcessingStage {
    LOADING_SOURCE("loading-source", 10),
    LOADING_TILES("loading-tiles", 20),
    ANALYZING_COLORS("analyzing-colors", 15),
    BUILDING_INDEX("building-index", 10),
    GENERATING_MOSAIC("generating-mosaic", 40),
    OPTIMIZING("optimizing", 3),
    FINALIZING("finalizing", 2);

    private final String id;
    private final int weight;

    ProcessingStage(String id, int weight) {
        this.id = id;
        this.weight = weight;
    }

    public String id() { return id; }
    public int weight() { return weight; }

    /**
     * 排在此階段之前的所有階段權重總和。
     */
    public int completedWeightBefore() {
        int sum = 0;
        for (ProcessingStage stage : values()) {
            if (stage == this) {
                break;
            }
            sum += stage.weight;
        }
        return sum;
    }
}
