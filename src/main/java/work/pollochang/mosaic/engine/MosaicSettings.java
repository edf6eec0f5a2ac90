package work.pollochang.mosaic.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import work.pollochang.mosaic.cache.TileCache;
import work.pollochang.mosaic.color.DistanceMetric;
import work.pollochang.mosaic.color.LabConversion;
import work.pollochang.mosaic.composite.Compositor;
import work.pollochang.mosaic.extract.MetadataExtractor;

/**
 * 單次產生流程的設定。可由 JSON 預設檔讀入 (Jackson)，或以 builder 建立。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class MosaicSettings {

    public static final int MAX_CONCURRENCY = MetadataExtractor.MAX_CONCURRENCY;

    @Builder.Default
    int gridSize = 50;

    @Builder.Default
    int tileSize = 32;

    @Builder.Default
    Quality quality = Quality.MEDIUM;

    @Builder.Default
    ColorMatching colorMatching = ColorMatching.LAB;

    @Builder.Default
    NeighborDiversity neighborDiversity = NeighborDiversity.ENABLED;

    /** 亂數種子，null 表示每次不同。 */
    Long seed;

    /** 每批處理的磁磚數，用於控制同時駐留的像素資料量。 */
    @Builder.Default
    int batchSize = 30;

    /** 批次內的並行數。 */
    @Builder.Default
    int concurrency = Math.min(MAX_CONCURRENCY, Math.max(1, Runtime.getRuntime().availableProcessors()));

    /** 每放置幾格送出一次預覽，0 表示不送。 */
    @Builder.Default
    int previewInterval = 100;

    @Builder.Default
    int previewMaxDimension = 512;

    @Builder.Default
    int cacheMaxEntries = TileCache.DEFAULT_MAX_ENTRIES;

    @Builder.Default
    long cacheMaxBytes = TileCache.DEFAULT_MAX_BYTES;

    /** 同分候選中參與隨機挑選的比例，null 表示依鄰近多樣性使用預設值。 */
    Double tieBreakShare;

    @JsonIgnore
    public boolean isDiversityEnabled() {
        return neighborDiversity == NeighborDiversity.ENABLED;
    }

    @JsonIgnore
    public DistanceMetric getDistanceMetric() {
        if (colorMatching == ColorMatching.RGB) {
            return DistanceMetric.WEIGHTED_RGB;
        }
        return quality == Quality.HIGH ? DistanceMetric.CIEDE2000 : DistanceMetric.CIE76;
    }

    @JsonIgnore
    public LabConversion getLabConversion() {
        return quality == Quality.LOW ? LabConversion.FAST : LabConversion.PRECISE;
    }

    /**
     * 檢查設定值，不合法時拋出 {@link IllegalArgumentException}。
     */
    public MosaicSettings validate() {
        require(gridSize >= 1, "gridSize 必須 >= 1: " + gridSize);
        require(gridSize <= Compositor.DEFAULT_MAX_RASTER_DIMENSION, "gridSize 超過上限: " + gridSize);
        require(tileSize >= 1, "tileSize 必須 >= 1: " + tileSize);
        require(quality != null, "quality 不可為 null");
        require(colorMatching != null, "colorMatching 不可為 null");
        require(neighborDiversity != null, "neighborDiversity 不可為 null");
        require(batchSize >= 1, "batchSize 必須 >= 1: " + batchSize);
        require(concurrency >= 1, "concurrency 必須 >= 1: " + concurrency);
        require(previewInterval >= 0, "previewInterval 必須 >= 0: " + previewInterval);
        require(previewMaxDimension >= 1, "previewMaxDimension 必須 >= 1: " + previewMaxDimension);
        require(cacheMaxEntries >= 1, "cacheMaxEntries 必須 >= 1: " + cacheMaxEntries);
        require(cacheMaxBytes >= 1, "cacheMaxBytes 必須 >= 1: " + cacheMaxBytes);
        require(tieBreakShare == null || (tieBreakShare >= 0 && tieBreakShare <= 1),
                "tieBreakShare 必須介於 0 與 1: " + tieBreakShare);
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
