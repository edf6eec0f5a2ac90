package work.pollochang.mosaic.composite;

import work.pollochang.mosaic.color.ColorAnalysis;
import work.pollochang.mosaic.extract.TileFailure;
import work.pollochang.mosaic.extract.TileStatistics;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 單次產生流程的結果。清單與對照表為不可修改的副本；
 * {@code raster} 為共用的畫布，呼叫端不應再繪製其上。
 *
 * @param raster        馬賽克畫布
 * @param gridInfo      網格與實際磁磚尺寸
 * @param placements    依列優先排列的放置結果
 * @param usage         每張磁磚的使用次數
 * @param failures      擷取失敗的磁磚
 * @param colorAnalysis 色彩分析摘要
 * @param tileStatistics 磁磚池的亮度與對比統計
 */
public record MosaicResult(
        BufferedImage raster,
        GridInfo gridInfo,
        List<PlacedTile> placements,
        Map<String, Integer> usage,
        List<TileFailure> failures,
        ColorAnalysis colorAnalysis,
        TileStatistics tileStatistics
) {

    public MosaicResult {
        Objects.requireNonNull(raster, "raster must not be null");
        Objects.requireNonNull(gridInfo, "gridInfo must not be null");
        placements = List.copyOf(placements);
        usage = Collections.unmodifiableMap(new LinkedHashMap<>(usage));
        failures = List.copyOf(failures);
        if (tileStatistics == null) {
            tileStatistics = TileStatistics.EMPTY;
        }
    }

    public int width() {
        return raster.getWidth();
    }

    public int height() {
        return raster.getHeight();
    }

    /**
     * @return 放置的格子數
     */
    public int tileCount() {
        return placements.size();
    }

    /**
     * 以新的畫布與網格資訊建立副本，其餘欄位共用。
     */
    public MosaicResult withRaster(BufferedImage newRaster, GridInfo newGridInfo) {
        return new MosaicResult(newRaster, newGridInfo, placements, usage, failures, colorAnalysis, tileStatistics);
    }
}
