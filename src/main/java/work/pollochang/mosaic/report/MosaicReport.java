package work.pollochang.mosaic.report;

import work.pollochang.mosaic.color.ColorAnalysis;
import work.pollochang.mosaic.composite.GridInfo;
import work.pollochang.mosaic.composite.MosaicResult;
import work.pollochang.mosaic.composite.PlacedTile;
import work.pollochang.mosaic.engine.MosaicSettings;
import work.pollochang.mosaic.extract.TileFailure;
import work.pollochang.mosaic.extract.TileStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 產生結果的中繼資料，輸出成 JSON 使用。
 *
 * @param settings      使用的設定
 * @param gridInfo      網格與實際磁磚尺寸
 * @param width         畫布寬度
 * @param height        畫布高度
 * @param tileCount     放置的格子數
 * @param distinctTiles 實際使用的不同磁磚數
 * @param usage         每張磁磚的使用次數
 * @param placements    放置結果
 * @param failures      擷取失敗的磁磚
 * @param colorAnalysis 色彩分析摘要
 * @param tileStatistics 磁磚池統計 (數量、平均亮度、平均對比)
 */
public record MosaicReport(
        MosaicSettings settings,
        GridInfo gridInfo,
        int width,
        int height,
        int tileCount,
        int distinctTiles,
        Map<String, Integer> usage,
        List<PlacementEntry> placements,
        List<TileFailure> failures,
        ColorAnalysis colorAnalysis,
        TileStatistics tileStatistics
) {

    public static MosaicReport of(MosaicResult result, MosaicSettings settings) {
        List<PlacementEntry> entries = new ArrayList<>(result.placements().size());
        for (PlacedTile placed : result.placements()) {
            entries.add(PlacementEntry.of(placed));
        }
        return new MosaicReport(
                settings,
                result.gridInfo(),
                result.width(),
                result.height(),
                result.tileCount(),
                result.usage().size(),
                result.usage(),
                entries,
                result.failures(),
                result.colorAnalysis(),
                result.tileStatistics()
        );
    }
}
