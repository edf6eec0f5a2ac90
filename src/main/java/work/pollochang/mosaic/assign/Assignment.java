package work.pollochang.mosaic.assign;

import java.util.List;

/**
 * @param placements   依列優先排列的放置結果
 * @param placementMap 格子對照
 * @param usage        使用次數
 * @param relaxedCells 因鄰近限制找不到候選而放寬限制的格子數
 */
public record Assignment(List<Placement> placements, PlacementMap placementMap, UsageCounter usage, int relaxedCells) {

    public Assignment {
        placements = List.copyOf(placements);
    }
}
