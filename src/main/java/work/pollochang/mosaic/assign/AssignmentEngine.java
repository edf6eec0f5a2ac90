package work.pollochang.mosaic.assign;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.color.ColorMath;
import work.pollochang.mosaic.core.EngineFaultException;
import work.pollochang.mosaic.core.SourceCell;
import work.pollochang.mosaic.core.TileRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * 依列優先順序為每個格子挑選磁磚。
 *
 * <p>每格的挑選規則：
 * <ol>
 *   <li>使用上限 {@code maxUsage = max(1, ceil(格子數 / 磁磚數)) + ceil(磁磚數 / 20)}。</li>
 *   <li>啟用鄰近多樣性時，排除上下左右已放置的磁磚；排除後沒有候選則放寬該格限制。</li>
 *   <li>候選依色差排序，取使用次數未達上限的前 10 名；全部達上限時改取使用次數最少的前 10 名。</li>
 *   <li>其中使用次數最少者若不只一個，取色差最小的前 {@code ceil(n * share)} 個隨機挑選。</li>
 * </ol>
 */
@Slf4j
public class AssignmentEngine {

    static final int CANDIDATE_LIMIT = 10;
    private static final int[][] NEIGHBOR_OFFSETS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};

    private final AssignmentOptions options;
    private final Random random;

    public AssignmentEngine(AssignmentOptions options, Random random) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * @param cells    依列優先排列的格子，數量須為 gridSize²
     * @param gridSize 每邊格數
     * @param palette  磁磚索引
     * @param callback 每放置一格後呼叫
     * @throws EngineFaultException 沒有任何磁磚可用
     */
    public Assignment assign(List<SourceCell> cells, int gridSize, TilePalette palette, CellPlacedCallback callback) {
        Objects.requireNonNull(cells, "cells must not be null");
        Objects.requireNonNull(palette, "palette must not be null");
        if (cells.size() != gridSize * gridSize) {
            throw new IllegalArgumentException("格子數 " + cells.size() + " 與網格 " + gridSize + "x" + gridSize + " 不符");
        }
        if (palette.isEmpty()) {
            throw new EngineFaultException("沒有任何磁磚可供分配");
        }

        int totalCells = cells.size();
        int tileCount = palette.size();
        int maxUsage = maxUsage(totalCells, tileCount);

        if (options.neighborDiversity()) {
            log.info("開始分配磁磚 (啟用鄰近多樣性)，格子數 {}，磁磚數 {}，使用上限 {}", totalCells, tileCount, maxUsage);
        } else {
            log.info("開始分配磁磚，格子數 {}，磁磚數 {}，使用上限 {}", totalCells, tileCount, maxUsage);
        }

        PlacementMap placementMap = new PlacementMap(gridSize);
        UsageCounter usage = new UsageCounter();
        List<Placement> placements = new ArrayList<>(totalCells);
        int relaxed = 0;

        for (SourceCell cell : cells) {
            Set<String> excluded = options.neighborDiversity()
                    ? neighborTiles(cell.x(), cell.y(), placementMap)
                    : Set.of();

            List<Candidate> candidates = rankCandidates(cell, palette, usage, excluded);
            boolean constrained = options.neighborDiversity();
            if (candidates.isEmpty()) {
                relaxed++;
                constrained = false;
                log.warn("({}, {}) - 鄰近限制下沒有候選磁磚，放寬限制", cell.x(), cell.y());
                candidates = rankCandidates(cell, palette, usage, Set.of());
            }

            TileRecord chosen = select(candidates, maxUsage, options.effectiveTieBreakShare(constrained));

            Placement placement = new Placement(cell.x(), cell.y(), chosen.id());
            placementMap.place(cell.x(), cell.y(), chosen.id());
            usage.increment(chosen.id());
            placements.add(placement);

            if (callback != null) {
                callback.onPlaced(placement, chosen, placements.size(), totalCells);
            }
        }

        if (options.neighborDiversity()) {
            log.info("鄰近多樣性結果: 相鄰重複 {} / 總格數 {}，放寬限制 {} 格",
                    countAdjacentDuplicates(placementMap, gridSize), totalCells, relaxed);
        }
        log.info("磁磚分配完成，使用 {} / {} 張磁磚", usage.distinctTiles(), tileCount);
        return new Assignment(placements, placementMap, usage, relaxed);
    }

    public static int maxUsage(int totalCells, int tileCount) {
        int base = Math.max(1, (int) Math.ceil((double) totalCells / tileCount));
        return base + (int) Math.ceil(tileCount / 20.0);
    }

    /**
     * 右方或下方與自己相同的格子數 (每格最多計一次)。
     */
    public static int countAdjacentDuplicates(PlacementMap map, int gridSize) {
        int duplicates = 0;
        for (int y = 0; y < gridSize; y++) {
            for (int x = 0; x < gridSize; x++) {
                String current = map.get(x, y);
                if (current == null) {
                    continue;
                }
                if (current.equals(map.get(x + 1, y)) || current.equals(map.get(x, y + 1))) {
                    duplicates++;
                }
            }
        }
        return duplicates;
    }

    private TileRecord select(List<Candidate> candidates, int maxUsage, double share) {
        List<Candidate> pool = new ArrayList<>(CANDIDATE_LIMIT);
        for (Candidate candidate : candidates) {
            if (candidate.usage < maxUsage) {
                pool.add(candidate);
                if (pool.size() == CANDIDATE_LIMIT) {
                    break;
                }
            }
        }
        if (pool.isEmpty()) {
            int globalMin = minUsage(candidates);
            for (Candidate candidate : candidates) {
                if (candidate.usage == globalMin) {
                    pool.add(candidate);
                    if (pool.size() == CANDIDATE_LIMIT) {
                        break;
                    }
                }
            }
        }

        int minUsage = minUsage(pool);
        List<Candidate> leastUsed = new ArrayList<>();
        for (Candidate candidate : pool) {
            if (candidate.usage == minUsage) {
                leastUsed.add(candidate);
            }
        }
        if (leastUsed.size() == 1) {
            return leastUsed.get(0).tile;
        }
        // pool 已依色差排序，leastUsed 保持同樣順序
        int top = Math.max(1, (int) Math.ceil(leastUsed.size() * share));
        return leastUsed.get(random.nextInt(Math.min(top, leastUsed.size()))).tile;
    }

    private List<Candidate> rankCandidates(SourceCell cell, TilePalette palette, UsageCounter usage, Set<String> excluded) {
        List<Candidate> candidates = new ArrayList<>(palette.size());
        for (TileRecord tile : palette.tiles()) {
            if (excluded.contains(tile.id())) {
                continue;
            }
            double distance = ColorMath.distance(cell, tile, options.metric());
            candidates.add(new Candidate(tile, distance, usage.get(tile.id())));
        }
        // List.sort 為穩定排序，同色差時維持輸入順序
        candidates.sort(Comparator.comparingDouble(c -> c.distance));
        return candidates;
    }

    private static Set<String> neighborTiles(int x, int y, PlacementMap map) {
        Set<String> neighbors = new HashSet<>();
        for (int[] offset : NEIGHBOR_OFFSETS) {
            String tileId = map.get(x + offset[0], y + offset[1]);
            if (tileId != null) {
                neighbors.add(tileId);
            }
        }
        return neighbors;
    }

    private static int minUsage(List<Candidate> candidates) {
        int min = Integer.MAX_VALUE;
        for (Candidate candidate : candidates) {
            min = Math.min(min, candidate.usage);
        }
        return min;
    }

    private static final class Candidate {
        private final TileRecord tile;
        private final double distance;
        private final int usage;

        private Candidate(TileRecord tile, double distance, int usage) {
            this.tile = tile;
            this.distance = distance;
            this.usage = usage;
        }
    }
}
