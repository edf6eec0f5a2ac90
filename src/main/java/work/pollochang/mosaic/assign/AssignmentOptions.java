package work.pollochang.mosaic.assign;

import work.pollochang.mosaic.color.DistanceMetric;

import java.util.Objects;

/**
 * @param metric            色差計算方式
 * @param neighborDiversity 是否避免上下左右相鄰使用同一張磁磚
 * @param tieBreakShare     同使用次數候選中參與隨機挑選的前段比例，null 使用預設值
 */
public record AssignmentOptions(DistanceMetric metric, boolean neighborDiversity, Double tieBreakShare) {

    public static final double DIVERSE_TIE_BREAK_SHARE = 0.4;
    public static final double PLAIN_TIE_BREAK_SHARE = 0.3;

    public AssignmentOptions {
        Objects.requireNonNull(metric, "metric must not be null");
        if (tieBreakShare != null && (tieBreakShare < 0 || tieBreakShare > 1)) {
            throw new IllegalArgumentException("tieBreakShare 必須介於 0 與 1: " + tieBreakShare);
        }
    }

    /**
     * @param constrained 此格是否套用了鄰近限制 (放寬限制的格子視為未套用)
     */
    public double effectiveTieBreakShare(boolean constrained) {
        if (tieBreakShare != null) {
            return tieBreakShare;
        }
        return constrained ? DIVERSE_TIE_BREAK_SHARE : PLAIN_TIE_BREAK_SHARE;
    }
}
