package com.eainde.chesscoach.analysis;

import com.eainde.chesscoach.config.EngineProperties;
import com.eainde.chesscoach.config.EngineProperties.DepthBreakpoint;

import java.util.Comparator;
import java.util.List;

/**
 * Deterministic, non-decreasing map from a player's rating to the depth of the human-like
 * search, clamped to {@code [minDepth, maxDepth]}.
 */
public class EloDepthMapping {

    private final List<DepthBreakpoint> breakpoints;
    private final int minDepth;
    private final int maxDepth;

    public EloDepthMapping(List<DepthBreakpoint> breakpoints, int minDepth, int maxDepth) {
        if (minDepth < 1 || maxDepth < minDepth) {
            throw new IllegalArgumentException("Depth range [" + minDepth + ", " + maxDepth + "] is invalid");
        }
        List<DepthBreakpoint> sorted = breakpoints.stream()
                .sorted(Comparator.comparingInt(DepthBreakpoint::elo))
                .toList();
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).depth() < sorted.get(i - 1).depth()) {
                throw new IllegalArgumentException("ELO breakpoints must not decrease in depth: "
                        + sorted.get(i - 1) + " then " + sorted.get(i));
            }
            if (sorted.get(i).elo() == sorted.get(i - 1).elo()) {
                throw new IllegalArgumentException("Duplicate ELO breakpoint " + sorted.get(i).elo());
            }
        }
        this.breakpoints = sorted;
        this.minDepth = minDepth;
        this.maxDepth = maxDepth;
    }

    public static EloDepthMapping from(EngineProperties properties) {
        return new EloDepthMapping(properties.eloToDepth(), properties.minDepth(), properties.maxDepth());
    }

    public int depthFor(int elo) {
        int depth = minDepth;
        for (DepthBreakpoint breakpoint : breakpoints) {
            if (elo >= breakpoint.elo()) {
                depth = breakpoint.depth();
            } else {
                break;
            }
        }
        return Math.max(minDepth, Math.min(maxDepth, depth));
    }

    public int minDepth() {
        return minDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
