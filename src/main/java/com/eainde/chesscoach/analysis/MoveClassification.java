package com.eainde.chesscoach.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Move quality tiers, ordered from best to worst. Each tier covers centipawn losses up to and
 * including its ceiling; a loss exactly on a boundary falls into the better tier.
 */
public enum MoveClassification {
    BEST(10),
    GOOD(50),
    INACCURACY(100),
    MISTAKE(300),
    BLUNDER(Integer.MAX_VALUE);

    private final int maxCentipawnLoss;

    MoveClassification(int maxCentipawnLoss) {
        this.maxCentipawnLoss = maxCentipawnLoss;
    }

    public int maxCentipawnLoss() {
        return maxCentipawnLoss;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    /** Tier for a non-negative centipawn loss. */
    public static MoveClassification forLoss(int centipawnLoss) {
        int loss = Math.max(0, centipawnLoss);
        for (MoveClassification tier : values()) {
            if (loss <= tier.maxCentipawnLoss) {
                return tier;
            }
        }
        return BLUNDER;
    }
}
