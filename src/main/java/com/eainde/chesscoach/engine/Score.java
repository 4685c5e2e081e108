package com.eainde.chesscoach.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Engine score from the point of view of the side to move: either centipawns or a
 * distance to mate (positive when the side to move mates, negative when it is mated).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Score(Integer centipawns, Integer mateIn) {

    /** Magnitude a forced mate saturates to; faster mates sit closer to it. */
    public static final int MATE_SCORE = 10_000;

    private static final int MAX_MATE_DISTANCE = 500;

    public Score {
        if ((centipawns == null) == (mateIn == null)) {
            throw new IllegalArgumentException("Score needs exactly one of centipawns or mateIn");
        }
    }

    public static Score centipawns(int cp) {
        return new Score(cp, null);
    }

    public static Score mate(int moves) {
        return new Score(null, moves);
    }

    @JsonIgnore
    public boolean isMate() {
        return mateIn != null;
    }

    /**
     * Centipawn value with mates mapped to {@code +/-(MATE_SCORE - distance)}. A mate of 0
     * means the side to move is already mated.
     */
    @JsonIgnore
    public int saturated() {
        if (mateIn == null) {
            return Math.max(-MATE_SCORE + MAX_MATE_DISTANCE, Math.min(MATE_SCORE - MAX_MATE_DISTANCE, centipawns));
        }
        if (mateIn == 0) {
            return -MATE_SCORE;
        }
        int distance = Math.min(Math.abs(mateIn), MAX_MATE_DISTANCE - 1);
        return Integer.signum(mateIn) * (MATE_SCORE - distance);
    }

    @Override
    public String toString() {
        return mateIn != null ? "mate " + mateIn : "cp " + centipawns;
    }
}
