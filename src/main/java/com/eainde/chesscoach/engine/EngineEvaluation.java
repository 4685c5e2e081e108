package com.eainde.chesscoach.engine;

import com.eainde.chesscoach.chess.Color;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of one Engine Oracle search for one (fen, depth) pair. Immutable.
 *
 * @param score      score as reported by the engine, relative to {@code sideToMove}
 * @param depth      search depth the evaluation was produced at
 * @param bestLine   principal variation in UCI notation, possibly empty
 * @param sideToMove side to move in the evaluated position
 */
public record EngineEvaluation(
        Score score,
        int depth,
        @JsonProperty("best_line") List<String> bestLine,
        @JsonProperty("side_to_move") Color sideToMove
) {

    public EngineEvaluation {
        bestLine = bestLine == null ? List.of() : List.copyOf(bestLine);
    }

    /** Saturated centipawns from {@code perspective}'s point of view. */
    public int centipawnsFor(Color perspective) {
        int value = score.saturated();
        return perspective == sideToMove ? value : -value;
    }

    /** Saturated centipawns from White's point of view. */
    @JsonProperty("white_centipawns")
    public int whiteCentipawns() {
        return centipawnsFor(Color.WHITE);
    }

    @JsonProperty("best_move")
    public String bestMove() {
        return bestLine.isEmpty() ? null : bestLine.get(0);
    }
}
