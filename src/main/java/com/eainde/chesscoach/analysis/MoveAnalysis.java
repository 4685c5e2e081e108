package com.eainde.chesscoach.analysis;

import com.eainde.chesscoach.engine.EngineEvaluation;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param uci            the played move in UCI notation
 * @param san            the played move in SAN
 * @param before         analysis of the position the mover faced
 * @param after          objective evaluation of the resulting position
 * @param centipawnLoss  how much the move gave away from the mover's point of view
 * @param bestMove       the engine's preferred move in the original position, UCI
 * @param playedBestMove whether the played move equals {@code bestMove}
 */
public record MoveAnalysis(
        String uci,
        String san,
        PositionAnalysis before,
        EngineEvaluation after,
        MoveClassification classification,
        @JsonProperty("centipawn_loss") int centipawnLoss,
        @JsonProperty("best_move") String bestMove,
        @JsonProperty("played_best_move") boolean playedBestMove
) {
}
