package com.eainde.chesscoach.analysis;

import com.eainde.chesscoach.engine.EngineEvaluation;
import com.eainde.chesscoach.opening.PositionType;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Combined view of one position: the user-independent evaluation, the estimate at the user's
 * strength and static features.
 *
 * @param humanLike      evaluation at the ELO-derived depth; {@code null} if that search failed
 * @param humanLikeDepth depth the human-like search was asked for
 * @param classification always {@code null} here; moves are classified by
 *                       {@link AnalysisCoordinator#analyzeMove}
 */
public record PositionAnalysis(
        String fen,
        EngineEvaluation objective,
        @JsonProperty("human_like") EngineEvaluation humanLike,
        @JsonProperty("human_like_depth") int humanLikeDepth,
        @JsonProperty("position_type") PositionType positionType,
        @JsonProperty("key_features") PositionFeatures keyFeatures,
        MoveClassification classification
) {

    @JsonProperty("degraded")
    public boolean degraded() {
        return humanLike == null;
    }
}
