package com.eainde.chesscoach.analysis;

import com.eainde.chesscoach.chess.Color;
import com.eainde.chesscoach.engine.EngineEvaluation;

/**
 * Pure move-quality judgement from two evaluations.
 * <p>
 * {@code before} is the evaluation of the position the mover faced, {@code after} the evaluation
 * of the position their move produced. Both are normalised to the mover (the side to move in
 * {@code before}), so {@code delta = after - before} is positive when the move improved the
 * mover's standing. Mates saturate to {@link com.eainde.chesscoach.engine.Score#MATE_SCORE}.
 */
public final class MoveClassifier {

    private MoveClassifier() {
    }

    public static int delta(EngineEvaluation before, EngineEvaluation after) {
        Color mover = before.sideToMove();
        return after.centipawnsFor(mover) - before.centipawnsFor(mover);
    }

    /** Centipawns the move gave away, never negative. */
    public static int centipawnLoss(EngineEvaluation before, EngineEvaluation after) {
        return Math.max(0, -delta(before, after));
    }

    public static MoveClassification classify(EngineEvaluation before, EngineEvaluation after) {
        return classifyDelta(delta(before, after));
    }

    public static MoveClassification classifyDelta(int delta) {
        return MoveClassification.forLoss(Math.max(0, -delta));
    }
}
