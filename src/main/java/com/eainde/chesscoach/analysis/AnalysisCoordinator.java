package com.eainde.chesscoach.analysis;

import com.eainde.chesscoach.chess.Board;
import com.eainde.chesscoach.chess.Move;
import com.eainde.chesscoach.config.EngineProperties;
import com.eainde.chesscoach.engine.EngineEvaluation;
import com.eainde.chesscoach.engine.EngineOraclePool;
import com.eainde.chesscoach.engine.EngineUnavailableException;
import com.eainde.chesscoach.engine.Score;
import com.eainde.chesscoach.opening.OpeningClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Fans engine evaluations out over the {@link EngineOraclePool} and merges them into position
 * and move judgements.
 * <p>
 * Each {@link #analyzePosition} issues the objective and the human-like search side by side and
 * joins on both before returning. Failures cross the join as {@link Outcome} values, never as
 * exceptions: a failed objective search fails the call, a failed human-like search only degrades
 * it. The pool guarantees that no two searches overlap on one engine.
 */
@Slf4j
@Service
public class AnalysisCoordinator {

    private final EngineOraclePool pool;
    private final OpeningClassifier openingClassifier;
    private final EloDepthMapping depthMapping;
    private final int objectiveDepth;
    private final Executor executor;

    @Autowired
    public AnalysisCoordinator(EngineOraclePool pool,
                               OpeningClassifier openingClassifier,
                               EngineProperties engineProperties,
                               @Qualifier("analysisExecutor") Executor executor) {
        this(pool, openingClassifier, EloDepthMapping.from(engineProperties), engineProperties.objectiveDepth(), executor);
    }

    public AnalysisCoordinator(EngineOraclePool pool,
                               OpeningClassifier openingClassifier,
                               EloDepthMapping depthMapping,
                               int objectiveDepth,
                               Executor executor) {
        this.pool = pool;
        this.openingClassifier = openingClassifier;
        this.depthMapping = depthMapping;
        this.objectiveDepth = objectiveDepth;
        this.executor = executor;
    }

    /**
     * Evaluates {@code fen} objectively and at the depth a player of {@code userElo} would
     * roughly see.
     *
     * @throws com.eainde.chesscoach.chess.InvalidPositionException if {@code fen} is not a legal position
     * @throws EngineUnavailableException                           if the objective search fails
     */
    public PositionAnalysis analyzePosition(String fen, int userElo) {
        Board board = Board.fromFen(fen);
        int humanDepth = depthMapping.depthFor(userElo);

        CompletableFuture<Outcome> objective = evaluateAsync(board, objectiveDepth);
        CompletableFuture<Outcome> humanLike = evaluateAsync(board, humanDepth);
        CompletableFuture.allOf(objective, humanLike).join();

        return combine(board, humanDepth, objective.join(), humanLike.join());
    }

    /**
     * Analyses the position before {@code moveText} and evaluates the position after it, all three
     * searches concurrently, then classifies the move from the mover's point of view.
     *
     * @param moveText move in UCI or SAN
     * @throws com.eainde.chesscoach.chess.IllegalMoveException if the move is not legal in {@code fenBefore}
     */
    public MoveAnalysis analyzeMove(String fenBefore, String moveText, int userElo) {
        Board before = Board.fromFen(fenBefore);
        Move move = before.parseMove(moveText);
        String san = before.toSan(move);
        Board after = before.play(move);
        int humanDepth = depthMapping.depthFor(userElo);

        CompletableFuture<Outcome> objectiveBefore = evaluateAsync(before, objectiveDepth);
        CompletableFuture<Outcome> humanLikeBefore = evaluateAsync(before, humanDepth);
        CompletableFuture<Outcome> objectiveAfter = evaluateAsync(after, objectiveDepth);
        CompletableFuture.allOf(objectiveBefore, humanLikeBefore, objectiveAfter).join();

        PositionAnalysis beforeAnalysis = combine(before, humanDepth, objectiveBefore.join(), humanLikeBefore.join());
        EngineEvaluation afterEvaluation = objectiveAfter.join().orThrow("objective evaluation after " + san);

        EngineEvaluation baseline = beforeAnalysis.objective();
        String bestMove = baseline.bestMove();
        return new MoveAnalysis(
                move.toUci(),
                san,
                beforeAnalysis,
                afterEvaluation,
                classifyMove(baseline, afterEvaluation),
                MoveClassifier.centipawnLoss(baseline, afterEvaluation),
                bestMove,
                move.toUci().equals(bestMove));
    }

    /**
     * Pure classification of a move from the evaluations of the positions before and after it.
     *
     * @see MoveClassifier
     */
    public MoveClassification classifyMove(EngineEvaluation before, EngineEvaluation after) {
        return MoveClassifier.classify(before, after);
    }

    private PositionAnalysis combine(Board board, int humanDepth, Outcome objective, Outcome humanLike) {
        EngineEvaluation objectiveEval = objective.orThrow("objective evaluation of " + board.toFen());
        EngineEvaluation humanLikeEval = humanLike.value();
        if (humanLike.failed()) {
            log.warn("Human-like evaluation at depth {} failed for {}, continuing with objective only: {}",
                    humanDepth, board.toFen(), humanLike.failure().getMessage());
        }
        return new PositionAnalysis(
                board.toFen(),
                objectiveEval,
                humanLikeEval,
                humanDepth,
                openingClassifier.positionType(board),
                PositionFeatures.extract(board),
                null);
    }

    private CompletableFuture<Outcome> evaluateAsync(Board board, int depth) {
        if (board.isCheckmate() || board.isStalemate()) {
            return CompletableFuture.completedFuture(Outcome.success(terminalEvaluation(board, depth)));
        }
        String fen = board.toFen();
        return CompletableFuture
                .supplyAsync(() -> pool.evaluate(fen, depth), executor)
                .handle((value, failure) -> failure == null ? Outcome.success(value) : Outcome.failure(unwrap(failure)));
    }

    /** Game-over positions need no search: mated is mate 0, stalemate is a dead draw. */
    private static EngineEvaluation terminalEvaluation(Board board, int depth) {
        Score score = board.isCheckmate() ? Score.mate(0) : Score.centipawns(0);
        return new EngineEvaluation(score, depth, List.of(), board.sideToMove());
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /** Result of one search, carried across the join as a value. */
    record Outcome(EngineEvaluation value, Throwable failure) {

        static Outcome success(EngineEvaluation value) {
            return new Outcome(value, null);
        }

        static Outcome failure(Throwable failure) {
            return new Outcome(null, failure);
        }

        boolean failed() {
            return failure != null;
        }

        EngineEvaluation orThrow(String what) {
            if (failure == null) {
                return value;
            }
            if (failure instanceof EngineUnavailableException engineFailure) {
                throw engineFailure;
            }
            throw new EngineUnavailableException(what + " failed: " + failure.getMessage(), failure);
        }
    }
}
