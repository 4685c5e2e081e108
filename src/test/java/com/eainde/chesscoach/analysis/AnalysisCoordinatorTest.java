package com.eainde.chesscoach.analysis;

import com.eainde.chesscoach.chess.Board;
import com.eainde.chesscoach.chess.Color;
import com.eainde.chesscoach.chess.IllegalMoveException;
import com.eainde.chesscoach.chess.InvalidPositionException;
import com.eainde.chesscoach.config.EngineProperties.DepthBreakpoint;
import com.eainde.chesscoach.engine.EngineEvaluation;
import com.eainde.chesscoach.engine.EngineOraclePool;
import com.eainde.chesscoach.engine.EngineUnavailableException;
import com.eainde.chesscoach.engine.Score;
import com.eainde.chesscoach.opening.OpeningClassifier;
import com.eainde.chesscoach.opening.PositionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisCoordinatorTest {

    private static final int OBJECTIVE_DEPTH = 20;
    private static final String AFTER_E4 = "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1";
    private static final String FOOLS_MATE = "rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3";

    private static final OpeningClassifier OPENINGS = new OpeningClassifier(new ObjectMapper());
    private static final EloDepthMapping DEPTHS = new EloDepthMapping(
            List.of(new DepthBreakpoint(0, 8), new DepthBreakpoint(1200, 12), new DepthBreakpoint(1500, 16)), 8, 20);

    @Mock
    private EngineOraclePool pool;

    private AnalysisCoordinator coordinator;

    @BeforeEach
    void setUp() {
        // Same-thread executor keeps ordering deterministic.
        coordinator = new AnalysisCoordinator(pool, OPENINGS, DEPTHS, OBJECTIVE_DEPTH, Runnable::run);
    }

    private static EngineEvaluation eval(int cp, int depth, Color sideToMove, String... line) {
        return new EngineEvaluation(Score.centipawns(cp), depth, List.of(line), sideToMove);
    }

    // ===== analyzePosition =====

    @Nested
    @DisplayName("analyzePosition()")
    class AnalyzePosition {

        @Test
        @DisplayName("should combine objective and human-like searches")
        void combinesBoth() {
            when(pool.evaluate(Board.START_FEN, 20)).thenReturn(eval(30, 20, Color.WHITE, "e2e4"));
            when(pool.evaluate(Board.START_FEN, 16)).thenReturn(eval(25, 16, Color.WHITE, "d2d4"));

            PositionAnalysis analysis = coordinator.analyzePosition(Board.START_FEN, 1500);

            assertThat(analysis.objective().score().centipawns()).isEqualTo(30);
            assertThat(analysis.humanLike().depth()).isEqualTo(16);
            assertThat(analysis.humanLikeDepth()).isEqualTo(16);
            assertThat(analysis.degraded()).isFalse();
            assertThat(analysis.positionType()).isEqualTo(PositionType.OPENING);
            assertThat(analysis.classification()).isNull();
        }

        @Test
        @DisplayName("should fail when the objective search fails")
        void objectiveFailureFails() {
            when(pool.evaluate(Board.START_FEN, 20)).thenThrow(new EngineUnavailableException("engine crashed"));
            when(pool.evaluate(Board.START_FEN, 8)).thenReturn(eval(25, 8, Color.WHITE));

            assertThatThrownBy(() -> coordinator.analyzePosition(Board.START_FEN, 800))
                    .isInstanceOf(EngineUnavailableException.class)
                    .hasMessageContaining("engine crashed");
        }

        @Test
        @DisplayName("should degrade when only the human-like search fails")
        void humanLikeFailureDegrades() {
            when(pool.evaluate(Board.START_FEN, 20)).thenReturn(eval(30, 20, Color.WHITE, "e2e4"));
            when(pool.evaluate(Board.START_FEN, 12)).thenThrow(new EngineUnavailableException("timeout"));

            PositionAnalysis analysis = coordinator.analyzePosition(Board.START_FEN, 1300);

            assertThat(analysis.humanLike()).isNull();
            assertThat(analysis.degraded()).isTrue();
            assertThat(analysis.objective().bestMove()).isEqualTo("e2e4");
        }

        @Test
        @DisplayName("should wrap unexpected objective failures")
        void wrapsUnexpectedFailures() {
            when(pool.evaluate(Board.START_FEN, 20)).thenThrow(new IllegalStateException("boom"));
            when(pool.evaluate(Board.START_FEN, 16)).thenReturn(eval(25, 16, Color.WHITE));

            assertThatThrownBy(() -> coordinator.analyzePosition(Board.START_FEN, 1600))
                    .isInstanceOf(EngineUnavailableException.class)
                    .hasMessageContaining("boom");
        }

        @Test
        @DisplayName("should answer game-over positions without searching")
        void terminalPosition() {
            PositionAnalysis analysis = coordinator.analyzePosition(FOOLS_MATE, 1500);

            assertThat(analysis.objective().score()).isEqualTo(Score.mate(0));
            assertThat(analysis.humanLike().score()).isEqualTo(Score.mate(0));
            assertThat(analysis.keyFeatures().tags()).contains("check");
            verifyNoInteractions(pool);
        }

        @Test
        @DisplayName("should reject an invalid FEN before searching")
        void invalidFen() {
            assertThatThrownBy(() -> coordinator.analyzePosition("8/8/8 w - -", 1500))
                    .isInstanceOf(InvalidPositionException.class);
            verifyNoInteractions(pool);
        }

        @Test
        @DisplayName("should run both searches side by side")
        void runsConcurrently() throws Exception {
            CountDownLatch bothStarted = new CountDownLatch(2);
            when(pool.evaluate(anyString(), anyInt())).thenAnswer(inv -> {
                bothStarted.countDown();
                if (!bothStarted.await(2, TimeUnit.SECONDS)) {
                    throw new EngineUnavailableException("searches ran one after the other");
                }
                int depth = inv.getArgument(1);
                return eval(10, depth, Color.WHITE);
            });
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                AnalysisCoordinator parallel = new AnalysisCoordinator(pool, OPENINGS, DEPTHS, OBJECTIVE_DEPTH, executor);

                PositionAnalysis analysis = parallel.analyzePosition(Board.START_FEN, 1500);

                assertThat(analysis.degraded()).isFalse();
            } finally {
                executor.shutdownNow();
            }
        }
    }

    // ===== analyzeMove =====

    @Nested
    @DisplayName("analyzeMove()")
    class AnalyzeMove {

        @Test
        @DisplayName("should call a move that throws away the advantage a blunder")
        void blunder() {
            when(pool.evaluate(Board.START_FEN, 20)).thenReturn(eval(500, 20, Color.WHITE, "d2d4"));
            when(pool.evaluate(Board.START_FEN, 12)).thenReturn(eval(480, 12, Color.WHITE, "d2d4"));
            when(pool.evaluate(AFTER_E4, 20)).thenReturn(eval(0, 20, Color.BLACK, "e7e5"));

            MoveAnalysis analysis = coordinator.analyzeMove(Board.START_FEN, "e4", 1200);

            assertThat(analysis.uci()).isEqualTo("e2e4");
            assertThat(analysis.san()).isEqualTo("e4");
            assertThat(analysis.classification()).isEqualTo(MoveClassification.BLUNDER);
            assertThat(analysis.centipawnLoss()).isEqualTo(500);
            assertThat(analysis.bestMove()).isEqualTo("d2d4");
            assertThat(analysis.playedBestMove()).isFalse();
        }

        @Test
        @DisplayName("should call a move that keeps the advantage best")
        void best() {
            when(pool.evaluate(Board.START_FEN, 20)).thenReturn(eval(500, 20, Color.WHITE, "e2e4"));
            when(pool.evaluate(Board.START_FEN, 12)).thenReturn(eval(480, 12, Color.WHITE, "e2e4"));
            when(pool.evaluate(AFTER_E4, 20)).thenReturn(eval(-490, 20, Color.BLACK, "e7e5"));

            MoveAnalysis analysis = coordinator.analyzeMove(Board.START_FEN, "e2e4", 1200);

            assertThat(analysis.classification()).isEqualTo(MoveClassification.BEST);
            assertThat(analysis.playedBestMove()).isTrue();
            assertThat(analysis.before().humanLikeDepth()).isEqualTo(12);
            verify(pool).evaluate(AFTER_E4, 20);
        }

        @Test
        @DisplayName("should fail when the position after the move cannot be evaluated")
        void afterFailure() {
            when(pool.evaluate(Board.START_FEN, 20)).thenReturn(eval(30, 20, Color.WHITE, "e2e4"));
            when(pool.evaluate(Board.START_FEN, 12)).thenReturn(eval(25, 12, Color.WHITE, "e2e4"));
            when(pool.evaluate(AFTER_E4, 20)).thenThrow(new EngineUnavailableException("engine crashed"));

            assertThatThrownBy(() -> coordinator.analyzeMove(Board.START_FEN, "e4", 1200))
                    .isInstanceOf(EngineUnavailableException.class);
        }

        @Test
        @DisplayName("should reject illegal moves before searching")
        void illegalMove() {
            assertThatThrownBy(() -> coordinator.analyzeMove(Board.START_FEN, "e5", 1200))
                    .isInstanceOf(IllegalMoveException.class);
            verifyNoInteractions(pool);
        }

        @Test
        @DisplayName("should evaluate a mating move without searching the mated position")
        void matingMove() {
            String beforeMate = "rnbqkbnr/pppp1ppp/8/4p3/6P1/5P2/PPPPP2P/RNBQKBNR b KQkq g3 0 2";
            when(pool.evaluate(beforeMate, 20)).thenReturn(
                    new EngineEvaluation(Score.mate(1), 20, List.of("d8h4"), Color.BLACK));
            when(pool.evaluate(beforeMate, 12)).thenReturn(
                    new EngineEvaluation(Score.mate(1), 12, List.of("d8h4"), Color.BLACK));

            MoveAnalysis analysis = coordinator.analyzeMove(beforeMate, "Qh4#", 1200);

            assertThat(analysis.after().score()).isEqualTo(Score.mate(0));
            assertThat(analysis.classification()).isEqualTo(MoveClassification.BEST);
            assertThat(analysis.playedBestMove()).isTrue();
        }
    }

    @Test
    void classifyMove_shouldDelegateToTheClassifier() {
        MoveClassification result = coordinator.classifyMove(
                eval(100, 20, Color.WHITE), eval(50, 20, Color.BLACK));

        assertThat(result).isEqualTo(MoveClassification.MISTAKE);
    }
}
