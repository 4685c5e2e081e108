package com.eainde.chesscoach.engine;

/**
 * A score-producing chess evaluator. One instance holds one engine session, so callers must
 * never have two evaluations in flight on the same instance; {@link EngineOraclePool}
 * enforces that.
 */
public interface EngineOracle extends AutoCloseable {

    /**
     * Searches {@code fen} to {@code depth} plies.
     *
     * @throws EngineUnavailableException if the engine fails or times out
     */
    EngineEvaluation evaluate(String fen, int depth);

    @Override
    void close();
}
