package com.eainde.chesscoach.engine;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Fixed set of {@link EngineOracle} handles with serialized checkout/checkin.
 * <p>
 * A handle is held by exactly one caller for exactly one evaluation and is always returned,
 * whether the evaluation succeeds, fails or its result is no longer wanted.
 */
@Slf4j
public class EngineOraclePool implements AutoCloseable {

    private final List<EngineOracle> oracles;
    private final BlockingQueue<EngineOracle> idle;
    private final Duration checkoutTimeout;

    public EngineOraclePool(List<EngineOracle> oracles, Duration checkoutTimeout) {
        if (oracles.isEmpty()) {
            throw new IllegalArgumentException("Engine oracle pool needs at least one oracle");
        }
        this.oracles = List.copyOf(oracles);
        this.idle = new ArrayBlockingQueue<>(oracles.size(), true, oracles);
        this.checkoutTimeout = checkoutTimeout;
    }

    /**
     * Evaluates {@code fen} on the next free oracle.
     *
     * @throws EngineUnavailableException if no oracle frees up within the checkout timeout,
     *                                    or the oracle itself fails
     */
    public EngineEvaluation evaluate(String fen, int depth) {
        return withOracle(oracle -> oracle.evaluate(fen, depth));
    }

    /**
     * Runs {@code work} against one checked-out oracle and checks it back in afterwards.
     * {@code work} must issue at most one evaluation.
     */
    public <T> T withOracle(Function<EngineOracle, T> work) {
        EngineOracle oracle = checkout();
        try {
            return work.apply(oracle);
        } finally {
            idle.offer(oracle);
        }
    }

    private EngineOracle checkout() {
        try {
            EngineOracle oracle = idle.poll(checkoutTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (oracle == null) {
                throw new EngineUnavailableException("No engine available within " + checkoutTimeout
                        + " (pool size " + oracles.size() + ")");
            }
            return oracle;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("Interrupted while waiting for an engine", e);
        }
    }

    public int size() {
        return oracles.size();
    }

    public int available() {
        return idle.size();
    }

    @Override
    public void close() {
        for (EngineOracle oracle : oracles) {
            try {
                oracle.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close engine oracle {}", oracle, e);
            }
        }
    }
}
