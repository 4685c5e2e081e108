package com.eainde.chesscoach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Engine Oracle settings ({@code chess-coach.engine.*}).
 *
 * @param executable        path or command name of the UCI engine
 * @param poolSize          number of engine processes; two allow the objective and the human-like
 *                          search of one position to run side by side
 * @param threads           UCI {@code Threads} option per process
 * @param hashMb            UCI {@code Hash} option per process
 * @param objectiveDepth    depth of the user-independent baseline search
 * @param minDepth          lower clamp for the human-like search depth
 * @param maxDepth          upper clamp for the human-like search depth; raising it makes the
 *                          human-like estimate stronger and slower
 * @param eloToDepth        breakpoints mapping a rating to a human-like depth; the entry with the
 *                          highest {@code elo} not above the user's rating applies
 * @param evaluationTimeout budget for one search before the engine is stopped
 * @param checkoutTimeout   how long a caller waits for a free engine
 */
@ConfigurationProperties(prefix = "chess-coach.engine")
public record EngineProperties(
        String executable,
        Integer poolSize,
        Integer threads,
        Integer hashMb,
        Integer objectiveDepth,
        Integer minDepth,
        Integer maxDepth,
        List<DepthBreakpoint> eloToDepth,
        Duration evaluationTimeout,
        Duration checkoutTimeout
) {

    public EngineProperties {
        executable = executable == null || executable.isBlank() ? "stockfish" : executable;
        poolSize = poolSize == null ? 2 : poolSize;
        threads = threads == null ? 2 : threads;
        hashMb = hashMb == null ? 256 : hashMb;
        objectiveDepth = objectiveDepth == null ? 20 : objectiveDepth;
        minDepth = minDepth == null ? 8 : minDepth;
        maxDepth = maxDepth == null ? 20 : maxDepth;
        eloToDepth = eloToDepth == null || eloToDepth.isEmpty()
                ? List.of(new DepthBreakpoint(0, 8), new DepthBreakpoint(1200, 12),
                          new DepthBreakpoint(1500, 16), new DepthBreakpoint(1800, 20))
                : List.copyOf(eloToDepth);
        evaluationTimeout = evaluationTimeout == null ? Duration.ofSeconds(30) : evaluationTimeout;
        checkoutTimeout = checkoutTimeout == null ? Duration.ofSeconds(60) : checkoutTimeout;
    }

    /**
     * @param elo   rating from which this depth applies (inclusive)
     * @param depth human-like search depth
     */
    public record DepthBreakpoint(int elo, int depth) {}
}
