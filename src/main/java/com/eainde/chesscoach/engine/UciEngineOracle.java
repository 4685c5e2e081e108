package com.eainde.chesscoach.engine;

import com.eainde.chesscoach.chess.Board;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * {@link EngineOracle} backed by a UCI engine process (Stockfish by default).
 * <p>
 * The process is started on first use and restarted after any failure. Each search is bounded
 * by {@code evaluationTimeout}: on expiry the engine is told to {@code stop} and the call fails.
 * If the engine does not answer {@code stop} within a grace period the process is killed.
 */
@Slf4j
public class UciEngineOracle implements EngineOracle {

    private static final Duration HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration STOP_GRACE = Duration.ofSeconds(2);
    private static final long POLL_MILLIS = 5;

    private final String name;
    private final String executable;
    private final int threads;
    private final int hashMb;
    private final Duration evaluationTimeout;

    private Process process;
    private BufferedReader reader;
    private BufferedWriter writer;

    public UciEngineOracle(String name, String executable, int threads, int hashMb, Duration evaluationTimeout) {
        this.name = name;
        this.executable = executable;
        this.threads = threads;
        this.hashMb = hashMb;
        this.evaluationTimeout = evaluationTimeout;
    }

    @Override
    public synchronized EngineEvaluation evaluate(String fen, int depth) {
        Board board = Board.fromFen(fen);
        UciInfoLine info;
        try {
            ensureStarted();
            send("position fen " + board.toFen());
            send("go depth " + depth);

            UciInfoLine[] latest = new UciInfoLine[1];
            String bestMoveLine = readUntil(line -> {
                UciInfoLine.parse(line)
                        .filter(parsed -> parsed.multiPv() == 1)
                        .ifPresent(parsed -> latest[0] = parsed);
                return line.startsWith("bestmove");
            }, evaluationTimeout);

            if (bestMoveLine == null) {
                send("stop");
                if (readUntil(line -> line.startsWith("bestmove"), STOP_GRACE) == null) {
                    throw new EngineUnavailableException(name + ": engine ignored 'stop' after " + evaluationTimeout);
                }
                // engine answered 'stop' and is idle again, so the process is kept
                int reached = latest[0] == null ? 0 : latest[0].depth();
                log.warn("{}: search for depth {} stopped at depth {} after {}", name, depth, reached, evaluationTimeout);
                throw new SearchTimeoutException(name + ": search for depth " + depth
                        + " did not finish within " + evaluationTimeout + " (reached depth " + reached + ")");
            }
            if (latest[0] == null) {
                throw new EngineUnavailableException(name + ": engine returned no score for " + fen);
            }
            info = latest[0];
        } catch (SearchTimeoutException e) {
            throw e;
        } catch (IOException e) {
            shutdown();
            throw new EngineUnavailableException(name + ": engine I/O failed", e);
        } catch (EngineUnavailableException e) {
            shutdown();
            throw e;
        }
        return new EngineEvaluation(info.score(), info.depth() > 0 ? info.depth() : depth, info.pv(), board.sideToMove());
    }

    /** A search stopped at its deadline; the engine itself is still usable. */
    private static final class SearchTimeoutException extends EngineUnavailableException {
        SearchTimeoutException(String message) {
            super(message);
        }
    }

    private void ensureStarted() throws IOException {
        if (process != null && process.isAlive()) {
            return;
        }
        log.info("{}: starting engine '{}'", name, executable);
        process = new ProcessBuilder(executable).redirectErrorStream(true).start();
        reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        send("uci");
        if (readUntil(line -> line.equals("uciok"), HANDSHAKE_TIMEOUT) == null) {
            throw new EngineUnavailableException(name + ": engine did not answer 'uci'");
        }
        send("setoption name Threads value " + threads);
        send("setoption name Hash value " + hashMb);
        send("isready");
        if (readUntil(line -> line.equals("readyok"), HANDSHAKE_TIMEOUT) == null) {
            throw new EngineUnavailableException(name + ": engine did not answer 'isready'");
        }
    }

    private void send(String command) throws IOException {
        writer.write(command);
        writer.newLine();
        writer.flush();
    }

    /**
     * Reads lines until {@code stop} accepts one, returning it, or returns {@code null} once
     * {@code timeout} has elapsed.
     */
    private String readUntil(Predicate<String> stop, Duration timeout) throws IOException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (!reader.ready()) {
                if (!process.isAlive()) {
                    throw new EngineUnavailableException(name + ": engine process exited with code " + process.exitValue());
                }
                try {
                    Thread.sleep(POLL_MILLIS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EngineUnavailableException(name + ": interrupted while waiting for the engine", e);
                }
                continue;
            }
            String line = reader.readLine();
            if (line == null) {
                throw new EngineUnavailableException(name + ": engine closed its output");
            }
            if (stop.test(line.trim())) {
                return line.trim();
            }
        }
        return null;
    }

    private void shutdown() {
        if (process == null) {
            return;
        }
        try {
            if (process.isAlive()) {
                send("quit");
                if (!process.waitFor(500, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                }
            }
        } catch (IOException e) {
            log.debug("{}: quit failed, killing engine: {}", name, e.getMessage());
            process.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        } finally {
            process = null;
            reader = null;
            writer = null;
        }
    }

    @Override
    public synchronized void close() {
        shutdown();
    }

    @Override
    public String toString() {
        return name;
    }
}
