package com.eainde.chesscoach.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The parts of a UCI {@code info} line that matter for evaluation: depth, multipv index,
 * score and principal variation.
 */
record UciInfoLine(int depth, int multiPv, Score score, List<String> pv) {

    /**
     * Parses an {@code info} line. Lines without a score (currmove updates, strings,
     * bound-only scores) yield empty.
     */
    static Optional<UciInfoLine> parse(String line) {
        if (line == null || !line.startsWith("info ")) {
            return Optional.empty();
        }
        String[] tokens = line.trim().split("\\s+");
        int depth = 0;
        int multiPv = 1;
        Score score = null;
        List<String> pv = new ArrayList<>();
        try {
            for (int i = 1; i < tokens.length; i++) {
                switch (tokens[i]) {
                    case "depth" -> depth = Integer.parseInt(tokens[++i]);
                    case "multipv" -> multiPv = Integer.parseInt(tokens[++i]);
                    case "score" -> {
                        String kind = tokens[++i];
                        int value = Integer.parseInt(tokens[++i]);
                        score = "mate".equals(kind) ? Score.mate(value) : Score.centipawns(value);
                        if (i + 1 < tokens.length
                                && ("lowerbound".equals(tokens[i + 1]) || "upperbound".equals(tokens[i + 1]))) {
                            return Optional.empty();
                        }
                    }
                    case "pv" -> {
                        for (i = i + 1; i < tokens.length; i++) {
                            pv.add(tokens[i]);
                        }
                    }
                    case "string" -> {
                        return Optional.empty();
                    }
                    default -> {
                        // nodes, nps, time, hashfull, ... are not needed
                    }
                }
            }
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            return Optional.empty();
        }
        return score == null ? Optional.empty() : Optional.of(new UciInfoLine(depth, multiPv, score, pv));
    }
}
