package com.eainde.chesscoach.chess;

import java.util.List;
import java.util.Map;

/**
 * A parsed game: PGN tag pairs plus every position reached along the main line.
 */
public record GameRecord(Map<String, String> tags, String pgn, List<GamePosition> positions) {

    public GameRecord {
        tags = Map.copyOf(tags);
        positions = List.copyOf(positions);
    }

    public String tag(String name, String fallback) {
        String value = tags.get(name);
        return value == null || value.isBlank() ? fallback : value;
    }

    public String startFen() {
        return positions.get(0).fenAfter();
    }

    public String finalFen() {
        return positions.get(positions.size() - 1).fenAfter();
    }

    public int moveCount() {
        return positions.size() - 1;
    }

    public List<String> sanMoves() {
        return positions.stream().skip(1).map(GamePosition::san).toList();
    }

    public List<String> uciMoves() {
        return positions.stream().skip(1).map(GamePosition::uci).toList();
    }
}
