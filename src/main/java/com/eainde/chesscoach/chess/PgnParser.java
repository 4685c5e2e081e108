package com.eainde.chesscoach.chess;

import com.eainde.chesscoach.error.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the main line of a single PGN game, or a bare list of SAN/UCI moves, and replays it.
 * Comments, variations, NAGs, move numbers and the result token are skipped.
 */
public final class PgnParser {

    private static final Pattern TAG = Pattern.compile("^\\s*\\[(\\w+)\\s+\"((?:[^\"\\\\]|\\\\.)*)\"\\s*]\\s*$");
    private static final Pattern MOVE_NUMBER = Pattern.compile("^\\d+\\.+");
    private static final Set<String> RESULTS = Set.of("1-0", "0-1", "1/2-1/2", "*");

    private PgnParser() {
    }

    /**
     * @throws ValidationException if the text has no moves or a move is illegal where it appears
     */
    public static GameRecord parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Game text is empty");
        }

        Map<String, String> tags = new LinkedHashMap<>();
        StringBuilder movetext = new StringBuilder();
        for (String line : text.split("\\R")) {
            Matcher m = TAG.matcher(line);
            if (m.matches()) {
                tags.put(m.group(1), m.group(2).replace("\\\"", "\""));
            } else if (!line.trim().startsWith("%")) {
                movetext.append(stripLineComment(line)).append(' ');
            }
        }

        Board board = tags.containsKey("FEN") ? Board.fromFen(tags.get("FEN")) : Board.startingPosition();
        List<GamePosition> positions = new ArrayList<>();
        positions.add(new GamePosition(0, null, null, board.toFen()));

        int ply = 0;
        for (String token : tokenize(movetext.toString())) {
            Move move;
            try {
                move = board.parseMove(token);
            } catch (IllegalMoveException e) {
                throw new ValidationException("Illegal move '" + token + "' at ply " + (ply + 1)
                        + " (position " + board.toFen() + ")", e);
            }
            String san = board.toSan(move);
            board = board.play(move);
            ply++;
            positions.add(new GamePosition(ply, san, move.toUci(), board.toFen()));
        }

        if (ply == 0) {
            throw new ValidationException("Game contains no moves");
        }
        return new GameRecord(tags, text, positions);
    }

    private static String stripLineComment(String line) {
        int semicolon = line.indexOf(';');
        int brace = line.indexOf('{');
        if (semicolon >= 0 && (brace < 0 || semicolon < brace)) {
            return line.substring(0, semicolon);
        }
        return line;
    }

    static List<String> tokenize(String movetext) {
        StringBuilder cleaned = new StringBuilder();
        int variationDepth = 0;
        boolean inComment = false;
        for (char c : movetext.toCharArray()) {
            if (inComment) {
                if (c == '}') inComment = false;
                continue;
            }
            if (c == '{') {
                inComment = true;
            } else if (c == '(') {
                variationDepth++;
            } else if (c == ')') {
                if (variationDepth > 0) variationDepth--;
            } else if (variationDepth == 0) {
                cleaned.append(c);
            }
        }

        List<String> tokens = new ArrayList<>();
        for (String raw : cleaned.toString().trim().split("\\s+")) {
            String token = MOVE_NUMBER.matcher(raw).replaceFirst("");
            if (token.isEmpty() || token.startsWith("$") || RESULTS.contains(token)) {
                continue;
            }
            tokens.add(token);
        }
        return tokens;
    }
}
