package com.eainde.chesscoach.opening;

import com.eainde.chesscoach.chess.Board;
import com.eainde.chesscoach.chess.GameRecord;
import com.eainde.chesscoach.chess.PgnParser;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stateless opening lookup: longest SAN-prefix match of a game against a table of known
 * openings, plus the coarse game phase of a position.
 */
@Slf4j
@Component
public class OpeningClassifier {

    static final String TABLE_RESOURCE = "/openings.json";

    static final OpeningMatch START_POSITION =
            new OpeningMatch("A00", "Start Position", 0, List.of("Develop pieces", "Control center"));
    static final OpeningMatch UNCOMMON_OPENING =
            new OpeningMatch("A00", "Uncommon Opening", 0, List.of("Develop pieces", "Control center"));

    private static final int OPENING_FULLMOVE_LIMIT = 10;
    private static final int ENDGAME_PIECE_LIMIT = 10;

    private final List<Entry> entries;

    @Autowired
    public OpeningClassifier(ObjectMapper objectMapper) {
        this(loadTable(objectMapper));
    }

    OpeningClassifier(List<Entry> entries) {
        // Longest first, so the first hit is the longest match.
        this.entries = entries.stream()
                .sorted(Comparator.comparingInt((Entry e) -> e.moves().size()).reversed())
                .toList();
        log.info("Loaded {} opening entries", entries.size());
    }

    /**
     * Matches the game's SAN moves against the table.
     *
     * @return the entry with the longest move sequence that prefixes the game, or empty
     */
    public Optional<OpeningMatch> classify(List<String> sanMoves) {
        List<String> game = sanMoves.stream().map(OpeningClassifier::normalise).toList();
        for (Entry entry : entries) {
            if (entry.moves().size() <= game.size() && game.subList(0, entry.moves().size()).equals(entry.moves())) {
                return Optional.of(new OpeningMatch(entry.eco(), entry.name(), entry.moves().size(), entry.plans()));
            }
        }
        return Optional.empty();
    }

    /** Like {@link #classify} but never empty: unmatched games are reported as an uncommon opening. */
    public OpeningMatch classifyOrFallback(List<String> sanMoves) {
        return classify(sanMoves).orElseGet(() -> sanMoves.isEmpty() ? START_POSITION : UNCOMMON_OPENING);
    }

    /** Parses {@code pgn} and classifies its main line. Throws if the PGN does not replay. */
    public Optional<OpeningMatch> classifyPgn(String pgn) {
        GameRecord game = PgnParser.parse(pgn);
        return classify(game.sanMoves());
    }

    public PositionType positionType(Board board) {
        if (board.fullmoveNumber() <= OPENING_FULLMOVE_LIMIT) {
            return PositionType.OPENING;
        }
        if (board.pieceCount() <= ENDGAME_PIECE_LIMIT) {
            return PositionType.ENDGAME;
        }
        return PositionType.MIDDLEGAME;
    }

    public PositionType positionType(String fen) {
        return positionType(Board.fromFen(fen));
    }

    private static String normalise(String san) {
        return san.replaceAll("[+#!?]", "");
    }

    private static List<Entry> loadTable(ObjectMapper objectMapper) {
        try (InputStream in = OpeningClassifier.class.getResourceAsStream(TABLE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Opening table " + TABLE_RESOURCE + " not found on classpath");
            }
            List<Entry> raw = objectMapper.readValue(in, new TypeReference<List<Entry>>() {});
            return raw.stream()
                    .map(e -> new Entry(e.eco(), e.name(), e.moves().stream().map(OpeningClassifier::normalise).toList(), e.plans()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read opening table " + TABLE_RESOURCE, e);
        }
    }

    /**
     * One table row.
     *
     * @param moves SAN half-moves from the initial position
     */
    record Entry(String eco, String name, List<String> moves, @JsonProperty("typical_plans") List<String> plans) {

        Entry {
            moves = List.copyOf(moves);
            plans = plans == null ? List.of() : List.copyOf(plans);
        }

        static Entry of(String eco, String name, String moves, String... plans) {
            return new Entry(eco, name, Arrays.asList(moves.split(" ")), Arrays.asList(plans));
        }
    }
}
