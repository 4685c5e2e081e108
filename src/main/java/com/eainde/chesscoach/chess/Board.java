package com.eainde.chesscoach.chess;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Immutable chess position: placement, side to move, castling rights, en passant square and
 * clocks. Everything needed to validate FENs, generate legal moves and replay games.
 *
 * <p>Castling rights use the bit mask {@code 0x1 = White O-O, 0x2 = White O-O-O,
 * 0x4 = Black O-O, 0x8 = Black O-O-O}.
 */
public final class Board {

    public static final String START_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private static final int WHITE_KING_SIDE = 0x1;
    private static final int WHITE_QUEEN_SIDE = 0x2;
    private static final int BLACK_KING_SIDE = 0x4;
    private static final int BLACK_QUEEN_SIDE = 0x8;

    private static final int[][] KNIGHT_STEPS = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
    private static final int[][] KING_STEPS = {{1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}};
    private static final int[][] ROOK_DIRECTIONS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    private static final int[][] BISHOP_DIRECTIONS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    private static final PieceType[] PROMOTIONS = {PieceType.QUEEN, PieceType.ROOK, PieceType.BISHOP, PieceType.KNIGHT};

    private static final Pattern UCI_MOVE = Pattern.compile("^[a-h][1-8][a-h][1-8][qrbn]?$");

    private final Piece[] squares;
    private final Color sideToMove;
    private final int castlingRights;
    private final int enPassantSquare;
    private final int halfmoveClock;
    private final int fullmoveNumber;

    private List<Move> legalMovesCache;

    private Board(Piece[] squares, Color sideToMove, int castlingRights, int enPassantSquare,
                  int halfmoveClock, int fullmoveNumber) {
        this.squares = squares;
        this.sideToMove = sideToMove;
        this.castlingRights = castlingRights;
        this.enPassantSquare = enPassantSquare;
        this.halfmoveClock = halfmoveClock;
        this.fullmoveNumber = fullmoveNumber;
    }

    public static Board startingPosition() {
        return fromFen(START_FEN);
    }

    /**
     * Parses and validates a FEN. The clock fields may be omitted.
     *
     * @throws InvalidPositionException if the text is malformed or the position cannot arise
     *                                  (missing or extra kings, pawns on a back rank, the side
     *                                  not to move standing in check)
     */
    public static Board fromFen(String fen) {
        if (fen == null || fen.isBlank()) {
            throw new InvalidPositionException(String.valueOf(fen), "empty");
        }
        String[] fields = fen.trim().split("\\s+");
        if (fields.length != 4 && fields.length != 6) {
            throw new InvalidPositionException(fen, "expected 6 fields but found " + fields.length);
        }

        Piece[] squares = parsePlacement(fen, fields[0]);

        Color side;
        if ("w".equals(fields[1])) {
            side = Color.WHITE;
        } else if ("b".equals(fields[1])) {
            side = Color.BLACK;
        } else {
            throw new InvalidPositionException(fen, "side to move must be 'w' or 'b'");
        }

        int castling = parseCastling(fen, fields[2]);

        int ep = -1;
        if (!"-".equals(fields[3])) {
            if (!Square.isValid(fields[3])) {
                throw new InvalidPositionException(fen, "bad en passant square '" + fields[3] + "'");
            }
            ep = Square.parse(fields[3]).index();
            int expectedRank = side == Color.WHITE ? 5 : 2;
            if ((ep >> 3) != expectedRank) {
                throw new InvalidPositionException(fen, "en passant square on the wrong rank");
            }
        }

        int halfmove = 0;
        int fullmove = 1;
        if (fields.length == 6) {
            try {
                halfmove = Integer.parseInt(fields[4]);
                fullmove = Integer.parseInt(fields[5]);
            } catch (NumberFormatException e) {
                throw new InvalidPositionException(fen, "clock fields must be integers");
            }
            if (halfmove < 0 || fullmove < 1) {
                throw new InvalidPositionException(fen, "clock fields out of range");
            }
        }

        Board board = new Board(squares, side, sanitizeCastling(squares, castling), ep, halfmove, fullmove);
        board.checkPlausible(fen);
        return board;
    }

    /** {@code true} when the FEN parses and describes a reachable-looking position. */
    public static boolean isValidFen(String fen) {
        try {
            fromFen(fen);
            return true;
        } catch (InvalidPositionException e) {
            return false;
        }
    }

    private static Piece[] parsePlacement(String fen, String placement) {
        String[] ranks = placement.split("/", -1);
        if (ranks.length != 8) {
            throw new InvalidPositionException(fen, "placement must describe 8 ranks");
        }
        Piece[] squares = new Piece[64];
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char c : ranks[i].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    file += c - '0';
                } else {
                    Piece piece = Piece.fromFenChar(c);
                    if (piece == null) {
                        throw new InvalidPositionException(fen, "unknown piece '" + c + "'");
                    }
                    if (file > 7) {
                        throw new InvalidPositionException(fen, "rank " + (rank + 1) + " is too long");
                    }
                    squares[rank * 8 + file] = piece;
                    file++;
                }
                if (file > 8) {
                    throw new InvalidPositionException(fen, "rank " + (rank + 1) + " is too long");
                }
            }
            if (file != 8) {
                throw new InvalidPositionException(fen, "rank " + (rank + 1) + " does not cover 8 files");
            }
        }
        return squares;
    }

    private static int parseCastling(String fen, String field) {
        if ("-".equals(field)) {
            return 0;
        }
        int rights = 0;
        for (char c : field.toCharArray()) {
            switch (c) {
                case 'K' -> rights |= WHITE_KING_SIDE;
                case 'Q' -> rights |= WHITE_QUEEN_SIDE;
                case 'k' -> rights |= BLACK_KING_SIDE;
                case 'q' -> rights |= BLACK_QUEEN_SIDE;
                default -> throw new InvalidPositionException(fen, "bad castling field '" + field + "'");
            }
        }
        return rights;
    }

    /** Drops castling rights whose king or rook is not on its home square. */
    private static int sanitizeCastling(Piece[] squares, int rights) {
        Piece whiteKing = new Piece(Color.WHITE, PieceType.KING);
        Piece blackKing = new Piece(Color.BLACK, PieceType.KING);
        Piece whiteRook = new Piece(Color.WHITE, PieceType.ROOK);
        Piece blackRook = new Piece(Color.BLACK, PieceType.ROOK);
        if (!whiteKing.equals(squares[4])) {
            rights &= ~(WHITE_KING_SIDE | WHITE_QUEEN_SIDE);
        }
        if (!blackKing.equals(squares[60])) {
            rights &= ~(BLACK_KING_SIDE | BLACK_QUEEN_SIDE);
        }
        if (!whiteRook.equals(squares[7])) rights &= ~WHITE_KING_SIDE;
        if (!whiteRook.equals(squares[0])) rights &= ~WHITE_QUEEN_SIDE;
        if (!blackRook.equals(squares[63])) rights &= ~BLACK_KING_SIDE;
        if (!blackRook.equals(squares[56])) rights &= ~BLACK_QUEEN_SIDE;
        return rights;
    }

    private void checkPlausible(String fen) {
        int whiteKings = 0;
        int blackKings = 0;
        for (int sq = 0; sq < 64; sq++) {
            Piece p = squares[sq];
            if (p == null) {
                continue;
            }
            if (p.type() == PieceType.KING) {
                if (p.color() == Color.WHITE) whiteKings++;
                else blackKings++;
            }
            if (p.type() == PieceType.PAWN && (sq < 8 || sq >= 56)) {
                throw new InvalidPositionException(fen, "pawn on " + Square.nameOf(sq));
            }
        }
        if (whiteKings != 1 || blackKings != 1) {
            throw new InvalidPositionException(fen, "each side needs exactly one king");
        }
        if (isKingAttacked(sideToMove.opposite())) {
            throw new InvalidPositionException(fen, "side not to move is in check");
        }
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public Color sideToMove() {
        return sideToMove;
    }

    public int castlingRights() {
        return castlingRights;
    }

    public int enPassantSquare() {
        return enPassantSquare;
    }

    public int halfmoveClock() {
        return halfmoveClock;
    }

    public int fullmoveNumber() {
        return fullmoveNumber;
    }

    public Piece pieceAt(int square) {
        return squares[square];
    }

    public Piece pieceAt(String squareName) {
        return squares[Square.parse(squareName).index()];
    }

    public int pieceCount() {
        int count = 0;
        for (Piece p : squares) {
            if (p != null) count++;
        }
        return count;
    }

    public boolean isCheck() {
        return isKingAttacked(sideToMove);
    }

    public boolean isCheckmate() {
        return isCheck() && legalMoves().isEmpty();
    }

    public boolean isStalemate() {
        return !isCheck() && legalMoves().isEmpty();
    }

    // ------------------------------------------------------------------
    // Attacks
    // ------------------------------------------------------------------

    /** Whether any piece of {@code by} attacks {@code square}. */
    public boolean isAttacked(int square, Color by) {
        int file = square & 7;
        int rank = square >> 3;

        int pawnRank = by == Color.WHITE ? rank - 1 : rank + 1;
        for (int df : new int[]{-1, 1}) {
            int from = offset(file + df, pawnRank);
            if (from >= 0 && squares[from] != null && squares[from].is(by, PieceType.PAWN)) {
                return true;
            }
        }
        for (int[] step : KNIGHT_STEPS) {
            int from = offset(file + step[0], rank + step[1]);
            if (from >= 0 && squares[from] != null && squares[from].is(by, PieceType.KNIGHT)) {
                return true;
            }
        }
        for (int[] step : KING_STEPS) {
            int from = offset(file + step[0], rank + step[1]);
            if (from >= 0 && squares[from] != null && squares[from].is(by, PieceType.KING)) {
                return true;
            }
        }
        return slidingAttack(file, rank, by, ROOK_DIRECTIONS, PieceType.ROOK)
                || slidingAttack(file, rank, by, BISHOP_DIRECTIONS, PieceType.BISHOP);
    }

    private boolean slidingAttack(int file, int rank, Color by, int[][] directions, PieceType slider) {
        for (int[] dir : directions) {
            int f = file + dir[0];
            int r = rank + dir[1];
            int sq;
            while ((sq = offset(f, r)) >= 0) {
                Piece p = squares[sq];
                if (p != null) {
                    if (p.color() == by && (p.type() == slider || p.type() == PieceType.QUEEN)) {
                        return true;
                    }
                    break;
                }
                f += dir[0];
                r += dir[1];
            }
        }
        return false;
    }

    private boolean isKingAttacked(Color kingColor) {
        int king = kingSquare(kingColor);
        return king >= 0 && isAttacked(king, kingColor.opposite());
    }

    private int kingSquare(Color color) {
        for (int sq = 0; sq < 64; sq++) {
            Piece p = squares[sq];
            if (p != null && p.is(color, PieceType.KING)) {
                return sq;
            }
        }
        return -1;
    }

    private static int offset(int file, int rank) {
        if (file < 0 || file > 7 || rank < 0 || rank > 7) {
            return -1;
        }
        return rank * 8 + file;
    }

    // ------------------------------------------------------------------
    // Move generation
    // ------------------------------------------------------------------

    public List<Move> legalMoves() {
        if (legalMovesCache == null) {
            List<Move> legal = new ArrayList<>();
            for (Move move : pseudoLegalMoves()) {
                Board next = applyUnchecked(move);
                if (!next.isKingAttacked(sideToMove)) {
                    legal.add(move);
                }
            }
            legalMovesCache = List.copyOf(legal);
        }
        return legalMovesCache;
    }

    public boolean isLegal(Move move) {
        return legalMoves().contains(move);
    }

    private List<Move> pseudoLegalMoves() {
        List<Move> moves = new ArrayList<>();
        for (int sq = 0; sq < 64; sq++) {
            Piece p = squares[sq];
            if (p == null || p.color() != sideToMove) {
                continue;
            }
            switch (p.type()) {
                case PAWN -> pawnMoves(sq, moves);
                case KNIGHT -> stepMoves(sq, KNIGHT_STEPS, moves);
                case BISHOP -> slideMoves(sq, BISHOP_DIRECTIONS, moves);
                case ROOK -> slideMoves(sq, ROOK_DIRECTIONS, moves);
                case QUEEN -> {
                    slideMoves(sq, ROOK_DIRECTIONS, moves);
                    slideMoves(sq, BISHOP_DIRECTIONS, moves);
                }
                case KING -> {
                    stepMoves(sq, KING_STEPS, moves);
                    castlingMoves(sq, moves);
                }
            }
        }
        return moves;
    }

    private void pawnMoves(int from, List<Move> moves) {
        int file = from & 7;
        int rank = from >> 3;
        int dir = sideToMove == Color.WHITE ? 1 : -1;
        int startRank = sideToMove == Color.WHITE ? 1 : 6;
        int lastRank = sideToMove == Color.WHITE ? 7 : 0;

        int one = offset(file, rank + dir);
        if (one >= 0 && squares[one] == null) {
            addPawnMove(from, one, lastRank, moves);
            int two = offset(file, rank + 2 * dir);
            if (rank == startRank && two >= 0 && squares[two] == null) {
                moves.add(new Move(from, two, null));
            }
        }
        for (int df : new int[]{-1, 1}) {
            int target = offset(file + df, rank + dir);
            if (target < 0) {
                continue;
            }
            Piece victim = squares[target];
            if (victim != null && victim.color() != sideToMove) {
                addPawnMove(from, target, lastRank, moves);
            } else if (victim == null && target == enPassantSquare) {
                moves.add(new Move(from, target, null));
            }
        }
    }

    private static void addPawnMove(int from, int to, int lastRank, List<Move> moves) {
        if ((to >> 3) == lastRank) {
            for (PieceType promotion : PROMOTIONS) {
                moves.add(new Move(from, to, promotion));
            }
        } else {
            moves.add(new Move(from, to, null));
        }
    }

    private void stepMoves(int from, int[][] steps, List<Move> moves) {
        int file = from & 7;
        int rank = from >> 3;
        for (int[] step : steps) {
            int to = offset(file + step[0], rank + step[1]);
            if (to >= 0 && (squares[to] == null || squares[to].color() != sideToMove)) {
                moves.add(new Move(from, to, null));
            }
        }
    }

    private void slideMoves(int from, int[][] directions, List<Move> moves) {
        int file = from & 7;
        int rank = from >> 3;
        for (int[] dir : directions) {
            int f = file + dir[0];
            int r = rank + dir[1];
            int to;
            while ((to = offset(f, r)) >= 0) {
                Piece p = squares[to];
                if (p == null) {
                    moves.add(new Move(from, to, null));
                } else {
                    if (p.color() != sideToMove) {
                        moves.add(new Move(from, to, null));
                    }
                    break;
                }
                f += dir[0];
                r += dir[1];
            }
        }
    }

    private void castlingMoves(int kingSquare, List<Move> moves) {
        Color enemy = sideToMove.opposite();
        int home = sideToMove == Color.WHITE ? 4 : 60;
        if (kingSquare != home || isAttacked(home, enemy)) {
            return;
        }
        int kingSide = sideToMove == Color.WHITE ? WHITE_KING_SIDE : BLACK_KING_SIDE;
        int queenSide = sideToMove == Color.WHITE ? WHITE_QUEEN_SIDE : BLACK_QUEEN_SIDE;
        if ((castlingRights & kingSide) != 0
                && squares[home + 1] == null && squares[home + 2] == null
                && !isAttacked(home + 1, enemy) && !isAttacked(home + 2, enemy)) {
            moves.add(new Move(home, home + 2, null));
        }
        if ((castlingRights & queenSide) != 0
                && squares[home - 1] == null && squares[home - 2] == null && squares[home - 3] == null
                && !isAttacked(home - 1, enemy) && !isAttacked(home - 2, enemy)) {
            moves.add(new Move(home, home - 2, null));
        }
    }

    // ------------------------------------------------------------------
    // Making moves
    // ------------------------------------------------------------------

    /**
     * Returns the position after {@code move}.
     *
     * @throws IllegalMoveException if the move is not legal here
     */
    public Board play(Move move) {
        if (!isLegal(move)) {
            throw new IllegalMoveException(move.toUci(), toFen());
        }
        return applyUnchecked(move);
    }

    private Board applyUnchecked(Move move) {
        Piece[] next = Arrays.copyOf(squares, 64);
        Piece moving = next[move.from()];
        Piece captured = next[move.to()];
        boolean pawnMove = moving.type() == PieceType.PAWN;

        next[move.from()] = null;
        next[move.to()] = move.promotion() != null ? new Piece(moving.color(), move.promotion()) : moving;

        if (pawnMove && move.to() == enPassantSquare && captured == null && (move.to() & 7) != (move.from() & 7)) {
            int victim = move.to() + (moving.color() == Color.WHITE ? -8 : 8);
            captured = next[victim];
            next[victim] = null;
        }

        if (moving.type() == PieceType.KING && Math.abs(move.to() - move.from()) == 2) {
            boolean kingSide = move.to() > move.from();
            int rookFrom = kingSide ? move.from() + 3 : move.from() - 4;
            int rookTo = kingSide ? move.from() + 1 : move.from() - 1;
            next[rookTo] = next[rookFrom];
            next[rookFrom] = null;
        }

        int rights = castlingRights;
        if (moving.type() == PieceType.KING) {
            rights &= moving.color() == Color.WHITE
                    ? ~(WHITE_KING_SIDE | WHITE_QUEEN_SIDE)
                    : ~(BLACK_KING_SIDE | BLACK_QUEEN_SIDE);
        }
        rights &= ~cornerRight(move.from());
        rights &= ~cornerRight(move.to());

        int ep = -1;
        if (pawnMove && Math.abs(move.to() - move.from()) == 16) {
            ep = (move.from() + move.to()) / 2;
        }

        int halfmove = pawnMove || captured != null ? 0 : halfmoveClock + 1;
        int fullmove = sideToMove == Color.BLACK ? fullmoveNumber + 1 : fullmoveNumber;
        return new Board(next, sideToMove.opposite(), rights, ep, halfmove, fullmove);
    }

    private static int cornerRight(int square) {
        return switch (square) {
            case 0 -> WHITE_QUEEN_SIDE;
            case 7 -> WHITE_KING_SIDE;
            case 56 -> BLACK_QUEEN_SIDE;
            case 63 -> BLACK_KING_SIDE;
            default -> 0;
        };
    }

    // ------------------------------------------------------------------
    // Notation
    // ------------------------------------------------------------------

    /**
     * Resolves UCI ({@code e2e4}, {@code e7e8q}) or SAN ({@code Nf3}, {@code O-O}, {@code exd8=Q+})
     * text to a legal move.
     *
     * @throws IllegalMoveException if nothing legal matches
     */
    public Move parseMove(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalMoveException(String.valueOf(text), toFen());
        }
        String trimmed = text.trim();
        if (UCI_MOVE.matcher(trimmed).matches()) {
            for (Move move : legalMoves()) {
                if (move.toUci().equals(trimmed)) {
                    return move;
                }
            }
            throw new IllegalMoveException(trimmed, toFen());
        }
        String wanted = canonicalSan(trimmed);
        for (Move move : legalMoves()) {
            if (canonicalSan(toSan(move)).equals(wanted)) {
                return move;
            }
        }
        throw new IllegalMoveException(trimmed, toFen());
    }

    private static String canonicalSan(String san) {
        return san.replace('0', 'O')
                .replaceAll("[+#!?]", "")
                .replace("x", "")
                .replace("=", "")
                .replace("e.p.", "");
    }

    /** Standard algebraic notation, including disambiguation and check markers. */
    public String toSan(Move move) {
        Piece moving = squares[move.from()];
        if (moving == null) {
            throw new IllegalMoveException(move.toUci(), toFen());
        }
        StringBuilder san = new StringBuilder();
        if (moving.type() == PieceType.KING && Math.abs(move.to() - move.from()) == 2) {
            san.append(move.to() > move.from() ? "O-O" : "O-O-O");
        } else {
            boolean capture = squares[move.to()] != null
                    || (moving.type() == PieceType.PAWN && (move.from() & 7) != (move.to() & 7));
            if (moving.type() == PieceType.PAWN) {
                if (capture) {
                    san.append((char) ('a' + (move.from() & 7)));
                }
            } else {
                san.append(moving.type().sanLetter());
                san.append(disambiguation(move, moving));
            }
            if (capture) {
                san.append('x');
            }
            san.append(Square.nameOf(move.to()));
            if (move.promotion() != null) {
                san.append('=').append(move.promotion().sanLetter());
            }
        }
        Board after = applyUnchecked(move);
        if (after.isCheck()) {
            san.append(after.legalMoves().isEmpty() ? '#' : '+');
        }
        return san.toString();
    }

    private String disambiguation(Move move, Piece moving) {
        boolean ambiguous = false;
        boolean sameFile = false;
        boolean sameRank = false;
        for (Move other : legalMoves()) {
            if (other.to() != move.to() || other.from() == move.from()) {
                continue;
            }
            Piece p = squares[other.from()];
            if (p == null || p.type() != moving.type()) {
                continue;
            }
            ambiguous = true;
            if ((other.from() & 7) == (move.from() & 7)) sameFile = true;
            if ((other.from() >> 3) == (move.from() >> 3)) sameRank = true;
        }
        if (!ambiguous) {
            return "";
        }
        String square = Square.nameOf(move.from());
        if (!sameFile) {
            return square.substring(0, 1);
        }
        if (!sameRank) {
            return square.substring(1);
        }
        return square;
    }

    public String toFen() {
        StringBuilder fen = new StringBuilder();
        for (int rank = 7; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < 8; file++) {
                Piece p = squares[rank * 8 + file];
                if (p == null) {
                    empty++;
                } else {
                    if (empty > 0) {
                        fen.append(empty);
                        empty = 0;
                    }
                    fen.append(p.toFenChar());
                }
            }
            if (empty > 0) {
                fen.append(empty);
            }
            if (rank > 0) {
                fen.append('/');
            }
        }
        fen.append(sideToMove == Color.WHITE ? " w " : " b ");
        StringBuilder castling = new StringBuilder();
        if ((castlingRights & WHITE_KING_SIDE) != 0) castling.append('K');
        if ((castlingRights & WHITE_QUEEN_SIDE) != 0) castling.append('Q');
        if ((castlingRights & BLACK_KING_SIDE) != 0) castling.append('k');
        if ((castlingRights & BLACK_QUEEN_SIDE) != 0) castling.append('q');
        fen.append(castling.length() == 0 ? "-" : castling);
        fen.append(' ').append(enPassantSquare < 0 ? "-" : Square.nameOf(enPassantSquare));
        fen.append(' ').append(halfmoveClock).append(' ').append(fullmoveNumber);
        return fen.toString();
    }

    @Override
    public String toString() {
        return toFen();
    }
}
