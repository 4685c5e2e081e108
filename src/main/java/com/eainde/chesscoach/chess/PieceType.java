package com.eainde.chesscoach.chess;

public enum PieceType {
    PAWN('p'),
    KNIGHT('n'),
    BISHOP('b'),
    ROOK('r'),
    QUEEN('q'),
    KING('k');

    private final char symbol;

    PieceType(char symbol) {
        this.symbol = symbol;
    }

    /** Lower-case FEN letter. */
    public char symbol() {
        return symbol;
    }

    /** Upper-case SAN letter; empty for pawns. */
    public String sanLetter() {
        return this == PAWN ? "" : String.valueOf(Character.toUpperCase(symbol));
    }

    public static PieceType fromSymbol(char c) {
        char lower = Character.toLowerCase(c);
        for (PieceType type : values()) {
            if (type.symbol == lower) {
                return type;
            }
        }
        return null;
    }
}
