package com.eainde.chesscoach.chess;

public record Piece(Color color, PieceType type) {

    public static Piece fromFenChar(char c) {
        PieceType type = PieceType.fromSymbol(c);
        if (type == null) {
            return null;
        }
        return new Piece(Character.isUpperCase(c) ? Color.WHITE : Color.BLACK, type);
    }

    public char toFenChar() {
        return color == Color.WHITE ? Character.toUpperCase(type.symbol()) : type.symbol();
    }

    public boolean is(Color c, PieceType t) {
        return color == c && type == t;
    }
}
