package com.eainde.chesscoach.chess;

/**
 * A move as origin and destination squares plus an optional promotion piece. Castling is
 * encoded as the king's two-square step, en passant as the pawn's diagonal step.
 */
public record Move(int from, int to, PieceType promotion) {

    public String toUci() {
        String uci = Square.nameOf(from) + Square.nameOf(to);
        return promotion == null ? uci : uci + promotion.symbol();
    }

    @Override
    public String toString() {
        return toUci();
    }
}
