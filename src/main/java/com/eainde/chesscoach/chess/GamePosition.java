package com.eainde.chesscoach.chess;

/**
 * One replayed ply of a game. Ply 0 is the starting position and carries no move.
 *
 * @param ply      half-move index, 0 for the initial position
 * @param san      the move that led here in SAN, {@code null} for ply 0
 * @param uci      the same move in UCI, {@code null} for ply 0
 * @param fenAfter the position after the move
 */
public record GamePosition(int ply, String san, String uci, String fenAfter) {

    /** Move number as printed in PGN, e.g. ply 3 is move 2. */
    public int moveNumber() {
        return (ply + 1) / 2;
    }
}
