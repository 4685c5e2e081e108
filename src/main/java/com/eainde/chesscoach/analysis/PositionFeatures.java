package com.eainde.chesscoach.analysis;

import com.eainde.chesscoach.chess.Board;
import com.eainde.chesscoach.chess.Piece;
import com.eainde.chesscoach.chess.PieceType;
import com.eainde.chesscoach.chess.Square;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Cheap static features of a position that help the coach pick teaching moments.
 *
 * @param tags           subset of {@code check}, {@code hanging_pieces}, {@code tactical}
 * @param hangingSquares squares of attacked, undefended pieces other than pawns and kings
 * @param attackedPieces number of pieces of either colour under attack
 */
public record PositionFeatures(
        List<String> tags,
        @JsonProperty("hanging_squares") List<String> hangingSquares,
        @JsonProperty("attacked_pieces") int attackedPieces
) {

    private static final int TACTICAL_ATTACK_COUNT = 2;

    public static PositionFeatures extract(Board board) {
        List<String> hanging = new ArrayList<>();
        int attacked = 0;
        for (int sq = 0; sq < 64; sq++) {
            Piece piece = board.pieceAt(sq);
            if (piece == null) {
                continue;
            }
            boolean underAttack = board.isAttacked(sq, piece.color().opposite());
            if (!underAttack) {
                continue;
            }
            attacked++;
            if (piece.type() != PieceType.PAWN && piece.type() != PieceType.KING
                    && !board.isAttacked(sq, piece.color())) {
                hanging.add(new Square(sq).name());
            }
        }

        List<String> tags = new ArrayList<>();
        if (!hanging.isEmpty()) tags.add("hanging_pieces");
        if (board.isCheck()) tags.add("check");
        if (attacked > TACTICAL_ATTACK_COUNT) tags.add("tactical");
        return new PositionFeatures(List.copyOf(tags), List.copyOf(hanging), attacked);
    }
}
