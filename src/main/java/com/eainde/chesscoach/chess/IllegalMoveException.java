package com.eainde.chesscoach.chess;

import com.eainde.chesscoach.error.ValidationException;

public class IllegalMoveException extends ValidationException {

    public IllegalMoveException(String move, String fen) {
        super("Move '" + move + "' is not legal in position " + fen);
    }
}
