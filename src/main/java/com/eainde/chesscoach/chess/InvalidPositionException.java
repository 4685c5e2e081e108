package com.eainde.chesscoach.chess;

import com.eainde.chesscoach.error.ValidationException;

public class InvalidPositionException extends ValidationException {

    public InvalidPositionException(String fen, String reason) {
        super("Invalid FEN '" + fen + "': " + reason);
    }
}
