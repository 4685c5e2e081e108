package com.eainde.chesscoach.opening;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PositionType {
    OPENING,
    MIDDLEGAME,
    ENDGAME;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
