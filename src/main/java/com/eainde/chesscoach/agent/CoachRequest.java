package com.eainde.chesscoach.agent;

import com.eainde.chesscoach.chess.GameRecord;

import java.util.List;

/**
 * Input of one coach run.
 *
 * @param lessonId   id given to the produced lesson
 * @param focusAreas optional hints such as "tactics" or "endgame"
 */
public record CoachRequest(String lessonId, GameRecord game, int userElo, List<String> focusAreas) {

    public CoachRequest {
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
    }
}
