package com.eainde.chesscoach.job;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * Request to generate a lesson.
 *
 * @param pgn        the game as PGN or a bare move list
 * @param gameId     optional reference to a stored game
 * @param title      optional lesson title
 * @param userElo    player rating; the configured default when absent
 * @param focusAreas optional hints such as "tactics"
 */
public record LessonRequest(
        String pgn,
        @JsonAlias("game_id") String gameId,
        String title,
        @JsonAlias("user_elo") Integer userElo,
        @JsonAlias("focus_areas") List<String> focusAreas
) {

    public static final int MIN_ELO = 100;
    public static final int MAX_ELO = 3500;

    public LessonRequest {
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
    }
}
