package com.eainde.chesscoach.opening;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param eco                 ECO code of the matched table entry
 * @param name                opening name
 * @param matchedPrefixLength number of half-moves of the game covered by the entry
 * @param typicalPlans        plans usually associated with the opening
 */
public record OpeningMatch(
        String eco,
        String name,
        @JsonProperty("matched_prefix_length") int matchedPrefixLength,
        @JsonProperty("typical_plans") List<String> typicalPlans
) {

    public OpeningMatch {
        typicalPlans = typicalPlans == null ? List.of() : List.copyOf(typicalPlans);
    }
}
