package com.beerpong.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Full payload of a tournament create or update. Participants keep submission order.
 */
public record TournamentSubmission(
        LocalDate date,
        TournamentType type,
        String flavor,
        List<String> participants,
        PlacementGroups placements
) {
}
