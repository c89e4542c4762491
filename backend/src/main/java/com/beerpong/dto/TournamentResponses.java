package com.beerpong.dto;

import com.beerpong.model.TournamentType;

import java.time.LocalDate;
import java.util.List;

public final class TournamentResponses {

    private TournamentResponses() {
    }

    public record TournamentSummary(
            Integer id,
            LocalDate date,
            TournamentType type,
            String flavor,
            List<String> participants
    ) {
    }

    public record TournamentDetail(
            Integer id,
            LocalDate date,
            TournamentType type,
            String flavor,
            List<String> participants,
            Placements placements
    ) {
    }

    public record Placements(
            List<String> firstPlace,
            List<String> secondPlace,
            List<String> thirdPlace
    ) {
    }

    public record TournamentMutation(
            String message,
            Integer tournamentId
    ) {
    }
}
