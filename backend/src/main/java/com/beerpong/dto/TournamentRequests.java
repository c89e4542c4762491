package com.beerpong.dto;

import com.beerpong.model.PlacementGroups;
import com.beerpong.model.TournamentSubmission;
import com.beerpong.model.TournamentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

public final class TournamentRequests {

    private TournamentRequests() {
    }

    /**
     * Body of both create and update; an update replaces every field and the whole entry set.
     */
    public record TournamentRequest(
            @NotNull(message = "date is required")
            LocalDate date,

            @NotNull(message = "type is required")
            TournamentType type,

            @Size(max = 1000, message = "flavor must be at most 1000 characters")
            String flavor,

            @NotNull(message = "participants is required")
            List<@NotBlank(message = "participant names must not be blank") String> participants,

            @NotNull(message = "placements is required")
            @Valid
            PlacementsRequest placements
    ) {
        public TournamentSubmission toSubmission() {
            return new TournamentSubmission(
                    date,
                    type,
                    flavor,
                    participants,
                    placements != null ? placements.toPlacementGroups() : null
            );
        }
    }

    public record PlacementsRequest(
            List<String> firstPlace,
            List<String> secondPlace,
            List<String> thirdPlace
    ) {
        public PlacementGroups toPlacementGroups() {
            return PlacementGroups.of(firstPlace, secondPlace, thirdPlace);
        }
    }
}
