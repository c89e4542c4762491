package com.beerpong.mapper;

import com.beerpong.dto.PlayerResponses;
import com.beerpong.dto.TournamentResponses;
import com.beerpong.model.PlacementRank;
import com.beerpong.model.Player;
import com.beerpong.model.Tournament;
import com.beerpong.repository.TournamentParticipantRow;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class TournamentResponseMapper {

    public PlayerResponses.PlayerSummary toPlayerSummary(Player player) {
        return new PlayerResponses.PlayerSummary(player.getId(), player.getName());
    }

    public TournamentResponses.TournamentSummary toTournamentSummary(
            Tournament tournament,
            Collection<TournamentParticipantRow> participantRows
    ) {
        return new TournamentResponses.TournamentSummary(
                tournament.getId(),
                tournament.getDate(),
                tournament.getType(),
                tournament.getFlavor(),
                participantNames(participantRows)
        );
    }

    public TournamentResponses.TournamentDetail toTournamentDetail(
            Tournament tournament,
            Collection<TournamentParticipantRow> participantRows
    ) {
        return new TournamentResponses.TournamentDetail(
                tournament.getId(),
                tournament.getDate(),
                tournament.getType(),
                tournament.getFlavor(),
                participantNames(participantRows),
                new TournamentResponses.Placements(
                        namesWithPlacement(participantRows, PlacementRank.FIRST),
                        namesWithPlacement(participantRows, PlacementRank.SECOND),
                        namesWithPlacement(participantRows, PlacementRank.THIRD)
                )
        );
    }

    private List<String> participantNames(Collection<TournamentParticipantRow> participantRows) {
        return participantRows.stream()
                .map(TournamentParticipantRow::getPlayerName)
                .toList();
    }

    private List<String> namesWithPlacement(
            Collection<TournamentParticipantRow> participantRows,
            PlacementRank placement
    ) {
        return participantRows.stream()
                .filter(row -> row.getPlacement() == placement)
                .map(TournamentParticipantRow::getPlayerName)
                .toList();
    }
}
