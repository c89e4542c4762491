package com.beerpong.repository;

import com.beerpong.model.PlacementRank;

public interface TournamentParticipantRow {
    Integer getTournamentId();

    String getPlayerName();

    PlacementRank getPlacement();
}
