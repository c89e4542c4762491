package com.beerpong.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

/**
 * One player's participation in one tournament. A null placement means the
 * player finished outside the ranked groups.
 */
@Getter
@Setter
@Entity
@Table(
        name = "tournament_entries",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_tournament_entries_tournament_player",
                columnNames = {"tournament_id", "player_id"}
        )
)
public class TournamentEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "tournament_id", nullable = false)
    private Integer tournamentId;

    @Column(name = "player_id", nullable = false)
    private Integer playerId;

    @Convert(converter = PlacementRankConverter.class)
    @Column(name = "placement")
    private PlacementRank placement;
}
