package com.beerpong.model;

/**
 * Closed set of podium ranks. Iteration order of {@link #values()} is the
 * precedence order used when a name appears in several placement groups.
 */
public enum PlacementRank {
    FIRST(1),
    SECOND(2),
    THIRD(3);

    private final int rank;

    PlacementRank(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public static PlacementRank fromRank(int rank) {
        for (PlacementRank placementRank : values()) {
            if (placementRank.rank == rank) {
                return placementRank;
            }
        }
        throw new IllegalArgumentException("Unsupported placement rank: " + rank);
    }
}
