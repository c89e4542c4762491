package com.beerpong.service;

import com.beerpong.model.PlacementGroups;
import com.beerpong.model.PlacementRank;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlacementResolverTest {

    private final PlacementResolver placementResolver = new PlacementResolver();

    @Test
    void resolvesEachGroupToItsRank() {
        PlacementGroups groups = PlacementGroups.of(List.of("Alice"), List.of("Bob"), List.of("Carol"));

        assertEquals(Optional.of(PlacementRank.FIRST), placementResolver.rankOf("Alice", groups));
        assertEquals(Optional.of(PlacementRank.SECOND), placementResolver.rankOf("Bob", groups));
        assertEquals(Optional.of(PlacementRank.THIRD), placementResolver.rankOf("Carol", groups));
    }

    @Test
    void firstPlaceTakesPrecedenceOverLowerGroups() {
        PlacementGroups groups = PlacementGroups.of(List.of("Alice"), List.of("Alice", "Bob"), List.of("Alice", "Bob"));

        assertEquals(Optional.of(PlacementRank.FIRST), placementResolver.rankOf("Alice", groups));
        assertEquals(Optional.of(PlacementRank.SECOND), placementResolver.rankOf("Bob", groups));
    }

    @Test
    void participantOutsideEveryGroupHasNoPlacement() {
        PlacementGroups groups = PlacementGroups.of(List.of("Alice"), null, List.of());

        assertTrue(placementResolver.rankOf("Dave", groups).isEmpty());
        assertTrue(placementResolver.rankOf("Dave", PlacementGroups.empty()).isEmpty());
    }

    @Test
    void namesMatchExactly() {
        PlacementGroups groups = PlacementGroups.of(List.of("Alice"), null, null);

        assertTrue(placementResolver.rankOf("alice", groups).isEmpty());
        assertTrue(placementResolver.rankOf("Alice ", groups).isEmpty());
    }
}
