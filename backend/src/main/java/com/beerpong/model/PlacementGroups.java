package com.beerpong.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Placement groups of one tournament, one per {@link PlacementRank} and always in rank order.
 */
public record PlacementGroups(List<PlacementGroup> groups) {

    public PlacementGroups {
        List<PlacementGroup> ordered = new ArrayList<>(groups);
        ordered.sort(Comparator.comparing(PlacementGroup::rank));
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).rank() == ordered.get(i - 1).rank()) {
                throw new IllegalArgumentException("Placement rank listed more than once: " + ordered.get(i).rank());
            }
        }
        groups = List.copyOf(ordered);
    }

    public static PlacementGroups of(
            Collection<String> firstPlace,
            Collection<String> secondPlace,
            Collection<String> thirdPlace
    ) {
        return new PlacementGroups(List.of(
                new PlacementGroup(PlacementRank.FIRST, toSet(firstPlace)),
                new PlacementGroup(PlacementRank.SECOND, toSet(secondPlace)),
                new PlacementGroup(PlacementRank.THIRD, toSet(thirdPlace))
        ));
    }

    public static PlacementGroups empty() {
        return of(null, null, null);
    }

    public Set<String> namesFor(PlacementRank rank) {
        return groups.stream()
                .filter(group -> group.rank() == rank)
                .findFirst()
                .map(PlacementGroup::names)
                .orElse(Set.of());
    }

    private static Set<String> toSet(Collection<String> names) {
        if (names == null) {
            return Set.of();
        }
        Set<String> result = new HashSet<>();
        for (String name : names) {
            if (name != null) {
                result.add(name);
            }
        }
        return result;
    }
}
