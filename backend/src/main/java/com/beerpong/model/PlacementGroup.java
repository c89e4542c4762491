package com.beerpong.model;

import java.util.Set;

public record PlacementGroup(
        PlacementRank rank,
        Set<String> names
) {
    public PlacementGroup {
        names = names == null ? Set.of() : Set.copyOf(names);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }
}
