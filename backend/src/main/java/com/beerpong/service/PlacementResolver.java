package com.beerpong.service;

import com.beerpong.model.PlacementGroup;
import com.beerpong.model.PlacementGroups;
import com.beerpong.model.PlacementRank;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class PlacementResolver {

    /**
     * Scans the groups in rank order; the first group naming the participant wins, so a name
     * listed under both first and second place resolves to first.
     *
     * @return the rank, or empty when the participant is in no group
     */
    public Optional<PlacementRank> rankOf(String name, PlacementGroups placementGroups) {
        if (placementGroups == null) {
            return Optional.empty();
        }
        for (PlacementGroup group : placementGroups.groups()) {
            if (group.contains(name)) {
                return Optional.of(group.rank());
            }
        }
        return Optional.empty();
    }
}
