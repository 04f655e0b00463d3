package com.example.roster.engine;

import java.util.List;

/**
 * Result of one run: new assignments in slot order and the slots left short.
 */
public record CoveragePlan(List<Assignment> assignments, List<UnfilledSlot> unfilled) {

    public CoveragePlan {
        assignments = List.copyOf(assignments);
        unfilled = List.copyOf(unfilled);
    }

    public boolean isFullyCovered() {
        return unfilled.isEmpty();
    }

    public int totalShortfall() {
        return unfilled.stream().mapToInt(UnfilledSlot::shortfall).sum();
    }
}
