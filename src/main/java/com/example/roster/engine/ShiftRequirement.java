package com.example.roster.engine;

import java.util.Objects;

/**
 * Staffing need of a project: {@code headcount} employees on every date the
 * recurrence matches.
 */
public record ShiftRequirement(Long projectId, ShiftType shiftType, Recurrence recurrence, int headcount) {

    public ShiftRequirement {
        Objects.requireNonNull(shiftType, "shiftType");
        Objects.requireNonNull(recurrence, "recurrence");
    }
}
