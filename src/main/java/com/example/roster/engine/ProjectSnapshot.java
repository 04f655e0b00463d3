package com.example.roster.engine;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

public record ProjectSnapshot(
        Long id,
        String name,
        BigDecimal hourlyRate,
        boolean active,
        List<ShiftRequirement> requirements) {

    public ProjectSnapshot {
        Objects.requireNonNull(id, "id");
        hourlyRate = hourlyRate == null ? BigDecimal.ZERO : hourlyRate;
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }
}
