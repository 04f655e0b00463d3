package com.example.roster.engine;

import java.time.LocalDate;
import java.util.Objects;

public record DatedShift(ShiftType shiftType, LocalDate date) {

    public DatedShift {
        Objects.requireNonNull(shiftType, "shiftType");
        Objects.requireNonNull(date, "date");
    }
}
