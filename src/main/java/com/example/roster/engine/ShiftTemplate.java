package com.example.roster.engine;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Concrete time window of a shift type. An end at or before the start means the
 * shift finishes on the following day.
 */
public record ShiftTemplate(ShiftType type, LocalTime start, LocalTime end) {

    public ShiftTemplate {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static ShiftTemplate defaultFor(ShiftType type) {
        return new ShiftTemplate(type, type.getDefaultStart(), type.getDefaultEnd());
    }

    public boolean crossesMidnight() {
        return !end.isAfter(start);
    }

    public long durationMinutes() {
        long minutes = Duration.between(start, end).toMinutes();
        return crossesMidnight() ? minutes + 24 * 60 : minutes;
    }

    public LocalDateTime startOn(LocalDate date) {
        return date.atTime(start);
    }

    public LocalDateTime endOn(LocalDate date) {
        return crossesMidnight() ? date.plusDays(1).atTime(end) : date.atTime(end);
    }
}
