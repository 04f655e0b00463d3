package com.example.roster.engine;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * One (date, shift type, project) unit of coverage with its absolute time window.
 */
public record ShiftSlot(
        Long projectId,
        LocalDate date,
        ShiftType shiftType,
        int requiredCount,
        LocalDateTime start,
        LocalDateTime end) {

    /** date, then morning &lt; afternoon &lt; night, then project id. */
    public static final Comparator<ShiftSlot> EXPANSION_ORDER = Comparator
            .comparing(ShiftSlot::date)
            .thenComparing(ShiftSlot::shiftType)
            .thenComparing(ShiftSlot::projectId);

    public static ShiftSlot of(Long projectId, LocalDate date, ShiftTemplate template, int requiredCount) {
        return new ShiftSlot(projectId, date, template.type(), requiredCount,
                template.startOn(date), template.endOn(date));
    }

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }

    public boolean overlaps(ShiftSlot other) {
        return overlaps(other.start, other.end);
    }

    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return start.isBefore(otherEnd) && otherStart.isBefore(end);
    }

    public boolean sameSlotAs(Assignment assignment) {
        return projectId.equals(assignment.projectId())
                && date.equals(assignment.date())
                && shiftType == assignment.shiftType();
    }
}
