package com.example.roster.engine;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * Weights and limits of the soft ranking plus the optional daily shift limit.
 *
 * @param preferredBonus   added when a slot matches a preferred shift entry
 * @param avoidancePenalty subtracted when the shift type is avoided and not preferred
 * @param nearCapPenalty   subtracted when the slot would push the week over the hour cap
 * @param weeklyHourCap    default soft cap per employee and week, 0 disables it
 * @param maxShiftsPerDay  hard limit of shifts per employee and date, 0 means no limit
 * @param weekStart        first day of the week used for the weekly cap
 */
public record SchedulingPolicy(
        int preferredBonus,
        int avoidancePenalty,
        int nearCapPenalty,
        int weeklyHourCap,
        int maxShiftsPerDay,
        DayOfWeek weekStart) {

    public SchedulingPolicy {
        Objects.requireNonNull(weekStart, "weekStart");
        if (weeklyHourCap < 0 || maxShiftsPerDay < 0) {
            throw new IllegalArgumentException("weeklyHourCap and maxShiftsPerDay must not be negative");
        }
    }

    public static SchedulingPolicy defaults() {
        return new SchedulingPolicy(2, 2, 1, 40, 0, DayOfWeek.SUNDAY);
    }

    public SchedulingPolicy withWeeklyHourCap(int hours) {
        return new SchedulingPolicy(preferredBonus, avoidancePenalty, nearCapPenalty, hours, maxShiftsPerDay, weekStart);
    }

    public SchedulingPolicy withMaxShiftsPerDay(int limit) {
        return new SchedulingPolicy(preferredBonus, avoidancePenalty, nearCapPenalty, weeklyHourCap, limit, weekStart);
    }
}
