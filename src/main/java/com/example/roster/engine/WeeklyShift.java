package com.example.roster.engine;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A shift type on a weekday, used for availability and weekly preferences.
 */
public record WeeklyShift(ShiftType shiftType, DayOfWeek dayOfWeek) {

    public WeeklyShift {
        Objects.requireNonNull(shiftType, "shiftType");
        Objects.requireNonNull(dayOfWeek, "dayOfWeek");
    }

    public static Set<WeeklyShift> everyDay(ShiftType shiftType) {
        Set<WeeklyShift> result = new HashSet<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            result.add(new WeeklyShift(shiftType, day));
        }
        return result;
    }

    public static Set<WeeklyShift> allShifts(Set<DayOfWeek> days) {
        Set<WeeklyShift> result = new HashSet<>();
        for (ShiftType type : ShiftType.values()) {
            for (DayOfWeek day : days) {
                result.add(new WeeklyShift(type, day));
            }
        }
        return result;
    }

    public static Set<WeeklyShift> always() {
        return allShifts(EnumSet.allOf(DayOfWeek.class));
    }
}
