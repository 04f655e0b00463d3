package com.example.roster.engine;

import com.example.roster.exception.ScheduleValidationException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which dates a shift requirement applies to.
 */
public sealed interface Recurrence permits Recurrence.Weekly, Recurrence.DateRange {

    boolean matches(LocalDate date);

    /**
     * Throws {@link ScheduleValidationException} when the rule can never be expanded.
     */
    void validate();

    static Recurrence weekly(DayOfWeek... days) {
        return new Weekly(days.length == 0 ? Set.of() : EnumSet.of(days[0], days));
    }

    static Recurrence everyDay() {
        return new Weekly(EnumSet.allOf(DayOfWeek.class));
    }

    static Recurrence between(LocalDate from, LocalDate to) {
        return new DateRange(from, to);
    }

    record Weekly(Set<DayOfWeek> days) implements Recurrence {

        public Weekly {
            days = days == null ? Set.of() : Set.copyOf(days);
        }

        @Override
        public boolean matches(LocalDate date) {
            return days.contains(date.getDayOfWeek());
        }

        @Override
        public void validate() {
            if (days.isEmpty()) {
                throw new ScheduleValidationException(ScheduleValidationException.INVALID_RECURRENCE,
                        "Weekly recurrence needs at least one weekday");
            }
        }
    }

    record DateRange(LocalDate from, LocalDate to) implements Recurrence {

        @Override
        public boolean matches(LocalDate date) {
            return from != null && to != null && !date.isBefore(from) && !date.isAfter(to);
        }

        @Override
        public void validate() {
            if (from == null || to == null || to.isBefore(from)) {
                throw new ScheduleValidationException(ScheduleValidationException.INVALID_RECURRENCE,
                        "Date range recurrence needs from <= to, got " + from + " .. " + to, from, to);
            }
        }
    }
}
