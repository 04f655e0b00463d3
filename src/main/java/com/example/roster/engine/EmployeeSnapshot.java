package com.example.roster.engine;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only view of an employee and their constraints for one scheduling run.
 * Blocked dates win over availability and preferences.
 *
 * @param maxWeeklyHours personal soft cap, or {@code null} to use the policy cap
 */
public record EmployeeSnapshot(
        Long id,
        String name,
        boolean active,
        Set<WeeklyShift> availability,
        Set<LocalDate> blockedDates,
        Set<WeeklyShift> preferredWeekly,
        Set<DatedShift> preferredDates,
        Set<ShiftType> avoidedShiftTypes,
        Integer maxWeeklyHours) {

    public EmployeeSnapshot {
        Objects.requireNonNull(id, "id");
        availability = Set.copyOf(availability);
        blockedDates = Set.copyOf(blockedDates);
        preferredWeekly = Set.copyOf(preferredWeekly);
        preferredDates = Set.copyOf(preferredDates);
        avoidedShiftTypes = Set.copyOf(avoidedShiftTypes);
    }

    public static Builder builder(Long id, String name) {
        return new Builder(id, name);
    }

    public boolean isBlockedOn(LocalDate date) {
        return blockedDates.contains(date);
    }

    public boolean isAvailableFor(ShiftType type, LocalDate date) {
        return availability.contains(new WeeklyShift(type, date.getDayOfWeek()));
    }

    public boolean prefers(ShiftType type, LocalDate date) {
        return preferredDates.contains(new DatedShift(type, date))
                || preferredWeekly.contains(new WeeklyShift(type, date.getDayOfWeek()));
    }

    public boolean avoids(ShiftType type) {
        return avoidedShiftTypes.contains(type);
    }

    public static final class Builder {
        private final Long id;
        private final String name;
        private boolean active = true;
        private final Set<WeeklyShift> availability = new HashSet<>();
        private final Set<LocalDate> blockedDates = new HashSet<>();
        private final Set<WeeklyShift> preferredWeekly = new HashSet<>();
        private final Set<DatedShift> preferredDates = new HashSet<>();
        private final Set<ShiftType> avoided = new HashSet<>();
        private Integer maxWeeklyHours;

        private Builder(Long id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder available(Collection<WeeklyShift> shifts) {
            availability.addAll(shifts);
            return this;
        }

        public Builder available(ShiftType type, DayOfWeek... days) {
            for (DayOfWeek day : days) {
                availability.add(new WeeklyShift(type, day));
            }
            return this;
        }

        public Builder blocked(LocalDate... dates) {
            blockedDates.addAll(List.of(dates));
            return this;
        }

        public Builder prefers(ShiftType type, DayOfWeek day) {
            preferredWeekly.add(new WeeklyShift(type, day));
            return this;
        }

        public Builder prefers(ShiftType type, LocalDate date) {
            preferredDates.add(new DatedShift(type, date));
            return this;
        }

        public Builder avoids(ShiftType type) {
            avoided.add(type);
            return this;
        }

        public Builder maxWeeklyHours(Integer hours) {
            this.maxWeeklyHours = hours;
            return this;
        }

        public EmployeeSnapshot build() {
            return new EmployeeSnapshot(id, name, active, availability, blockedDates,
                    preferredWeekly, preferredDates, avoided, maxWeeklyHours);
        }
    }
}
