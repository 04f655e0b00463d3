package com.example.roster.engine;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ConstraintEvaluatorTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 7, 1);

    private final ShiftCatalog catalog = ShiftCatalog.defaults();
    private final ConstraintEvaluator evaluator = new ConstraintEvaluator(SchedulingPolicy.defaults());

    private ShiftSlot slot(long projectId, LocalDate date, ShiftType type) {
        return ShiftSlot.of(projectId, date, catalog.templateOf(type), 1);
    }

    private RunLedger ledger() {
        return new RunLedger(catalog, DayOfWeek.SUNDAY);
    }

    @Test
    void blockedDate_overridesAvailabilityAndPreference() {
        EmployeeSnapshot employee = EmployeeSnapshot.builder(1L, "A")
                .available(WeeklyShift.always())
                .prefers(ShiftType.MORNING, MONDAY)
                .blocked(MONDAY)
                .build();

        assertThat(evaluator.isEligible(employee, slot(1, MONDAY, ShiftType.MORNING), ledger())).isFalse();
        assertThat(evaluator.firstViolation(employee, slot(1, MONDAY, ShiftType.MORNING), ledger()))
                .contains("blocked-date");
    }

    @Test
    void missingAvailability_makesIneligible() {
        EmployeeSnapshot employee = EmployeeSnapshot.builder(1L, "A")
                .available(ShiftType.MORNING, DayOfWeek.TUESDAY)
                .build();

        assertThat(evaluator.firstViolation(employee, slot(1, MONDAY, ShiftType.MORNING), ledger()))
                .contains("availability");
        assertThat(evaluator.isEligible(employee, slot(1, MONDAY.plusDays(1), ShiftType.MORNING), ledger())).isTrue();
    }

    @Test
    void nightShift_blocksNextMorningOnlyWhenWindowsOverlap() {
        EmployeeSnapshot employee = EmployeeSnapshot.builder(1L, "A").available(WeeklyShift.always()).build();
        RunLedger ledger = ledger();
        ledger.book(1L, slot(1, MONDAY, ShiftType.NIGHT));

        // night 22:00-06:00 ends exactly when the next morning starts
        assertThat(evaluator.isEligible(employee, slot(2, MONDAY.plusDays(1), ShiftType.MORNING), ledger)).isTrue();
        assertThat(evaluator.firstViolation(employee, slot(2, MONDAY, ShiftType.NIGHT), ledger)).contains("overlap");
    }

    @Test
    void overlaps_usesHalfOpenWindows() {
        ShiftSlot morning = slot(1, MONDAY, ShiftType.MORNING);
        ShiftSlot afternoon = slot(2, MONDAY, ShiftType.AFTERNOON);
        ShiftSlot otherMorning = slot(2, MONDAY, ShiftType.MORNING);

        assertThat(ConstraintEvaluator.overlaps(morning, afternoon)).isFalse();
        assertThat(ConstraintEvaluator.overlaps(morning, otherMorning)).isTrue();
    }

    @Test
    void dailyLimit_appliesOnlyWhenConfigured() {
        EmployeeSnapshot employee = EmployeeSnapshot.builder(1L, "A").available(WeeklyShift.always()).build();
        RunLedger ledger = ledger();
        ledger.book(1L, slot(1, MONDAY, ShiftType.MORNING));
        ShiftSlot afternoon = slot(1, MONDAY, ShiftType.AFTERNOON);

        ConstraintEvaluator limited = new ConstraintEvaluator(SchedulingPolicy.defaults().withMaxShiftsPerDay(1));

        assertThat(evaluator.isEligible(employee, afternoon, ledger)).isTrue();
        assertThat(limited.firstViolation(employee, afternoon, ledger)).contains("daily-limit");
    }

    @Test
    void preferenceScore_addsBonusAndAvoidancePenalty() {
        EmployeeSnapshot employee = EmployeeSnapshot.builder(1L, "A")
                .available(WeeklyShift.always())
                .prefers(ShiftType.MORNING, DayOfWeek.MONDAY)
                .avoids(ShiftType.NIGHT)
                .avoids(ShiftType.MORNING)
                .build();

        assertThat(evaluator.preferenceScore(employee, slot(1, MONDAY, ShiftType.MORNING), ledger())).isEqualTo(2);
        assertThat(evaluator.preferenceScore(employee, slot(1, MONDAY, ShiftType.NIGHT), ledger())).isEqualTo(-2);
        assertThat(evaluator.preferenceScore(employee, slot(1, MONDAY, ShiftType.AFTERNOON), ledger())).isZero();
    }

    @Test
    void preferenceScore_penalizesExceedingWeeklyCap() {
        EmployeeSnapshot employee = EmployeeSnapshot.builder(1L, "A")
                .available(WeeklyShift.always())
                .maxWeeklyHours(16)
                .build();
        RunLedger ledger = ledger();
        ledger.book(1L, slot(1, MONDAY, ShiftType.MORNING));

        // 8h booked + 8h = 16h, not above the cap
        assertThat(evaluator.preferenceScore(employee, slot(1, MONDAY.plusDays(1), ShiftType.MORNING), ledger)).isZero();

        ledger.book(1L, slot(1, MONDAY.plusDays(1), ShiftType.MORNING));
        assertThat(evaluator.preferenceScore(employee, slot(1, MONDAY.plusDays(2), ShiftType.MORNING), ledger)).isEqualTo(-1);
        // the following week starts on Sunday and is counted separately
        assertThat(evaluator.preferenceScore(employee, slot(1, LocalDate.of(2024, 7, 7), ShiftType.MORNING), ledger)).isZero();
    }

    @Test
    void weeklyCapOfZero_disablesTheNearCapPenalty() {
        ConstraintEvaluator uncapped = new ConstraintEvaluator(SchedulingPolicy.defaults().withWeeklyHourCap(0));
        EmployeeSnapshot employee = EmployeeSnapshot.builder(1L, "A").available(WeeklyShift.always()).build();
        RunLedger ledger = ledger();
        for (int day = 0; day < 6; day++) {
            ledger.book(1L, slot(1, MONDAY.plusDays(day), ShiftType.AFTERNOON));
        }

        assertThat(evaluator.nearWeeklyCap(employee, slot(1, MONDAY, ShiftType.MORNING), ledger)).isTrue();
        assertThat(uncapped.nearWeeklyCap(employee, slot(1, MONDAY, ShiftType.MORNING), ledger)).isFalse();
    }
}
