package com.example.roster.engine;

import com.example.roster.exception.OverlapConflictException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunLedgerTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 7, 1);

    private final ShiftCatalog catalog = ShiftCatalog.defaults();
    private final RunLedger ledger = new RunLedger(catalog, DayOfWeek.SUNDAY);

    private ShiftSlot slot(long projectId, LocalDate date, ShiftType type) {
        return ShiftSlot.of(projectId, date, catalog.templateOf(type), 1);
    }

    @Test
    void book_overlappingSlot_throws() {
        ledger.book(1L, slot(1, MONDAY, ShiftType.MORNING));

        assertThatThrownBy(() -> ledger.book(1L, slot(2, MONDAY, ShiftType.MORNING)))
                .isInstanceOf(OverlapConflictException.class)
                .satisfies(e -> {
                    OverlapConflictException conflict = (OverlapConflictException) e;
                    assertThat(conflict.getEmployeeId()).isEqualTo(1L);
                    assertThat(conflict.getConflictingBooking().projectId()).isEqualTo(1L);
                    assertThat(conflict.getConflictingBooking().shiftType()).isEqualTo(ShiftType.MORNING);
                    assertThat(conflict.getConflictingBooking().date()).isEqualTo(MONDAY);
                });
        assertThat(ledger.bookingsOf(1L)).hasSize(1);
    }

    @Test
    void seed_countsTowardCoverageAndHours_butSkipsCancelled() {
        ledger.seed(new Assignment(1L, 1L, MONDAY, ShiftType.NIGHT, AssignmentStatus.REPORTED));
        ledger.seed(new Assignment(2L, 1L, MONDAY, ShiftType.NIGHT, AssignmentStatus.CANCELLED));

        assertThat(ledger.priorCoverageOf(slot(1, MONDAY, ShiftType.NIGHT))).isEqualTo(1);
        assertThat(ledger.bookedMinutes(1L)).isEqualTo(480);
        assertThat(ledger.bookedMinutes(2L)).isZero();
        assertThat(ledger.hasOverlap(1L, slot(3, MONDAY.plusDays(1), ShiftType.MORNING))).isFalse();
        assertThat(ledger.shiftsOn(1L, MONDAY)).isEqualTo(1);
    }

    @Test
    void weekMinutes_areBucketedByConfiguredWeekStart() {
        ledger.book(1L, slot(1, LocalDate.of(2024, 7, 6), ShiftType.MORNING));
        ledger.book(1L, slot(1, LocalDate.of(2024, 7, 7), ShiftType.MORNING));

        assertThat(ledger.weekMinutes(1L, MONDAY)).isEqualTo(480);
        assertThat(ledger.weekMinutes(1L, LocalDate.of(2024, 7, 8))).isEqualTo(480);
        assertThat(ledger.weekStartOf(LocalDate.of(2024, 7, 6))).isEqualTo(LocalDate.of(2024, 6, 30));
    }
}
