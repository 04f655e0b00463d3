package com.example.roster.engine;

import com.example.roster.exception.OverlapConflictException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable bookings of a single run: who works when, how many minutes so far,
 * and how many seats of each slot were already covered before the run.
 * Not thread-safe; owned by one {@link SchedulingRun}.
 */
public final class RunLedger {

    public record Booking(Long projectId, LocalDate date, ShiftType shiftType,
                          LocalDateTime start, LocalDateTime end) {

        boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
            return start.isBefore(otherEnd) && otherStart.isBefore(end);
        }
    }

    private record SlotKey(Long projectId, LocalDate date, ShiftType shiftType) {
    }

    private record WeekKey(Long employeeId, LocalDate weekStart) {
    }

    private final ShiftCatalog catalog;
    private final DayOfWeek weekStart;
    private final Map<Long, List<Booking>> bookingsByEmployee = new HashMap<>();
    private final Map<Long, Long> minutesByEmployee = new HashMap<>();
    private final Map<WeekKey, Long> minutesByWeek = new HashMap<>();
    private final Map<SlotKey, Integer> priorCoverage = new HashMap<>();

    public RunLedger(ShiftCatalog catalog, DayOfWeek weekStart) {
        this.catalog = catalog;
        this.weekStart = weekStart;
    }

    /**
     * Records an assignment that existed before the run. Conflicts inside the
     * prior data are not checked here.
     */
    public void seed(Assignment existing) {
        if (!existing.status().counts()) {
            return;
        }
        ShiftTemplate template = catalog.templateOf(existing.shiftType());
        Booking booking = new Booking(existing.projectId(), existing.date(), existing.shiftType(),
                template.startOn(existing.date()), template.endOn(existing.date()));
        add(existing.employeeId(), booking, template.durationMinutes());
        priorCoverage.merge(new SlotKey(existing.projectId(), existing.date(), existing.shiftType()), 1, Integer::sum);
    }

    /**
     * Books an employee into a slot.
     *
     * @throws OverlapConflictException if the employee already works during the slot
     */
    public void book(Long employeeId, ShiftSlot slot) {
        for (Booking booking : bookingsOf(employeeId)) {
            if (booking.overlaps(slot.start(), slot.end())) {
                throw new OverlapConflictException("Employee " + employeeId + " is already booked on "
                        + booking.date() + " " + booking.shiftType() + " which overlaps " + slot,
                        employeeId, booking);
            }
        }
        Booking booking = new Booking(slot.projectId(), slot.date(), slot.shiftType(), slot.start(), slot.end());
        add(employeeId, booking, slot.durationMinutes());
    }

    private void add(Long employeeId, Booking booking, long minutes) {
        bookingsByEmployee.computeIfAbsent(employeeId, k -> new ArrayList<>()).add(booking);
        minutesByEmployee.merge(employeeId, minutes, Long::sum);
        minutesByWeek.merge(new WeekKey(employeeId, weekStartOf(booking.date())), minutes, Long::sum);
    }

    public boolean hasOverlap(Long employeeId, ShiftSlot slot) {
        for (Booking booking : bookingsOf(employeeId)) {
            if (booking.overlaps(slot.start(), slot.end())) {
                return true;
            }
        }
        return false;
    }

    public int shiftsOn(Long employeeId, LocalDate date) {
        int count = 0;
        for (Booking booking : bookingsOf(employeeId)) {
            if (booking.date().equals(date)) {
                count++;
            }
        }
        return count;
    }

    public long bookedMinutes(Long employeeId) {
        return minutesByEmployee.getOrDefault(employeeId, 0L);
    }

    public long weekMinutes(Long employeeId, LocalDate date) {
        return minutesByWeek.getOrDefault(new WeekKey(employeeId, weekStartOf(date)), 0L);
    }

    public int priorCoverageOf(ShiftSlot slot) {
        return priorCoverage.getOrDefault(new SlotKey(slot.projectId(), slot.date(), slot.shiftType()), 0);
    }

    public List<Booking> bookingsOf(Long employeeId) {
        return bookingsByEmployee.getOrDefault(employeeId, List.of());
    }

    LocalDate weekStartOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(weekStart));
    }
}
