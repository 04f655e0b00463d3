package com.example.roster.engine;

import com.example.roster.exception.ScheduleValidationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive date range of a scheduling run.
 */
public record PlanningWindow(LocalDate start, LocalDate end) {

    public PlanningWindow {
        if (start == null || end == null) {
            throw new ScheduleValidationException(ScheduleValidationException.INVALID_WINDOW,
                    "Planning window needs both a start and an end date", start, end);
        }
        if (end.isBefore(start)) {
            throw new ScheduleValidationException(ScheduleValidationException.INVALID_WINDOW,
                    "Planning window end " + end + " is before start " + start, start, end);
        }
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            dates.add(day);
        }
        return dates;
    }
}
