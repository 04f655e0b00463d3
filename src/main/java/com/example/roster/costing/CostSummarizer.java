package com.example.roster.costing;

import com.example.roster.engine.Assignment;
import com.example.roster.engine.ProjectSnapshot;
import com.example.roster.engine.ShiftCatalog;
import com.example.roster.exception.ScheduleValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Aggregates hours and cost of assignments per employee and per project.
 * <p>
 * Minutes and minute-rate products are summed exactly; conversion to hours and
 * rounding to two decimals happen once per aggregate, so per-entity results
 * never carry compounded rounding error. Cancelled assignments are skipped.
 */
public class CostSummarizer {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private final ShiftCatalog catalog;

    public CostSummarizer(ShiftCatalog catalog) {
        this.catalog = catalog;
    }

    private static final class Accumulator {
        long minutes;
        BigDecimal minuteCost = BigDecimal.ZERO;
        int assignments;
        final Set<Long> employeeIds = new HashSet<>();

        void add(long shiftMinutes, BigDecimal rate, Long employeeId) {
            minutes += shiftMinutes;
            minuteCost = minuteCost.add(rate.multiply(BigDecimal.valueOf(shiftMinutes)));
            assignments++;
            employeeIds.add(employeeId);
        }

        BigDecimal hours() {
            return toHours(minutes);
        }

        BigDecimal cost() {
            return toCost(minuteCost);
        }
    }

    public CostSummary summarize(Collection<Assignment> assignments, Collection<ProjectSnapshot> projects) {
        Map<Long, ProjectSnapshot> projectsById = new HashMap<>();
        for (ProjectSnapshot project : projects) {
            projectsById.put(project.id(), project);
        }

        Map<Long, Accumulator> byEmployee = new TreeMap<>();
        Map<Long, Accumulator> byProject = new TreeMap<>();
        Accumulator total = new Accumulator();

        for (Assignment assignment : assignments) {
            if (!assignment.status().counts()) {
                continue;
            }
            ProjectSnapshot project = projectsById.get(assignment.projectId());
            if (project == null) {
                throw new ScheduleValidationException(ScheduleValidationException.UNKNOWN_PROJECT,
                        "Assignment references unknown project " + assignment.projectId(), assignment.projectId());
            }
            long minutes = catalog.durationMinutes(assignment.shiftType());
            BigDecimal rate = project.hourlyRate();
            byEmployee.computeIfAbsent(assignment.employeeId(), k -> new Accumulator())
                    .add(minutes, rate, assignment.employeeId());
            byProject.computeIfAbsent(assignment.projectId(), k -> new Accumulator())
                    .add(minutes, rate, assignment.employeeId());
            total.add(minutes, rate, assignment.employeeId());
        }

        Map<Long, EmployeeCost> employeeCosts = new LinkedHashMap<>();
        byEmployee.forEach((id, acc) ->
                employeeCosts.put(id, new EmployeeCost(id, acc.hours(), acc.cost(), acc.assignments)));

        Map<Long, ProjectCost> projectCosts = new LinkedHashMap<>();
        byProject.forEach((id, acc) -> projectCosts.put(id, new ProjectCost(id, projectsById.get(id).name(),
                acc.hours(), acc.cost(), acc.assignments, acc.employeeIds.size())));

        return new CostSummary(
                Collections.unmodifiableMap(employeeCosts),
                Collections.unmodifiableMap(projectCosts),
                total.hours(),
                total.cost(),
                total.assignments);
    }

    public static BigDecimal toHours(long minutes) {
        return BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);
    }

    /** Cost of {@code minutes} worked at an hourly {@code rate}, rounded to two decimals. */
    public static BigDecimal costOf(BigDecimal rate, long minutes) {
        return toCost(rate.multiply(BigDecimal.valueOf(minutes)));
    }

    private static BigDecimal toCost(BigDecimal minuteCost) {
        return minuteCost.divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);
    }
}
