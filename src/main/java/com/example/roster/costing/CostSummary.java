package com.example.roster.costing;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Hour and cost aggregates, keyed by id in ascending order. All amounts carry two decimals.
 */
public record CostSummary(
        Map<Long, EmployeeCost> employees,
        Map<Long, ProjectCost> projects,
        BigDecimal totalHours,
        BigDecimal totalCost,
        int assignmentCount) {

    public BigDecimal employeeCostSum() {
        return employees.values().stream().map(EmployeeCost::cost).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal projectCostSum() {
        return projects.values().stream().map(ProjectCost::cost).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
