package com.example.roster.schedule;

import com.example.roster.costing.CostSummary;
import com.example.roster.engine.Assignment;
import com.example.roster.engine.CoveragePlan;
import com.example.roster.engine.PlanningWindow;
import com.example.roster.engine.UnfilledSlot;

import java.time.LocalDate;
import java.util.List;

/**
 * 一回のスケジュール計算結果。保存済みかどうかは {@code persisted} で示す。
 */
public record PlanResult(
        LocalDate start,
        LocalDate end,
        boolean persisted,
        List<Assignment> assignments,
        List<UnfilledSlot> unfilled,
        int totalShortfall,
        CostSummary cost) {

    static PlanResult of(PlanningWindow window, CoveragePlan plan, CostSummary cost, boolean persisted) {
        return new PlanResult(window.start(), window.end(), persisted, plan.assignments(), plan.unfilled(),
                plan.totalShortfall(), cost);
    }
}
