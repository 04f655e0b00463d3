package com.example.roster.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Eligibility and preference checks for a candidate employee on a slot.
 * Hard constraints are AND-ed; soft signals add up to the preference score.
 */
public class ConstraintEvaluator {

    private final SchedulingPolicy policy;
    private final Map<String, HardConstraint> hardConstraints = new LinkedHashMap<>();

    public ConstraintEvaluator(SchedulingPolicy policy) {
        this.policy = policy;
        hardConstraints.put("blocked-date", (employee, slot, ledger) -> !employee.isBlockedOn(slot.date()));
        hardConstraints.put("availability",
                (employee, slot, ledger) -> employee.isAvailableFor(slot.shiftType(), slot.date()));
        hardConstraints.put("overlap", (employee, slot, ledger) -> !ledger.hasOverlap(employee.id(), slot));
        if (policy.maxShiftsPerDay() > 0) {
            hardConstraints.put("daily-limit",
                    (employee, slot, ledger) -> ledger.shiftsOn(employee.id(), slot.date()) < policy.maxShiftsPerDay());
        }
    }

    public boolean isEligible(EmployeeSnapshot employee, ShiftSlot slot, RunLedger ledger) {
        return firstViolation(employee, slot, ledger).isEmpty();
    }

    /**
     * Name of the first hard constraint the candidate fails, if any.
     */
    public Optional<String> firstViolation(EmployeeSnapshot employee, ShiftSlot slot, RunLedger ledger) {
        for (Map.Entry<String, HardConstraint> entry : hardConstraints.entrySet()) {
            if (!entry.getValue().test(employee, slot, ledger)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public int preferenceScore(EmployeeSnapshot employee, ShiftSlot slot, RunLedger ledger) {
        int score = 0;
        boolean preferred = employee.prefers(slot.shiftType(), slot.date());
        if (preferred) {
            score += policy.preferredBonus();
        } else if (employee.avoids(slot.shiftType())) {
            score -= policy.avoidancePenalty();
        }
        if (nearWeeklyCap(employee, slot, ledger)) {
            score -= policy.nearCapPenalty();
        }
        return score;
    }

    boolean nearWeeklyCap(EmployeeSnapshot employee, ShiftSlot slot, RunLedger ledger) {
        int capHours = employee.maxWeeklyHours() != null ? employee.maxWeeklyHours() : policy.weeklyHourCap();
        if (capHours <= 0) {
            return false;
        }
        long projected = ledger.weekMinutes(employee.id(), slot.date()) + slot.durationMinutes();
        return projected > capHours * 60L;
    }

    public static boolean overlaps(ShiftSlot a, ShiftSlot b) {
        return a.overlaps(b);
    }
}
