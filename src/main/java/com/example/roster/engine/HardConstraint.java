package com.example.roster.engine;

/**
 * A rule a candidate must pass to be booked into a slot.
 */
@FunctionalInterface
public interface HardConstraint {

    boolean test(EmployeeSnapshot employee, ShiftSlot slot, RunLedger ledger);
}
