package com.example.roster.exception;

import com.example.roster.engine.RunLedger;

/**
 * An employee was about to be booked into two overlapping shifts. The engine
 * filters overlapping candidates before booking, so reaching this is a bug.
 */
public class OverlapConflictException extends RuntimeException {

    private final Long employeeId;
    private final RunLedger.Booking conflictingBooking;

    public OverlapConflictException(String message, Long employeeId, RunLedger.Booking conflictingBooking) {
        super(message);
        this.employeeId = employeeId;
        this.conflictingBooking = conflictingBooking;
    }

    public Long getEmployeeId() {
        return employeeId;
    }

    public RunLedger.Booking getConflictingBooking() {
        return conflictingBooking;
    }
}
