package com.example.roster.exception;

/**
 * Malformed or inconsistent scheduling input. Raised before any assignment is
 * made, so a run that throws it never yields a partial plan.
 */
public class ScheduleValidationException extends BusinessException {

    public static final String INVALID_WINDOW = "INVALID_WINDOW";
    public static final String INVALID_HEADCOUNT = "INVALID_HEADCOUNT";
    public static final String INVALID_RECURRENCE = "INVALID_RECURRENCE";
    public static final String INVALID_RATE = "INVALID_RATE";
    public static final String INVALID_SHIFT_TEMPLATE = "INVALID_SHIFT_TEMPLATE";
    public static final String UNKNOWN_PROJECT = "UNKNOWN_PROJECT";
    public static final String REQUIREMENT_PROJECT_MISMATCH = "REQUIREMENT_PROJECT_MISMATCH";
    public static final String UNKNOWN_EMPLOYEE = "UNKNOWN_EMPLOYEE";
    public static final String DUPLICATE_EMPLOYEE = "DUPLICATE_EMPLOYEE";
    public static final String DUPLICATE_PROJECT = "DUPLICATE_PROJECT";

    public ScheduleValidationException(String errorCode, String message, Object... parameters) {
        super(errorCode, message, parameters);
    }
}
