package com.example.roster.engine;

public enum AssignmentStatus {
    /** Created by the engine. */
    ASSIGNED,
    /** Entered by the employee. */
    REPORTED,
    CANCELLED;

    public boolean counts() {
        return this != CANCELLED;
    }
}
