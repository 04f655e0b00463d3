package com.example.roster.engine;

import java.time.LocalDate;
import java.util.Objects;

public record Assignment(Long employeeId, Long projectId, LocalDate date, ShiftType shiftType,
                         AssignmentStatus status) {

    public Assignment {
        Objects.requireNonNull(employeeId, "employeeId");
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(shiftType, "shiftType");
        Objects.requireNonNull(status, "status");
    }

    public static Assignment assigned(Long employeeId, ShiftSlot slot) {
        return new Assignment(employeeId, slot.projectId(), slot.date(), slot.shiftType(), AssignmentStatus.ASSIGNED);
    }
}
