package com.example.roster.constraint;

import com.example.roster.engine.ShiftType;

import java.time.DayOfWeek;
import java.time.LocalDate;

public record EmployeeConstraintDto(
        Long id,
        Long employeeId,
        EmployeeConstraint.ConstraintKind kind,
        String kindName,
        String shiftType,
        DayOfWeek dayOfWeek,
        LocalDate date,
        String reason) {

    public static EmployeeConstraintDto from(EmployeeConstraint constraint) {
        ShiftType type = constraint.getShiftType();
        return new EmployeeConstraintDto(
                constraint.getId(),
                constraint.getEmployee().getId(),
                constraint.getKind(),
                constraint.getKind().getDisplayName(),
                type == null ? null : type.getKey(),
                constraint.getDayOfWeek(),
                constraint.getDate(),
                constraint.getReason()
        );
    }
}
