package com.example.roster.schedule;

import com.example.roster.engine.AssignmentStatus;

import java.time.LocalDate;
import java.time.LocalTime;

public record ShiftAssignmentDto(
        Long id,
        LocalDate workDate,
        String shiftType,
        LocalTime startTime,
        LocalTime endTime,
        Long employeeId,
        String employeeName,
        Long projectId,
        String projectName,
        AssignmentStatus status) {

    public static ShiftAssignmentDto from(ShiftAssignment assignment) {
        return new ShiftAssignmentDto(
                assignment.getId(),
                assignment.getWorkDate(),
                assignment.getShiftType().getKey(),
                assignment.getStartTime(),
                assignment.getEndTime(),
                assignment.getEmployee().getId(),
                assignment.getEmployee().getName(),
                assignment.getProject().getId(),
                assignment.getProject().getName(),
                assignment.getStatus()
        );
    }
}
