package com.example.roster.engine;

import java.util.List;

/**
 * Snapshot handed to one run.
 *
 * @param existingAssignments bookings that already exist (earlier plans, self-reports); cancelled ones are ignored
 */
public record SchedulingRequest(
        List<EmployeeSnapshot> employees,
        List<ProjectSnapshot> projects,
        PlanningWindow window,
        List<Assignment> existingAssignments) {

    public SchedulingRequest {
        employees = employees == null ? List.of() : List.copyOf(employees);
        projects = projects == null ? List.of() : List.copyOf(projects);
        existingAssignments = existingAssignments == null ? List.of() : List.copyOf(existingAssignments);
    }

    public SchedulingRequest(List<EmployeeSnapshot> employees, List<ProjectSnapshot> projects, PlanningWindow window) {
        this(employees, projects, window, List.of());
    }
}
