package com.example.roster.engine;

import com.example.roster.exception.ScheduleValidationException;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * Cross-reference checks on a request. Requirement shape (headcount, recurrence)
 * is checked by {@link RequirementExpander}.
 */
final class RequestValidator {

    private RequestValidator() {
    }

    static void validate(SchedulingRequest request) {
        if (request.window() == null) {
            throw new ScheduleValidationException(ScheduleValidationException.INVALID_WINDOW,
                    "Planning window is required");
        }

        Set<Long> employeeIds = new HashSet<>();
        for (EmployeeSnapshot employee : request.employees()) {
            if (!employeeIds.add(employee.id())) {
                throw new ScheduleValidationException(ScheduleValidationException.DUPLICATE_EMPLOYEE,
                        "Employee id " + employee.id() + " appears more than once", employee.id());
            }
        }

        Set<Long> projectIds = new HashSet<>();
        for (ProjectSnapshot project : request.projects()) {
            if (!projectIds.add(project.id())) {
                throw new ScheduleValidationException(ScheduleValidationException.DUPLICATE_PROJECT,
                        "Project id " + project.id() + " appears more than once", project.id());
            }
            if (project.hourlyRate().compareTo(BigDecimal.ZERO) < 0) {
                throw new ScheduleValidationException(ScheduleValidationException.INVALID_RATE,
                        "Project " + project.id() + " has a negative hourly rate", project.id(), project.hourlyRate());
            }
        }

        for (ProjectSnapshot project : request.projects()) {
            for (ShiftRequirement requirement : project.requirements()) {
                if (requirement.projectId() == null || !projectIds.contains(requirement.projectId())) {
                    throw new ScheduleValidationException(ScheduleValidationException.UNKNOWN_PROJECT,
                            "Requirement of project " + project.id() + " references unknown project "
                                    + requirement.projectId(), project.id(), requirement.projectId());
                }
                if (!requirement.projectId().equals(project.id())) {
                    throw new ScheduleValidationException(ScheduleValidationException.REQUIREMENT_PROJECT_MISMATCH,
                            "Requirement held by project " + project.id() + " belongs to project "
                                    + requirement.projectId(), project.id(), requirement.projectId());
                }
            }
        }

        for (Assignment existing : request.existingAssignments()) {
            if (!employeeIds.contains(existing.employeeId())) {
                throw new ScheduleValidationException(ScheduleValidationException.UNKNOWN_EMPLOYEE,
                        "Existing assignment references unknown employee " + existing.employeeId(),
                        existing.employeeId());
            }
            if (!projectIds.contains(existing.projectId())) {
                throw new ScheduleValidationException(ScheduleValidationException.UNKNOWN_PROJECT,
                        "Existing assignment references unknown project " + existing.projectId(),
                        existing.projectId());
            }
        }
    }
}
