package com.example.roster.project;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public record ProjectDto(Long id, String name, BigDecimal hourlyRate, boolean active, List<RequirementDto> requirements) {

    public record RequirementDto(
            Long id,
            String shiftType,
            int headcount,
            ProjectShiftRequirement.RecurrenceType recurrence,
            Set<DayOfWeek> daysOfWeek,
            LocalDate from,
            LocalDate to) {

        static RequirementDto from(ProjectShiftRequirement requirement) {
            return new RequirementDto(
                    requirement.getId(),
                    requirement.getShiftType().getKey(),
                    requirement.getHeadcount(),
                    requirement.getRecurrenceType(),
                    new TreeSet<>(requirement.getDaysOfWeek()),
                    requirement.getRangeStart(),
                    requirement.getRangeEnd());
        }
    }

    public static ProjectDto from(Project project) {
        return new ProjectDto(
                project.getId(),
                project.getName(),
                project.getHourlyRate(),
                Boolean.TRUE.equals(project.getActive()),
                project.getRequirements().stream().map(RequirementDto::from).toList());
    }
}
