package com.example.roster.engine;

import com.example.roster.exception.ScheduleValidationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the requirements of active projects into concrete slots for a window.
 */
public class RequirementExpander {

    private record SlotKey(Long projectId, LocalDate date, ShiftType shiftType) {
    }

    private final ShiftCatalog catalog;

    public RequirementExpander(ShiftCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Expands every requirement of every active project.
     * Requirements of one project that hit the same date and shift type are merged
     * into a single slot whose headcounts add up.
     *
     * @return slots in {@link ShiftSlot#EXPANSION_ORDER}
     * @throws ScheduleValidationException on a non-positive headcount or a malformed recurrence
     */
    public List<ShiftSlot> expand(List<ProjectSnapshot> projects, PlanningWindow window) {
        for (ProjectSnapshot project : projects) {
            if (project.active()) {
                project.requirements().forEach(this::validate);
            }
        }

        Map<SlotKey, Integer> headcounts = new LinkedHashMap<>();
        List<LocalDate> dates = window.dates();
        for (ProjectSnapshot project : projects) {
            if (!project.active()) {
                continue;
            }
            for (ShiftRequirement requirement : project.requirements()) {
                for (LocalDate date : dates) {
                    if (requirement.recurrence().matches(date)) {
                        headcounts.merge(new SlotKey(requirement.projectId(), date, requirement.shiftType()),
                                requirement.headcount(), Integer::sum);
                    }
                }
            }
        }

        List<ShiftSlot> slots = new ArrayList<>(headcounts.size());
        headcounts.forEach((key, count) ->
                slots.add(ShiftSlot.of(key.projectId(), key.date(), catalog.templateOf(key.shiftType()), count)));
        slots.sort(ShiftSlot.EXPANSION_ORDER);
        return slots;
    }

    void validate(ShiftRequirement requirement) {
        if (requirement.headcount() <= 0) {
            throw new ScheduleValidationException(ScheduleValidationException.INVALID_HEADCOUNT,
                    "Requirement " + requirement.shiftType().getKey() + " of project " + requirement.projectId()
                            + " has headcount " + requirement.headcount() + "; at least 1 is required",
                    requirement.projectId(), requirement.shiftType());
        }
        requirement.recurrence().validate();
    }
}
