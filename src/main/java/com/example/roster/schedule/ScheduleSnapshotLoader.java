package com.example.roster.schedule;

import com.example.roster.constraint.EmployeeConstraint;
import com.example.roster.constraint.EmployeeConstraintRepository;
import com.example.roster.employee.Employee;
import com.example.roster.employee.EmployeeRepository;
import com.example.roster.engine.Assignment;
import com.example.roster.engine.EmployeeSnapshot;
import com.example.roster.engine.PlanningWindow;
import com.example.roster.engine.ProjectSnapshot;
import com.example.roster.engine.SchedulingPolicy;
import com.example.roster.engine.SchedulingRequest;
import com.example.roster.engine.ShiftRequirement;
import com.example.roster.engine.ShiftType;
import com.example.roster.engine.WeeklyShift;
import com.example.roster.project.Project;
import com.example.roster.project.ProjectRepository;
import com.example.roster.project.ProjectShiftRequirement;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * DBの内容からスケジュール計算用のスナップショットを組み立てる。
 */
@Component
@Transactional(readOnly = true)
public class ScheduleSnapshotLoader {

    private final EmployeeRepository employeeRepository;
    private final EmployeeConstraintRepository constraintRepository;
    private final ProjectRepository projectRepository;
    private final ShiftAssignmentRepository assignmentRepository;
    private final SchedulingPolicy policy;

    public ScheduleSnapshotLoader(EmployeeRepository employeeRepository,
                                  EmployeeConstraintRepository constraintRepository,
                                  ProjectRepository projectRepository,
                                  ShiftAssignmentRepository assignmentRepository,
                                  SchedulingPolicy policy) {
        this.employeeRepository = employeeRepository;
        this.constraintRepository = constraintRepository;
        this.projectRepository = projectRepository;
        this.assignmentRepository = assignmentRepository;
        this.policy = policy;
    }

    /**
     * 計算リクエストを組み立てる。
     *
     * @param projectIds 対象プロジェクト。空なら全ての有効なプロジェクト。対象外のプロジェクトも
     *                   既存割り当ての参照先として必要なため、必要人数定義だけを外して渡す。
     */
    public SchedulingRequest load(PlanningWindow window, Collection<Long> projectIds) {
        List<EmployeeSnapshot> employees = loadEmployees();
        List<ProjectSnapshot> projects = loadProjects().stream()
                .map(p -> projectIds == null || projectIds.isEmpty() || projectIds.contains(p.id())
                        ? p
                        : new ProjectSnapshot(p.id(), p.name(), p.hourlyRate(), p.active(), List.of()))
                .toList();
        return new SchedulingRequest(employees, projects, window, loadExisting(window));
    }

    public List<ProjectSnapshot> loadProjects() {
        return projectRepository.findAllWithRequirements().stream()
                .map(ScheduleSnapshotLoader::toSnapshot)
                .toList();
    }

    public List<EmployeeSnapshot> loadEmployees() {
        List<Employee> employees = employeeRepository.findAllByOrderByIdAsc();
        Set<Long> ids = employees.stream().map(Employee::getId).collect(Collectors.toSet());
        Map<Long, List<EmployeeConstraint>> constraintsByEmployee = ids.isEmpty()
                ? Map.of()
                : constraintRepository.findByEmployee_IdInAndActiveTrue(ids).stream()
                        .collect(Collectors.groupingBy(c -> c.getEmployee().getId()));

        List<EmployeeSnapshot> result = new ArrayList<>(employees.size());
        for (Employee employee : employees) {
            result.add(toSnapshot(employee, constraintsByEmployee.getOrDefault(employee.getId(), List.of())));
        }
        return result;
    }

    /**
     * 窓の前後にかかる既存割り当て（取消を除く）。前日の夜勤と週上限の集計対象週も含める。
     */
    List<Assignment> loadExisting(PlanningWindow window) {
        LocalDate weekStart = window.start().with(TemporalAdjusters.previousOrSame(policy.weekStart()));
        LocalDate from = weekStart.isBefore(window.start().minusDays(1)) ? weekStart : window.start().minusDays(1);
        LocalDate to = window.end().with(TemporalAdjusters.previousOrSame(policy.weekStart())).plusDays(6);
        return assignmentRepository.findDetailedBetween(from, to).stream()
                .filter(sa -> sa.getStatus().counts())
                .map(ShiftAssignment::toAssignment)
                .toList();
    }

    static EmployeeSnapshot toSnapshot(Employee employee, List<EmployeeConstraint> constraints) {
        EmployeeSnapshot.Builder builder = EmployeeSnapshot.builder(employee.getId(), employee.getName())
                .active(Boolean.TRUE.equals(employee.getActive()))
                .maxWeeklyHours(employee.getMaxWeeklyHours());

        Set<WeeklyShift> availability = new HashSet<>();
        boolean hasAvailability = false;
        for (EmployeeConstraint constraint : constraints) {
            switch (constraint.getKind()) {
                case AVAILABLE -> {
                    hasAvailability = true;
                    availability.addAll(expand(constraint.getShiftType(), constraint.getDayOfWeek()));
                }
                case BLOCKED_DATE -> builder.blocked(constraint.getDate());
                case PREFERRED -> {
                    if (constraint.getDate() != null) {
                        builder.prefers(constraint.getShiftType(), constraint.getDate());
                    } else {
                        for (WeeklyShift shift : expand(constraint.getShiftType(), constraint.getDayOfWeek())) {
                            builder.prefers(shift.shiftType(), shift.dayOfWeek());
                        }
                    }
                }
                case AVOIDED -> builder.avoids(constraint.getShiftType());
            }
        }
        // no AVAILABLE rows means available for every shift on every day
        builder.available(hasAvailability ? availability : WeeklyShift.always());
        return builder.build();
    }

    static ProjectSnapshot toSnapshot(Project project) {
        List<ShiftRequirement> requirements = project.getRequirements().stream()
                .map(ProjectShiftRequirement::toRequirement)
                .toList();
        return new ProjectSnapshot(project.getId(), project.getName(), project.getHourlyRate(),
                Boolean.TRUE.equals(project.getActive()), requirements);
    }

    private static Set<WeeklyShift> expand(ShiftType type, DayOfWeek day) {
        Set<ShiftType> types = type == null ? EnumSet.allOf(ShiftType.class) : EnumSet.of(type);
        Set<DayOfWeek> days = day == null ? EnumSet.allOf(DayOfWeek.class) : EnumSet.of(day);
        Set<WeeklyShift> result = new HashSet<>();
        for (ShiftType t : types) {
            for (DayOfWeek d : days) {
                result.add(new WeeklyShift(t, d));
            }
        }
        return result;
    }
}
