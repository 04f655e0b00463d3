package com.example.roster.schedule;

import com.example.roster.constraint.EmployeeConstraint.ConstraintKind;
import com.example.roster.constraint.EmployeeConstraintService;
import com.example.roster.costing.CostSummary;
import com.example.roster.employee.Employee;
import com.example.roster.employee.EmployeeRepository;
import com.example.roster.engine.Assignment;
import com.example.roster.engine.AssignmentStatus;
import com.example.roster.engine.ShiftType;
import com.example.roster.engine.UnfilledSlot;
import com.example.roster.exception.BusinessException;
import com.example.roster.exception.ScheduleValidationException;
import com.example.roster.project.Project;
import com.example.roster.project.ProjectService;
import com.example.roster.project.ProjectService.RequirementSpec;
import com.example.roster.project.ProjectShiftRequirement.RecurrenceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class ScheduleServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 7, 1);
    private static final LocalDate SUNDAY = LocalDate.of(2024, 7, 7);
    private static final Set<DayOfWeek> WEEKDAYS = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

    @Autowired
    private ScheduleService scheduleService;

    @Autowired
    private ProjectService projectService;

    @Autowired
    private EmployeeConstraintService constraintService;

    @Autowired
    private EmployeeRepository employeeRepository;

    @Autowired
    private ShiftAssignmentRepository assignmentRepository;

    private Employee dana;
    private Project frontDesk;

    @BeforeEach
    void setUp() {
        dana = employeeRepository.save(new Employee("ダナ"));
        for (DayOfWeek day : WEEKDAYS) {
            constraintService.createConstraint(dana.getId(), ConstraintKind.AVAILABLE, "morning", day, null, null);
        }
        frontDesk = projectService.createProject("受付", new BigDecimal("15.00"), true,
                List.of(new RequirementSpec("morning", 1, RecurrenceType.WEEKLY, WEEKDAYS, null, null)));
    }

    @Test
    void simulate_coversEveryWeekdayWithoutSaving() {
        PlanResult result = scheduleService.simulate(MONDAY, SUNDAY, List.of());

        assertThat(result.persisted()).isFalse();
        assertThat(result.assignments()).hasSize(5)
            .allSatisfy(a -> assertThat(a.employeeId()).isEqualTo(dana.getId()));
        assertThat(result.unfilled()).isEmpty();
        assertThat(result.cost().totalCost()).isEqualByComparingTo("600.00");
        assertThat(result.cost().totalHours()).isEqualByComparingTo("40");
        assertThat(assignmentRepository.count()).isZero();
    }

    @Test
    void generate_savesAssignments_andRerunAddsNothing() {
        PlanResult first = scheduleService.generate(MONDAY, SUNDAY, null);
        assertThat(first.persisted()).isTrue();

        List<ShiftAssignment> saved = scheduleService.findAssignments(MONDAY, SUNDAY, null, null);
        assertThat(saved).hasSize(5).allSatisfy(sa -> {
            assertThat(sa.getStatus()).isEqualTo(AssignmentStatus.ASSIGNED);
            assertThat(sa.getStartTime()).isEqualTo(LocalTime.of(6, 0));
            assertThat(sa.getEndTime()).isEqualTo(LocalTime.of(14, 0));
            assertThat(sa.getProject().getId()).isEqualTo(frontDesk.getId());
        });

        PlanResult second = scheduleService.generate(MONDAY, SUNDAY, null);

        assertThat(second.assignments()).isEmpty();
        assertThat(second.unfilled()).isEmpty();
        assertThat(assignmentRepository.count()).isEqualTo(5);
    }

    @Test
    void blockedDate_leavesSlotUnfilled() {
        LocalDate wednesday = MONDAY.plusDays(2);
        constraintService.createConstraint(dana.getId(), ConstraintKind.BLOCKED_DATE, null, null, wednesday, "私用");

        PlanResult result = scheduleService.simulate(MONDAY, SUNDAY, null);

        assertThat(result.assignments()).extracting(Assignment::date).doesNotContain(wednesday);
        assertThat(result.unfilled()).extracting(UnfilledSlot::date).containsExactly(wednesday);
        assertThat(result.totalShortfall()).isEqualTo(1);
    }

    @Test
    void inactiveProjectAndEmployee_areIgnored() {
        Employee idle = employeeRepository.save(new Employee("休職者"));
        idle.setActive(false);
        projectService.createProject("夜間警備", new BigDecimal("20.00"), false,
                List.of(new RequirementSpec("night", 1, null, null, null, null)));

        PlanResult result = scheduleService.simulate(MONDAY, SUNDAY, null);

        assertThat(result.assignments()).extracting(Assignment::employeeId).containsOnly(dana.getId());
        assertThat(result.assignments()).extracting(Assignment::projectId).containsOnly(frontDesk.getId());
    }

    @Test
    void projectSelection_limitsWhichRequirementsAreExpanded() {
        Employee eli = employeeRepository.save(new Employee("イーライ"));
        Project warehouse = projectService.createProject("倉庫", new BigDecimal("18.00"), true,
                List.of(new RequirementSpec("afternoon", 1, RecurrenceType.DATE_RANGE, null, MONDAY, MONDAY.plusDays(1))));

        PlanResult onlyWarehouse = scheduleService.generate(MONDAY, SUNDAY, List.of(warehouse.getId()));

        assertThat(onlyWarehouse.assignments()).hasSize(2)
            .allSatisfy(a -> {
                assertThat(a.projectId()).isEqualTo(warehouse.getId());
                assertThat(a.shiftType()).isEqualTo(ShiftType.AFTERNOON);
                assertThat(a.employeeId()).isEqualTo(eli.getId());
            });
        assertThat(scheduleService.findAssignments(MONDAY, SUNDAY, frontDesk.getId(), null)).isEmpty();

        PlanResult both = scheduleService.generate(MONDAY, SUNDAY, List.of());
        assertThat(both.assignments()).extracting(Assignment::projectId).containsOnly(frontDesk.getId());
        assertThat(both.cost().projects()).containsOnlyKeys(frontDesk.getId());
    }

    @Test
    void reportShift_savesReportedAssignment_andRejectsOverlap() {
        scheduleService.generate(MONDAY, SUNDAY, null);
        Project other = projectService.createProject("応援", new BigDecimal("12.00"), true, List.of());

        ShiftAssignment reported = scheduleService.reportShift(dana.getId(), other.getId(), MONDAY, ShiftType.AFTERNOON);
        assertThat(reported.getStatus()).isEqualTo(AssignmentStatus.REPORTED);
        assertThat(reported.getStartTime()).isEqualTo(LocalTime.of(14, 0));

        assertThatThrownBy(() -> scheduleService.reportShift(dana.getId(), other.getId(), MONDAY, ShiftType.MORNING))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ScheduleService.SHIFT_OVERLAP);

        // Sunday night ends at 06:00 on Monday, right when Monday morning starts
        ShiftAssignment sundayNight = scheduleService.reportShift(dana.getId(), other.getId(),
            MONDAY.minusDays(1), ShiftType.NIGHT);
        assertThat(sundayNight.getId()).isNotNull();

        assertThatThrownBy(() -> scheduleService.reportShift(dana.getId(), frontDesk.getId(), MONDAY, ShiftType.AFTERNOON))
            .extracting("errorCode")
            .isEqualTo(ScheduleService.SHIFT_OVERLAP);
        assertThat(scheduleService.findAssignments(MONDAY.minusDays(1), MONDAY, null, dana.getId())).hasSize(3);
    }

    @Test
    void reportShift_byInactiveEmployee_isRejected() {
        dana.setActive(false);
        employeeRepository.save(dana);

        assertThatThrownBy(() -> scheduleService.reportShift(dana.getId(), frontDesk.getId(), MONDAY, ShiftType.MORNING))
            .extracting("errorCode")
            .isEqualTo(ScheduleService.INACTIVE_EMPLOYEE);
    }

    @Test
    void cancelAssignment_reopensSlotAndDropsCost() {
        scheduleService.generate(MONDAY, SUNDAY, null);
        ShiftAssignment monday = scheduleService.findAssignments(MONDAY, MONDAY, null, null).get(0);

        ShiftAssignment cancelled = scheduleService.cancelAssignment(monday.getId());
        assertThat(cancelled.getStatus()).isEqualTo(AssignmentStatus.CANCELLED);

        assertThatThrownBy(() -> scheduleService.cancelAssignment(monday.getId()))
            .extracting("errorCode")
            .isEqualTo(ScheduleService.ALREADY_CANCELLED);

        CostSummary summary = scheduleService.summarize(MONDAY, SUNDAY, null);
        assertThat(summary.totalCost()).isEqualByComparingTo("480.00");
        assertThat(summary.assignmentCount()).isEqualTo(4);

        PlanResult refill = scheduleService.simulate(MONDAY, SUNDAY, null);
        assertThat(refill.assignments()).extracting(Assignment::date).containsExactly(MONDAY);
    }

    @Test
    void summarize_filtersByProject() {
        scheduleService.generate(MONDAY, SUNDAY, null);
        Project other = projectService.createProject("応援", new BigDecimal("12.00"), true, List.of());
        scheduleService.reportShift(dana.getId(), other.getId(), MONDAY.plusDays(5), ShiftType.MORNING);

        CostSummary all = scheduleService.summarize(MONDAY, SUNDAY, null);
        CostSummary onlyOther = scheduleService.summarize(MONDAY, SUNDAY, other.getId());

        assertThat(all.totalCost()).isEqualByComparingTo("696.00");
        assertThat(all.employees().get(dana.getId()).assignments()).isEqualTo(6);
        assertThat(onlyOther.totalCost()).isEqualByComparingTo("96.00");
        assertThat(onlyOther.projects()).containsOnlyKeys(other.getId());
    }

    @Test
    void invalidWindow_isRejected() {
        assertThatThrownBy(() -> scheduleService.simulate(SUNDAY, MONDAY, null))
            .isInstanceOf(ScheduleValidationException.class)
            .extracting("errorCode")
            .isEqualTo(ScheduleValidationException.INVALID_WINDOW);
    }
}
