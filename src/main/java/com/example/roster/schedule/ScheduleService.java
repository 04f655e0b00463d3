package com.example.roster.schedule;

import com.example.roster.costing.CostSummarizer;
import com.example.roster.costing.CostSummary;
import com.example.roster.employee.Employee;
import com.example.roster.employee.EmployeeRepository;
import com.example.roster.engine.Assignment;
import com.example.roster.engine.AssignmentEngine;
import com.example.roster.engine.AssignmentStatus;
import com.example.roster.engine.CoveragePlan;
import com.example.roster.engine.PlanningWindow;
import com.example.roster.engine.ProjectSnapshot;
import com.example.roster.engine.RunLedger;
import com.example.roster.engine.SchedulingRequest;
import com.example.roster.engine.ShiftCatalog;
import com.example.roster.engine.ShiftSlot;
import com.example.roster.engine.ShiftTemplate;
import com.example.roster.engine.ShiftType;
import com.example.roster.exception.BusinessException;
import com.example.roster.exception.ResourceNotFoundException;
import com.example.roster.project.Project;
import com.example.roster.project.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Service
@Transactional
public class ScheduleService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    public static final String SHIFT_OVERLAP = "SHIFT_OVERLAP";
    public static final String ALREADY_CANCELLED = "ALREADY_CANCELLED";
    public static final String INACTIVE_EMPLOYEE = "INACTIVE_EMPLOYEE";
    public static final String SCHEDULER_BUSY = "SCHEDULER_BUSY";

    static final Comparator<ShiftAssignment> DISPLAY_ORDER = Comparator
            .comparing(ShiftAssignment::getWorkDate)
            .thenComparing(ShiftAssignment::getShiftType)
            .thenComparing(sa -> sa.getProject().getId())
            .thenComparing(sa -> sa.getEmployee().getId());

    private final AssignmentEngine engine;
    private final CostSummarizer costSummarizer;
    private final ScheduleSnapshotLoader snapshotLoader;
    private final ShiftAssignmentRepository assignmentRepository;
    private final EmployeeRepository employeeRepository;
    private final ProjectRepository projectRepository;
    private final ScheduleJobStatusService jobStatusService;

    public ScheduleService(AssignmentEngine engine,
                           CostSummarizer costSummarizer,
                           ScheduleSnapshotLoader snapshotLoader,
                           ShiftAssignmentRepository assignmentRepository,
                           EmployeeRepository employeeRepository,
                           ProjectRepository projectRepository,
                           ScheduleJobStatusService jobStatusService) {
        this.engine = engine;
        this.costSummarizer = costSummarizer;
        this.snapshotLoader = snapshotLoader;
        this.assignmentRepository = assignmentRepository;
        this.employeeRepository = employeeRepository;
        this.projectRepository = projectRepository;
        this.jobStatusService = jobStatusService;
    }

    /**
     * 割り当てを計算する（保存しない）。既存の割り当ては埋まっている枠として扱う。
     */
    @Transactional(readOnly = true)
    public PlanResult simulate(LocalDate start, LocalDate end, Collection<Long> projectIds) {
        PlanningWindow window = new PlanningWindow(start, end);
        SchedulingRequest request = snapshotLoader.load(window, projectIds);
        CoveragePlan plan = engine.plan(request);
        CostSummary cost = costSummarizer.summarize(plan.assignments(), request.projects());
        logger.info("シフトをシミュレーションしました: 期間={}..{}, 割り当て={}件, 不足={}人",
                start, end, plan.assignments().size(), plan.totalShortfall());
        return PlanResult.of(window, plan, cost, false);
    }

    /**
     * 割り当てを計算して保存する。既に埋まっている枠には追加しない。
     */
    public PlanResult generate(LocalDate start, LocalDate end, Collection<Long> projectIds) {
        PlanningWindow window = new PlanningWindow(start, end);
        SchedulingRequest request = snapshotLoader.load(window, projectIds);
        CoveragePlan plan = engine.plan(request);

        ShiftCatalog catalog = engine.getCatalog();
        List<ShiftAssignment> entities = new ArrayList<>(plan.assignments().size());
        for (Assignment assignment : plan.assignments()) {
            ShiftTemplate template = catalog.templateOf(assignment.shiftType());
            entities.add(new ShiftAssignment(
                    assignment.date(),
                    assignment.shiftType(),
                    template.start(),
                    template.end(),
                    employeeRepository.getReferenceById(assignment.employeeId()),
                    projectRepository.getReferenceById(assignment.projectId()),
                    AssignmentStatus.ASSIGNED));
        }
        assignmentRepository.saveAll(entities);

        CostSummary cost = costSummarizer.summarize(plan.assignments(), request.projects());
        logger.info("シフトを生成しました: 期間={}..{}, 保存={}件, 不足={}人",
                start, end, entities.size(), plan.totalShortfall());
        if (!plan.isFullyCovered()) {
            logger.info("必要人数を満たせない枠が{}件あります", plan.unfilled().size());
        }
        return PlanResult.of(window, plan, cost, true);
    }

    /**
     * シミュレーションを専用スレッドプールで実行し、結果をジョブ状態に記録する。
     */
    @Async("scheduleExecutor")
    @Transactional(readOnly = true)
    public void simulateAsync(String jobId, LocalDate start, LocalDate end, Collection<Long> projectIds) {
        try {
            jobStatusService.finish(jobId, simulate(start, end, projectIds));
        } catch (BusinessException e) {
            logger.warn("非同期シミュレーションが入力エラーで終了しました: job={}, {}", jobId, e.getMessage());
            jobStatusService.fail(jobId, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("非同期シミュレーションに失敗しました: job={}", jobId, e);
            jobStatusService.fail(jobId, "シミュレーションに失敗しました");
        }
    }

    /**
     * 従業員による勤務の自己申告。既存の勤務と時間が重なる場合は登録しない。
     */
    public ShiftAssignment reportShift(Long employeeId, Long projectId, LocalDate date, ShiftType shiftType) {
        Employee employee = employeeRepository.findById(employeeId)
                .orElseThrow(() -> new ResourceNotFoundException("従業員が見つかりません: " + employeeId, employeeId));
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("プロジェクトが見つかりません: " + projectId, projectId));
        if (!Boolean.TRUE.equals(employee.getActive())) {
            throw new BusinessException(INACTIVE_EMPLOYEE, "無効な従業員は勤務を申告できません: " + employeeId, employeeId);
        }

        ShiftCatalog catalog = engine.getCatalog();
        RunLedger ledger = new RunLedger(catalog, engine.getPolicy().weekStart());
        assignmentRepository.findDetailedByEmployeeBetween(employeeId, date.minusDays(1), date.plusDays(1))
                .forEach(existing -> ledger.seed(existing.toAssignment()));

        ShiftTemplate template = catalog.templateOf(shiftType);
        ShiftSlot slot = ShiftSlot.of(projectId, date, template, 1);
        if (ledger.hasOverlap(employeeId, slot)) {
            throw new BusinessException(SHIFT_OVERLAP,
                    "既存の勤務と時間が重なっています: " + date + " " + shiftType.getKey(), employeeId, date, shiftType);
        }

        ShiftAssignment saved = assignmentRepository.save(new ShiftAssignment(
                date, shiftType, template.start(), template.end(), employee, project, AssignmentStatus.REPORTED));
        logger.info("勤務を申告しました: 従業員={}, プロジェクト={}, 日付={}, シフト={}",
                employee.getName(), project.getName(), date, shiftType.getKey());
        return saved;
    }

    /**
     * 割り当てを取り消す。取り消した割り当ては集計・重複判定の対象外になる。
     */
    public ShiftAssignment cancelAssignment(Long assignmentId) {
        ShiftAssignment assignment = assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("割り当てが見つかりません: " + assignmentId, assignmentId));
        if (assignment.getStatus() == AssignmentStatus.CANCELLED) {
            throw new BusinessException(ALREADY_CANCELLED, "既に取り消されています: " + assignmentId, assignmentId);
        }
        assignment.setStatus(AssignmentStatus.CANCELLED);
        logger.info("割り当てを取り消しました: ID={}, 日付={}", assignmentId, assignment.getWorkDate());
        return assignmentRepository.save(assignment);
    }

    @Transactional(readOnly = true)
    public List<ShiftAssignment> findAssignments(LocalDate start, LocalDate end, Long projectId, Long employeeId) {
        PlanningWindow window = new PlanningWindow(start, end);
        List<ShiftAssignment> found;
        if (projectId != null) {
            found = assignmentRepository.findDetailedByProjectBetween(projectId, window.start(), window.end());
        } else if (employeeId != null) {
            found = assignmentRepository.findDetailedByEmployeeBetween(employeeId, window.start(), window.end());
        } else {
            found = assignmentRepository.findDetailedBetween(window.start(), window.end());
        }
        return found.stream()
                .filter(sa -> employeeId == null || sa.getEmployee().getId().equals(employeeId))
                .sorted(DISPLAY_ORDER)
                .toList();
    }

    /**
     * 期間内の保存済み割り当て（取消を除く）の時間・費用を集計する。
     */
    @Transactional(readOnly = true)
    public CostSummary summarize(LocalDate start, LocalDate end, Long projectId) {
        List<Assignment> assignments = findAssignments(start, end, projectId, null).stream()
                .map(ShiftAssignment::toAssignment)
                .toList();
        List<ProjectSnapshot> projects = snapshotLoader.loadProjects();
        return costSummarizer.summarize(assignments, projects);
    }
}
