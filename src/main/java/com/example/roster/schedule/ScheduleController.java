package com.example.roster.schedule;

import com.example.roster.common.ApiResponse;
import com.example.roster.common.ShiftKeys;
import com.example.roster.exception.BusinessException;
import com.example.roster.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;
    private final ScheduleJobStatusService jobStatusService;
    private final ScheduleCsvExporter csvExporter;
    private final ScheduleCalendarExporter calendarExporter;

    public ScheduleController(ScheduleService scheduleService,
                              ScheduleJobStatusService jobStatusService,
                              ScheduleCsvExporter csvExporter,
                              ScheduleCalendarExporter calendarExporter) {
        this.scheduleService = scheduleService;
        this.jobStatusService = jobStatusService;
        this.csvExporter = csvExporter;
        this.calendarExporter = calendarExporter;
    }

    @PostMapping("/simulate")
    public ResponseEntity<ApiResponse<PlanResult>> simulate(@Valid @RequestBody PlanRequest request) {
        PlanResult result = scheduleService.simulate(request.start(), request.end(), request.projectIds());
        return ResponseEntity.ok(ApiResponse.success("シフトをシミュレーションしました", result, planMeta(result)));
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<PlanResult>> generate(@Valid @RequestBody PlanRequest request) {
        PlanResult result = scheduleService.generate(request.start(), request.end(), request.projectIds());
        return ResponseEntity.ok(ApiResponse.success("シフトを生成しました", result, planMeta(result)));
    }

    @PostMapping("/simulate/async")
    public ResponseEntity<ApiResponse<Map<String, Object>>> simulateAsync(@Valid @RequestBody PlanRequest request) {
        String jobId = jobStatusService.start(request.start(), request.end());
        try {
            scheduleService.simulateAsync(jobId, request.start(), request.end(), request.projectIds());
        } catch (TaskRejectedException e) {
            jobStatusService.fail(jobId, "実行待ちのシミュレーションが上限に達しています");
            logger.warn("非同期シミュレーションを受け付けられませんでした: job={}", jobId, e);
            throw new BusinessException(ScheduleService.SCHEDULER_BUSY,
                    "シミュレーションが混み合っています。しばらくしてから再実行してください", e, jobId);
        }
        logger.info("非同期シミュレーションを開始しました: job={}, 期間={}..{}", jobId, request.start(), request.end());
        Map<String, Object> data = new HashMap<>();
        data.put("jobId", jobId);
        data.put("start", request.start());
        data.put("end", request.end());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success("シミュレーションを開始しました", data));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getJobStatus(@PathVariable String jobId) {
        ScheduleJobStatusService.Status s = jobStatusService.get(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("ジョブが見つかりません: " + jobId, jobId));
        Map<String, Object> data = new HashMap<>();
        data.put("jobId", s.jobId);
        data.put("running", s.running);
        data.put("done", s.done);
        data.put("failed", s.failed);
        data.put("error", s.error);
        data.put("startedAt", s.startedAt);
        data.put("finishedAt", s.finishedAt);
        data.put("result", s.result);
        return ResponseEntity.ok(ApiResponse.success("ジョブ状況を取得しました", data));
    }

    @GetMapping("/assignments")
    public ResponseEntity<ApiResponse<List<ShiftAssignmentDto>>> getAssignments(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(name = "projectId", required = false) Long projectId,
            @RequestParam(name = "employeeId", required = false) Long employeeId) {
        List<ShiftAssignmentDto> data = scheduleService.findAssignments(start, end, projectId, employeeId).stream()
                .map(ShiftAssignmentDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("シフト割り当てを取得しました", data, Map.of("count", data.size())));
    }

    @PostMapping("/assignments/report")
    public ResponseEntity<ApiResponse<ShiftAssignmentDto>> reportShift(@Valid @RequestBody ReportRequest request) {
        ShiftAssignment saved = scheduleService.reportShift(request.employeeId(), request.projectId(),
                request.date(), ShiftKeys.parse(request.shiftType()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("勤務を申告しました", ShiftAssignmentDto.from(saved)));
    }

    @PostMapping("/assignments/{id}/cancel")
    public ResponseEntity<ApiResponse<ShiftAssignmentDto>> cancelAssignment(@PathVariable("id") Long assignmentId) {
        ShiftAssignment cancelled = scheduleService.cancelAssignment(assignmentId);
        return ResponseEntity.ok(ApiResponse.success("割り当てを取り消しました", ShiftAssignmentDto.from(cancelled)));
    }

    @GetMapping(value = "/export/csv", produces = "text/csv")
    public ResponseEntity<byte[]> exportCsv(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(name = "projectId", required = false) Long projectId) {
        List<ShiftAssignment> assignments = scheduleService.findAssignments(start, end, projectId, null);
        ScheduleCsvExporter.CsvFile file = csvExporter.export(assignments, start, end);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.filename() + "\"")
                .contentType(new MediaType("text", "csv"))
                .body(file.data());
    }

    @GetMapping(value = "/export/ics", produces = "text/calendar")
    public ResponseEntity<byte[]> exportCalendar(
            @RequestParam("projectId") Long projectId,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        List<ShiftAssignment> assignments = scheduleService.findAssignments(start, end, projectId, null);
        ScheduleCalendarExporter.CalendarFile file = calendarExporter.export(projectId, assignments, start, end);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.filename() + "\"")
                .contentType(new MediaType("text", "calendar"))
                .body(file.data());
    }

    private Map<String, Object> planMeta(PlanResult result) {
        Map<String, Object> meta = new HashMap<>();
        meta.put("assignmentCount", result.assignments().size());
        meta.put("unfilledCount", result.unfilled().size());
        meta.put("totalShortfall", result.totalShortfall());
        meta.put("fullyCovered", result.unfilled().isEmpty());
        return meta;
    }

    public record PlanRequest(
            @NotNull(message = "開始日は必須です") LocalDate start,
            @NotNull(message = "終了日は必須です") LocalDate end,
            List<Long> projectIds) {}

    public record ReportRequest(
            @NotNull(message = "従業員は必須です") Long employeeId,
            @NotNull(message = "プロジェクトは必須です") Long projectId,
            @NotNull(message = "日付は必須です") LocalDate date,
            @NotBlank(message = "シフト種別は必須です") String shiftType) {}
}
