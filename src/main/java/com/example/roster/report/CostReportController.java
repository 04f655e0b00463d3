package com.example.roster.report;

import com.example.roster.common.ApiResponse;
import com.example.roster.costing.CostSummary;
import com.example.roster.schedule.ScheduleService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/reports")
public class CostReportController {

    private final ScheduleService scheduleService;

    public CostReportController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    /**
     * 期間内の稼働時間・人件費を従業員別・プロジェクト別に集計する。
     */
    @GetMapping("/costs")
    public ResponseEntity<ApiResponse<CostSummary>> getCostSummary(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(name = "projectId", required = false) Long projectId) {
        CostSummary summary = scheduleService.summarize(start, end, projectId);
        Map<String, Object> meta = new HashMap<>();
        meta.put("start", start);
        meta.put("end", end);
        if (projectId != null) {
            meta.put("projectId", projectId);
        }
        return ResponseEntity.ok(ApiResponse.success("費用集計を取得しました", summary, meta));
    }
}
