package com.example.roster.schedule;

import com.example.roster.costing.CostSummarizer;
import com.example.roster.engine.AssignmentStatus;
import com.example.roster.engine.ShiftCatalog;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

@Component
public class ScheduleCsvExporter {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final Locale LOCALE_JP = Locale.JAPANESE;
    private static final String[] HEADERS = {
            "日付", "曜日", "従業員ID", "従業員名", "プロジェクトID", "プロジェクト名", "シフト",
            "開始", "終了", "稼働時間(h)", "時給", "金額", "状態"
    };

    private final ShiftCatalog catalog;

    public ScheduleCsvExporter(ShiftCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * 割り当てをCSVに変換する。取消済みの行も出力するが、時間と金額は0とする。
     */
    public CsvFile export(List<ShiftAssignment> assignments, LocalDate start, LocalDate end) {
        StringBuilder builder = new StringBuilder();
        builder.append('\uFEFF');
        builder.append(String.join(",", HEADERS)).append('\n');

        assignments.stream()
                .sorted(ScheduleService.DISPLAY_ORDER)
                .forEach(sa -> appendRow(builder, sa));

        byte[] data = builder.toString().getBytes(StandardCharsets.UTF_8);
        String filename = String.format("schedule-%s-%s.csv", start, end);
        return new CsvFile(filename, data);
    }

    private void appendRow(StringBuilder builder, ShiftAssignment assignment) {
        boolean cancelled = assignment.getStatus() == AssignmentStatus.CANCELLED;
        long minutes = cancelled ? 0 : catalog.durationMinutes(assignment.getShiftType());
        BigDecimal rate = assignment.getProject().getHourlyRate();

        StringJoiner joiner = new StringJoiner(",");
        joiner.add(escapeCsv(DATE_FORMAT.format(assignment.getWorkDate())));
        joiner.add(escapeCsv(formatDayOfWeek(assignment.getWorkDate())));
        joiner.add(escapeCsv(String.valueOf(assignment.getEmployee().getId())));
        joiner.add(escapeCsv(assignment.getEmployee().getName()));
        joiner.add(escapeCsv(String.valueOf(assignment.getProject().getId())));
        joiner.add(escapeCsv(assignment.getProject().getName()));
        joiner.add(escapeCsv(assignment.getShiftType().getKey()));
        joiner.add(escapeCsv(formatTime(assignment.getStartTime())));
        joiner.add(escapeCsv(formatTime(assignment.getEndTime())));
        joiner.add(escapeCsv(CostSummarizer.toHours(minutes).toPlainString()));
        joiner.add(escapeCsv(rate.toPlainString()));
        joiner.add(escapeCsv(CostSummarizer.costOf(rate, minutes).toPlainString()));
        joiner.add(escapeCsv(assignment.getStatus().name()));

        builder.append(joiner).append('\n');
    }

    private String formatDayOfWeek(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.SHORT, LOCALE_JP);
    }

    private String formatTime(LocalTime time) {
        return time == null ? "" : TIME_FORMAT.format(time);
    }

    private String escapeCsv(String value) {
        String target = value == null ? "" : value;
        if (target.contains(",") || target.contains("\"") || target.contains("\n")) {
            return "\"" + target.replace("\"", "\"\"") + "\"";
        }
        return target;
    }

    public record CsvFile(String filename, byte[] data) { }
}
