package com.example.roster.schedule;

import com.example.roster.engine.AssignmentStatus;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * プロジェクトのシフトをiCalendar形式（RFC 5545）で出力する。時刻はフローティング（タイムゾーンなし）。
 */
@Component
public class ScheduleCalendarExporter {

    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final DateTimeFormatter UTC_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");
    private static final String CRLF = "\r\n";

    private final Clock clock;

    public ScheduleCalendarExporter() {
        this(Clock.systemUTC());
    }

    ScheduleCalendarExporter(Clock clock) {
        this.clock = clock;
    }

    public CalendarFile export(Long projectId, List<ShiftAssignment> assignments, LocalDate start, LocalDate end) {
        String stamp = UTC_FORMAT.format(LocalDateTime.now(clock.withZone(ZoneOffset.UTC)));
        StringBuilder builder = new StringBuilder();
        line(builder, "BEGIN:VCALENDAR");
        line(builder, "VERSION:2.0");
        line(builder, "PRODID:-//Roster//Shift Schedule//JA");
        line(builder, "CALSCALE:GREGORIAN");

        assignments.stream()
                .filter(sa -> sa.getStatus() != AssignmentStatus.CANCELLED)
                .sorted(ScheduleService.DISPLAY_ORDER)
                .forEach(sa -> appendEvent(builder, sa, stamp));

        line(builder, "END:VCALENDAR");
        String filename = String.format("project_%d_%s_%s.ics", projectId, start, end);
        return new CalendarFile(filename, builder.toString().getBytes(StandardCharsets.UTF_8));
    }

    private void appendEvent(StringBuilder builder, ShiftAssignment assignment, String stamp) {
        LocalDateTime start = assignment.getWorkDate().atTime(assignment.getStartTime());
        LocalDateTime end = assignment.getWorkDate().atTime(assignment.getEndTime());
        if (!end.isAfter(start)) {
            end = end.plusDays(1);
        }
        String projectName = assignment.getProject().getName();

        line(builder, "BEGIN:VEVENT");
        line(builder, "UID:assignment-" + assignment.getId() + "@roster");
        line(builder, "DTSTAMP:" + stamp);
        line(builder, "DTSTART:" + LOCAL_FORMAT.format(start));
        line(builder, "DTEND:" + LOCAL_FORMAT.format(end));
        line(builder, "SUMMARY:" + escapeText(projectName + " - " + assignment.getEmployee().getName()));
        line(builder, "DESCRIPTION:" + escapeText(assignment.getShiftType().getKey() + " (" + assignment.getStatus().name() + ")"));
        line(builder, "LOCATION:" + escapeText(projectName));
        line(builder, "END:VEVENT");
    }

    private static void line(StringBuilder builder, String content) {
        builder.append(content).append(CRLF);
    }

    static String escapeText(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\")
                .replace(";", "\\;")
                .replace(",", "\\,")
                .replace("\n", "\\n");
    }

    public record CalendarFile(String filename, byte[] data) { }
}
