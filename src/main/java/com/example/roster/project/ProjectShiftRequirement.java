package com.example.roster.project;

import com.example.roster.engine.Recurrence;
import com.example.roster.engine.ShiftRequirement;
import com.example.roster.engine.ShiftType;
import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * プロジェクトの必要人数定義。曜日指定（毎週）または期間指定で繰り返す。
 */
@Entity
@Table(name = "project_shift_requirements")
public class ProjectShiftRequirement {

    public enum RecurrenceType { WEEKLY, DATE_RANGE }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    @Enumerated(EnumType.STRING)
    @Column(name = "shift_type", nullable = false, length = 20)
    private ShiftType shiftType;

    @Column(nullable = false)
    private Integer headcount;

    @Enumerated(EnumType.STRING)
    @Column(name = "recurrence_type", nullable = false, length = 20)
    private RecurrenceType recurrenceType = RecurrenceType.WEEKLY;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "project_requirement_days", joinColumns = @JoinColumn(name = "requirement_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", length = 10)
    private Set<DayOfWeek> daysOfWeek = EnumSet.noneOf(DayOfWeek.class);

    @Column(name = "range_start")
    private LocalDate rangeStart;

    @Column(name = "range_end")
    private LocalDate rangeEnd;

    protected ProjectShiftRequirement() {
    }

    public static ProjectShiftRequirement weekly(ShiftType shiftType, int headcount, Set<DayOfWeek> days) {
        ProjectShiftRequirement requirement = new ProjectShiftRequirement();
        requirement.shiftType = shiftType;
        requirement.headcount = headcount;
        requirement.recurrenceType = RecurrenceType.WEEKLY;
        requirement.daysOfWeek = days == null || days.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(days);
        return requirement;
    }

    public static ProjectShiftRequirement dateRange(ShiftType shiftType, int headcount, LocalDate from, LocalDate to) {
        ProjectShiftRequirement requirement = new ProjectShiftRequirement();
        requirement.shiftType = shiftType;
        requirement.headcount = headcount;
        requirement.recurrenceType = RecurrenceType.DATE_RANGE;
        requirement.rangeStart = from;
        requirement.rangeEnd = to;
        return requirement;
    }

    public Recurrence toRecurrence() {
        if (recurrenceType == RecurrenceType.DATE_RANGE) {
            return new Recurrence.DateRange(rangeStart, rangeEnd);
        }
        return new Recurrence.Weekly(daysOfWeek);
    }

    public ShiftRequirement toRequirement() {
        return new ShiftRequirement(project.getId(), shiftType, toRecurrence(), headcount == null ? 0 : headcount);
    }

    public Long getId() {
        return id;
    }

    public Project getProject() {
        return project;
    }

    void setProject(Project project) {
        this.project = project;
    }

    public ShiftType getShiftType() {
        return shiftType;
    }

    public Integer getHeadcount() {
        return headcount;
    }

    public RecurrenceType getRecurrenceType() {
        return recurrenceType;
    }

    public Set<DayOfWeek> getDaysOfWeek() {
        return daysOfWeek;
    }

    public LocalDate getRangeStart() {
        return rangeStart;
    }

    public LocalDate getRangeEnd() {
        return rangeEnd;
    }
}
