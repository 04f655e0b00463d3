package com.example.roster.constraint;

import com.example.roster.employee.Employee;
import com.example.roster.engine.ShiftType;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 従業員の勤務制約。
 * <p>
 * {@link ConstraintKind#AVAILABLE} はシフト種別・曜日のどちらかを省略すると「全て」を意味する。
 * AVAILABLE が一件もない従業員は全シフト・全曜日で勤務可能として扱う。
 */
@Entity
@Table(name = "employee_constraints")
public class EmployeeConstraint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    @NotNull(message = "従業員は必須です")
    private Employee employee;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @NotNull(message = "制約種別は必須です")
    private ConstraintKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "shift_type", length = 20)
    private ShiftType shiftType;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "target_date")
    private LocalDate date;

    @Column(length = 200)
    private String reason;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "is_active")
    private Boolean active = true;

    protected EmployeeConstraint() {
    }

    public EmployeeConstraint(Employee employee, ConstraintKind kind, ShiftType shiftType,
                              DayOfWeek dayOfWeek, LocalDate date, String reason) {
        this.employee = employee;
        this.kind = kind;
        this.shiftType = shiftType;
        this.dayOfWeek = dayOfWeek;
        this.date = date;
        this.reason = reason;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public Long getId() {
        return id;
    }

    public Employee getEmployee() {
        return employee;
    }

    public ConstraintKind getKind() {
        return kind;
    }

    public ShiftType getShiftType() {
        return shiftType;
    }

    public DayOfWeek getDayOfWeek() {
        return dayOfWeek;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public enum ConstraintKind {
        AVAILABLE("勤務可能"),
        BLOCKED_DATE("勤務不可日"),
        PREFERRED("希望"),
        AVOIDED("回避");

        private final String displayName;

        ConstraintKind(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    @Override
    public String toString() {
        return "EmployeeConstraint{" +
                "id=" + id +
                ", kind=" + kind +
                ", shiftType=" + shiftType +
                ", dayOfWeek=" + dayOfWeek +
                ", date=" + date +
                ", active=" + active +
                '}';
    }
}
