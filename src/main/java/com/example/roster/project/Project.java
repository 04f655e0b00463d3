package com.example.roster.project;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "projects")
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    @NotBlank(message = "プロジェクト名は必須です")
    @Size(max = 100, message = "プロジェクト名は100文字以下で入力してください")
    private String name;

    @Column(name = "hourly_rate", nullable = false, precision = 12, scale = 2)
    @DecimalMin(value = "0.00", message = "時給は0以上で指定してください")
    private BigDecimal hourlyRate = BigDecimal.ZERO;

    @Column(name = "is_active", nullable = false)
    private Boolean active = true;

    @OneToMany(mappedBy = "project", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<ProjectShiftRequirement> requirements = new ArrayList<>();

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Project() {
    }

    public Project(String name, BigDecimal hourlyRate) {
        this.name = name;
        this.hourlyRate = hourlyRate;
        this.createdAt = LocalDateTime.now();
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public void replaceRequirements(List<ProjectShiftRequirement> replacement) {
        requirements.clear();
        for (ProjectShiftRequirement requirement : replacement) {
            requirement.setProject(this);
            requirements.add(requirement);
        }
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public BigDecimal getHourlyRate() {
        return hourlyRate;
    }

    public void setHourlyRate(BigDecimal hourlyRate) {
        this.hourlyRate = hourlyRate;
    }

    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }

    public List<ProjectShiftRequirement> getRequirements() {
        return requirements;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
