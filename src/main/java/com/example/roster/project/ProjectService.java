package com.example.roster.project;

import com.example.roster.common.ShiftKeys;
import com.example.roster.engine.ShiftType;
import com.example.roster.exception.BusinessException;
import com.example.roster.exception.ResourceNotFoundException;
import com.example.roster.exception.ScheduleValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Service
@Transactional
public class ProjectService {

    private static final Logger logger = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;

    public ProjectService(ProjectRepository projectRepository) {
        this.projectRepository = projectRepository;
    }

    /**
     * 必要人数定義の入力値。recurrence を省略した場合は毎日（全曜日）として扱う。
     */
    public record RequirementSpec(String shiftType, int headcount,
                                  ProjectShiftRequirement.RecurrenceType recurrence,
                                  Set<DayOfWeek> daysOfWeek, LocalDate from, LocalDate to) {}

    @Transactional(readOnly = true)
    public List<Project> findAll() {
        return projectRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Project findProject(Long id) {
        return projectRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("プロジェクトが見つかりません: " + id, id));
    }

    public Project createProject(String name, BigDecimal hourlyRate, Boolean active, List<RequirementSpec> requirements) {
        String trimmed = name.trim();
        if (projectRepository.findByName(trimmed).isPresent()) {
            throw new BusinessException("DUPLICATE_NAME", "同名のプロジェクトが既に存在します: " + trimmed, trimmed);
        }
        Project project = new Project(trimmed, normalizeRate(hourlyRate));
        if (active != null) {
            project.setActive(active);
        }
        project.replaceRequirements(toEntities(requirements));
        Project saved = projectRepository.save(project);
        logger.info("プロジェクトを作成しました: ID={}, 名称={}, 時給={}, 必要人数定義={}件",
                saved.getId(), saved.getName(), saved.getHourlyRate(), saved.getRequirements().size());
        return saved;
    }

    public Project updateActive(Long id, boolean active) {
        Project project = findProject(id);
        project.setActive(active);
        logger.info("プロジェクトの有効状態を変更しました: ID={}, active={}", id, active);
        return projectRepository.save(project);
    }

    public Project updateRate(Long id, BigDecimal hourlyRate) {
        Project project = findProject(id);
        project.setHourlyRate(normalizeRate(hourlyRate));
        logger.info("プロジェクトの時給を変更しました: ID={}, 時給={}", id, project.getHourlyRate());
        return projectRepository.save(project);
    }

    public Project replaceRequirements(Long id, List<RequirementSpec> requirements) {
        Project project = findProject(id);
        project.replaceRequirements(toEntities(requirements));
        Project saved = projectRepository.save(project);
        logger.info("必要人数定義を更新しました: ID={}, 件数={}", id, saved.getRequirements().size());
        return saved;
    }

    private List<ProjectShiftRequirement> toEntities(List<RequirementSpec> specs) {
        List<ProjectShiftRequirement> result = new ArrayList<>();
        if (specs == null) {
            return result;
        }
        for (RequirementSpec spec : specs) {
            ShiftType type = ShiftKeys.parse(spec.shiftType());
            if (spec.headcount() < 1) {
                throw new ScheduleValidationException(ScheduleValidationException.INVALID_HEADCOUNT,
                        "必要人数は1以上で指定してください: " + spec.headcount(), spec.headcount());
            }
            ProjectShiftRequirement requirement;
            if (spec.recurrence() == ProjectShiftRequirement.RecurrenceType.DATE_RANGE) {
                requirement = ProjectShiftRequirement.dateRange(type, spec.headcount(), spec.from(), spec.to());
            } else {
                Set<DayOfWeek> days = spec.daysOfWeek() == null || spec.daysOfWeek().isEmpty()
                        ? EnumSet.allOf(DayOfWeek.class)
                        : spec.daysOfWeek();
                requirement = ProjectShiftRequirement.weekly(type, spec.headcount(), days);
            }
            requirement.toRecurrence().validate();
            result.add(requirement);
        }
        return result;
    }

    private BigDecimal normalizeRate(BigDecimal rate) {
        BigDecimal value = rate == null ? BigDecimal.ZERO : rate;
        if (value.signum() < 0) {
            throw new ScheduleValidationException(ScheduleValidationException.INVALID_RATE,
                    "時給は0以上で指定してください: " + value, value);
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
