package com.example.roster.constraint;

import com.example.roster.common.ShiftKeys;
import com.example.roster.constraint.EmployeeConstraint.ConstraintKind;
import com.example.roster.employee.Employee;
import com.example.roster.employee.EmployeeRepository;
import com.example.roster.engine.ShiftType;
import com.example.roster.exception.BusinessException;
import com.example.roster.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

@Service
@Transactional
public class EmployeeConstraintService {

    private static final Logger logger = LoggerFactory.getLogger(EmployeeConstraintService.class);

    public static final String INVALID_CONSTRAINT = "INVALID_CONSTRAINT";

    private final EmployeeConstraintRepository constraintRepository;
    private final EmployeeRepository employeeRepository;

    public EmployeeConstraintService(EmployeeConstraintRepository constraintRepository,
                                     EmployeeRepository employeeRepository) {
        this.constraintRepository = constraintRepository;
        this.employeeRepository = employeeRepository;
    }

    /**
     * 制約を作成
     */
    public EmployeeConstraint createConstraint(Long employeeId, ConstraintKind kind, String shiftKey,
                                               DayOfWeek dayOfWeek, LocalDate date, String reason) {
        Employee employee = employeeRepository.findById(employeeId)
                .orElseThrow(() -> new ResourceNotFoundException("従業員が見つかりません: " + employeeId, employeeId));

        ShiftType shiftType = ShiftKeys.parseOptional(shiftKey);
        checkShape(kind, shiftType, dayOfWeek, date);

        EmployeeConstraint saved = constraintRepository.save(
                new EmployeeConstraint(employee, kind, shiftType, dayOfWeek, date, reason));

        logger.info("制約を作成しました: 従業員={}, 種別={}, シフト={}, 曜日={}, 日付={}",
                employee.getName(), kind, shiftType, dayOfWeek, date);
        return saved;
    }

    /**
     * 制約を削除（論理削除）
     */
    public void deleteConstraint(Long employeeId, Long constraintId) {
        EmployeeConstraint constraint = constraintRepository.findById(constraintId)
                .filter(c -> c.getEmployee().getId().equals(employeeId))
                .orElseThrow(() -> new ResourceNotFoundException("制約が見つかりません: " + constraintId, constraintId));

        constraint.setActive(false);
        constraintRepository.save(constraint);

        logger.info("制約を削除しました: ID={}, 従業員ID={}, 種別={}", constraintId, employeeId, constraint.getKind());
    }

    /**
     * 従業員の制約一覧を取得
     */
    @Transactional(readOnly = true)
    public List<EmployeeConstraint> getEmployeeConstraints(Long employeeId) {
        if (!employeeRepository.existsById(employeeId)) {
            throw new ResourceNotFoundException("従業員が見つかりません: " + employeeId, employeeId);
        }
        return constraintRepository.findByEmployee_IdAndActiveTrueOrderByIdAsc(employeeId);
    }

    private void checkShape(ConstraintKind kind, ShiftType shiftType, DayOfWeek dayOfWeek, LocalDate date) {
        if (kind == null) {
            throw new BusinessException(INVALID_CONSTRAINT, "制約種別は必須です");
        }
        switch (kind) {
            case BLOCKED_DATE -> {
                if (date == null) {
                    throw new BusinessException(INVALID_CONSTRAINT, "勤務不可日には日付が必要です", kind);
                }
            }
            case AVAILABLE -> {
                if (date != null) {
                    throw new BusinessException(INVALID_CONSTRAINT, "勤務可能は曜日単位で指定してください", kind);
                }
            }
            case PREFERRED -> {
                if (shiftType == null) {
                    throw new BusinessException(INVALID_CONSTRAINT, "希望にはシフト種別が必要です", kind);
                }
                if (date != null && dayOfWeek != null) {
                    throw new BusinessException(INVALID_CONSTRAINT, "希望は日付か曜日のどちらか一方を指定してください", kind);
                }
            }
            case AVOIDED -> {
                if (shiftType == null) {
                    throw new BusinessException(INVALID_CONSTRAINT, "回避にはシフト種別が必要です", kind);
                }
            }
        }
    }
}
