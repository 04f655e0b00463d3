package com.example.roster.employee;

import com.example.roster.common.ApiResponse;
import com.example.roster.constraint.EmployeeConstraintRepository;
import com.example.roster.exception.BusinessException;
import com.example.roster.exception.ResourceNotFoundException;
import com.example.roster.schedule.ShiftAssignmentRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/employees")
public class EmployeeController {

    private static final Logger logger = LoggerFactory.getLogger(EmployeeController.class);

    private final EmployeeRepository employeeRepository;
    private final EmployeeConstraintRepository constraintRepository;
    private final ShiftAssignmentRepository assignmentRepository;

    public EmployeeController(EmployeeRepository employeeRepository,
                              EmployeeConstraintRepository constraintRepository,
                              ShiftAssignmentRepository assignmentRepository) {
        this.employeeRepository = employeeRepository;
        this.constraintRepository = constraintRepository;
        this.assignmentRepository = assignmentRepository;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Employee>>> getAllEmployees(
            @RequestParam(name = "activeOnly", required = false, defaultValue = "false") boolean activeOnly) {
        List<Employee> employees = activeOnly
                ? employeeRepository.findByActiveTrueOrderByIdAsc()
                : employeeRepository.findAllByOrderByIdAsc();
        return ResponseEntity.ok(ApiResponse.success("従業員一覧を取得しました", employees,
                Map.of("count", employees.size())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Employee>> getEmployee(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("従業員を取得しました", findEmployee(id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Employee>> createEmployee(@Valid @RequestBody EmployeeRequest request) {
        String name = request.name().trim();
        if (employeeRepository.findByName(name).isPresent()) {
            throw new BusinessException("DUPLICATE_NAME", "同名の従業員が既に存在します: " + name, name);
        }
        Employee employee = new Employee(name, blankToNull(request.email()), blankToNull(request.phone()));
        employee.setAdmin(Boolean.TRUE.equals(request.admin()));
        employee.setMaxWeeklyHours(request.maxWeeklyHours());
        Employee saved = employeeRepository.save(employee);
        logger.info("従業員を作成しました: ID={}, 氏名={}", saved.getId(), saved.getName());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("従業員を作成しました", saved));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Employee>> updateEmployee(@PathVariable Long id,
                                                                @Valid @RequestBody EmployeeRequest request) {
        Employee employee = findEmployee(id);
        String name = request.name().trim();
        employeeRepository.findByName(name)
                .filter(other -> !other.getId().equals(id))
                .ifPresent(other -> {
                    throw new BusinessException("DUPLICATE_NAME", "同名の従業員が既に存在します: " + name, name);
                });
        employee.setName(name);
        employee.setEmail(blankToNull(request.email()));
        employee.setPhone(blankToNull(request.phone()));
        if (request.admin() != null) {
            employee.setAdmin(request.admin());
        }
        employee.setMaxWeeklyHours(request.maxWeeklyHours());
        Employee updated = employeeRepository.save(employee);
        logger.info("従業員を更新しました: ID={}", id);
        return ResponseEntity.ok(ApiResponse.success("従業員を更新しました", updated));
    }

    @PutMapping("/{id}/active")
    public ResponseEntity<ApiResponse<Employee>> updateActive(@PathVariable Long id, @RequestBody ActiveRequest request) {
        if (request == null || request.active() == null) {
            return ResponseEntity.badRequest().body(ApiResponse.failure("有効フラグが指定されていません"));
        }
        Employee employee = findEmployee(id);
        employee.setActive(request.active());
        logger.info("従業員の有効状態を変更しました: ID={}, active={}", id, request.active());
        return ResponseEntity.ok(ApiResponse.success("従業員の状態を更新しました", employeeRepository.save(employee)));
    }

    @DeleteMapping("/{id}")
    @Transactional
    public ResponseEntity<ApiResponse<Void>> deleteEmployee(@PathVariable Long id) {
        Employee employee = findEmployee(id);
        if (assignmentRepository.existsByEmployee_Id(id)) {
            throw new BusinessException("EMPLOYEE_IN_USE",
                    "シフト割り当てがある従業員は削除できません。無効化してください: " + id, id);
        }
        constraintRepository.deleteByEmployee_Id(id);
        employeeRepository.delete(employee);
        logger.info("従業員を削除しました: ID={}, 氏名={}", id, employee.getName());
        return ResponseEntity.ok(ApiResponse.success("従業員を削除しました", null));
    }

    private Employee findEmployee(Long id) {
        return employeeRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("従業員が見つかりません: " + id, id));
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public record EmployeeRequest(
            @NotBlank(message = "氏名は必須です")
            @Size(max = 50, message = "従業員名は50文字以下で入力してください") String name,
            @Email(message = "メールアドレスの形式が正しくありません") String email,
            @Size(max = 30, message = "電話番号は30文字以下で入力してください") String phone,
            Boolean admin,
            @Min(value = 0, message = "週上限時間は0以上で指定してください") Integer maxWeeklyHours) {}

    public record ActiveRequest(Boolean active) {}
}
