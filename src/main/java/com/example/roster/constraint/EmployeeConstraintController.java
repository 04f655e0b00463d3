package com.example.roster.constraint;

import com.example.roster.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/employees/{employeeId}/constraints")
public class EmployeeConstraintController {

    private final EmployeeConstraintService constraintService;

    public EmployeeConstraintController(EmployeeConstraintService constraintService) {
        this.constraintService = constraintService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<EmployeeConstraintDto>>> listConstraints(@PathVariable Long employeeId) {
        List<EmployeeConstraintDto> data = constraintService.getEmployeeConstraints(employeeId).stream()
                .map(EmployeeConstraintDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("制約一覧を取得しました", data));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<EmployeeConstraintDto>> createConstraint(@PathVariable Long employeeId,
                                                                               @Valid @RequestBody ConstraintRequest request) {
        EmployeeConstraint constraint = constraintService.createConstraint(
                employeeId,
                request.kind(),
                request.shiftType(),
                request.dayOfWeek(),
                request.date(),
                request.reason()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("制約を作成しました", EmployeeConstraintDto.from(constraint)));
    }

    @DeleteMapping("/{constraintId}")
    public ResponseEntity<ApiResponse<Void>> deleteConstraint(@PathVariable Long employeeId,
                                                              @PathVariable Long constraintId) {
        constraintService.deleteConstraint(employeeId, constraintId);
        return ResponseEntity.ok(ApiResponse.success("制約を削除しました", null));
    }

    public record ConstraintRequest(
            @NotNull(message = "制約種別は必須です") EmployeeConstraint.ConstraintKind kind,
            String shiftType,
            DayOfWeek dayOfWeek,
            LocalDate date,
            @Size(max = 200, message = "理由は200文字以下で入力してください") String reason) {}
}
