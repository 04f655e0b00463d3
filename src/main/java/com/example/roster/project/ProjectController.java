package com.example.roster.project;

import com.example.roster.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ProjectDto>>> getAllProjects() {
        List<ProjectDto> data = projectService.findAll().stream().map(ProjectDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success("プロジェクト一覧を取得しました", data, Map.of("count", data.size())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ProjectDto>> getProject(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("プロジェクトを取得しました",
                ProjectDto.from(projectService.findProject(id))));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ProjectDto>> createProject(@Valid @RequestBody ProjectRequest request) {
        Project project = projectService.createProject(request.name(), request.hourlyRate(), request.active(),
                request.requirements());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("プロジェクトを作成しました", ProjectDto.from(project)));
    }

    @PutMapping("/{id}/active")
    public ResponseEntity<ApiResponse<ProjectDto>> updateActive(@PathVariable Long id,
                                                                @Valid @RequestBody ActiveRequest request) {
        Project project = projectService.updateActive(id, request.active());
        return ResponseEntity.ok(ApiResponse.success("プロジェクトの状態を更新しました", ProjectDto.from(project)));
    }

    @PutMapping("/{id}/rate")
    public ResponseEntity<ApiResponse<ProjectDto>> updateRate(@PathVariable Long id,
                                                              @Valid @RequestBody RateRequest request) {
        Project project = projectService.updateRate(id, request.hourlyRate());
        return ResponseEntity.ok(ApiResponse.success("時給を更新しました", ProjectDto.from(project)));
    }

    @PutMapping("/{id}/requirements")
    public ResponseEntity<ApiResponse<ProjectDto>> replaceRequirements(
            @PathVariable Long id, @RequestBody List<ProjectService.RequirementSpec> requirements) {
        Project project = projectService.replaceRequirements(id, requirements);
        return ResponseEntity.ok(ApiResponse.success("必要人数定義を更新しました", ProjectDto.from(project)));
    }

    public record ProjectRequest(
            @NotBlank(message = "プロジェクト名は必須です")
            @Size(max = 100, message = "プロジェクト名は100文字以下で入力してください") String name,
            BigDecimal hourlyRate,
            Boolean active,
            List<ProjectService.RequirementSpec> requirements) {}

    public record ActiveRequest(@NotNull(message = "有効フラグは必須です") Boolean active) {}

    public record RateRequest(@NotNull(message = "時給は必須です") BigDecimal hourlyRate) {}
}
