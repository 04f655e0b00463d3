package com.example.roster.employee;

import com.example.roster.constraint.EmployeeConstraintRepository;
import com.example.roster.engine.AssignmentStatus;
import com.example.roster.engine.ShiftType;
import com.example.roster.project.Project;
import com.example.roster.project.ProjectRepository;
import com.example.roster.schedule.ShiftAssignment;
import com.example.roster.schedule.ShiftAssignmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class EmployeeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EmployeeRepository employeeRepository;

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private ShiftAssignmentRepository assignmentRepository;

    @Autowired
    private EmployeeConstraintRepository constraintRepository;

    @BeforeEach
    void setUp() {
        assignmentRepository.deleteAll();
        constraintRepository.deleteAll();
        employeeRepository.deleteAll();
    }

    @Test
    void createEmployee_withAllAttributes_persistsEmployee() throws Exception {
        String payload = """
            {
              \"name\": \"API従業員\",
              \"email\": \"api@example.com\",
              \"phone\": \"090-0000-0000\",
              \"admin\": true,
              \"maxWeeklyHours\": 30
            }
            """;

        mockMvc.perform(post("/api/employees")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.name").value("API従業員"))
            .andExpect(jsonPath("$.data.active").value(true))
            .andExpect(jsonPath("$.data.maxWeeklyHours").value(30));

        Employee saved = employeeRepository.findByName("API従業員").orElseThrow();
        assertThat(saved.getEmail()).isEqualTo("api@example.com");
        assertThat(saved.getAdmin()).isTrue();
        assertThat(saved.getMaxWeeklyHours()).isEqualTo(30);
    }

    @Test
    void createEmployee_withDuplicateName_returnsConflict() throws Exception {
        employeeRepository.save(new Employee("重複従業員"));

        mockMvc.perform(post("/api/employees")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \" 重複従業員 \"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.details.errorCode").value("DUPLICATE_NAME"));
    }

    @Test
    void createEmployee_withInvalidAttributes_returnsBadRequest() throws Exception {
        String payload = """
            {
              \"name\": \"\",
              \"email\": \"not-an-email\",
              \"maxWeeklyHours\": -1
            }
            """;

        mockMvc.perform(post("/api/employees")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("バリデーションエラー"))
            .andExpect(jsonPath("$.details.name").value("氏名は必須です"))
            .andExpect(jsonPath("$.details.email").value("メールアドレスの形式が正しくありません"))
            .andExpect(jsonPath("$.details.maxWeeklyHours").value("週上限時間は0以上で指定してください"));
    }

    @Test
    void updateEmployee_updatesAllAttributes() throws Exception {
        Employee existing = employeeRepository.save(new Employee("既存従業員", "old@example.com", null));

        String payload = """
            {
              \"name\": \"更新後従業員\",
              \"email\": \"new@example.com\",
              \"phone\": \"03-1111-2222\",
              \"maxWeeklyHours\": 20
            }
            """;

        mockMvc.perform(put("/api/employees/" + existing.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.name").value("更新後従業員"))
            .andExpect(jsonPath("$.data.email").value("new@example.com"));

        Employee updated = employeeRepository.findById(existing.getId()).orElseThrow();
        assertThat(updated.getPhone()).isEqualTo("03-1111-2222");
        assertThat(updated.getMaxWeeklyHours()).isEqualTo(20);
    }

    @Test
    void updateActive_togglesFlag_andActiveOnlyListingFollows() throws Exception {
        Employee first = employeeRepository.save(new Employee("有効従業員"));
        Employee second = employeeRepository.save(new Employee("停止予定従業員"));

        mockMvc.perform(put("/api/employees/" + second.getId() + "/active")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"active\": false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.active").value(false));

        mockMvc.perform(get("/api/employees").param("activeOnly", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.count").value(1))
            .andExpect(jsonPath("$.data[0].id").value(first.getId()));

        mockMvc.perform(put("/api/employees/" + second.getId() + "/active")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void getEmployee_unknownId_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/employees/999999"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.details.errorCode").value("NOT_FOUND"));
    }

    @Test
    void deleteEmployee_withoutAssignments_removesEmployee() throws Exception {
        Employee employee = employeeRepository.save(new Employee("削除従業員"));

        mockMvc.perform(delete("/api/employees/" + employee.getId()))
            .andExpect(status().isOk());

        assertThat(employeeRepository.findById(employee.getId())).isEmpty();
    }

    @Test
    void deleteEmployee_withAssignments_returnsConflict() throws Exception {
        Employee employee = employeeRepository.save(new Employee("勤務済み従業員"));
        Project project = projectRepository.save(new Project("削除テスト案件", new BigDecimal("10.00")));
        assignmentRepository.save(new ShiftAssignment(LocalDate.of(2024, 7, 1), ShiftType.MORNING,
                LocalTime.of(6, 0), LocalTime.of(14, 0), employee, project, AssignmentStatus.ASSIGNED));

        mockMvc.perform(delete("/api/employees/" + employee.getId()))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.details.errorCode").value("EMPLOYEE_IN_USE"));

        assertThat(employeeRepository.findById(employee.getId())).isPresent();
    }
}
