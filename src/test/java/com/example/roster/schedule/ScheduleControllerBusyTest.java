package com.example.roster.schedule;

import com.example.roster.exception.BusinessException;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import java.time.LocalDate;
import java.util.Collection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleControllerBusyTest {

    private static final LocalDate START = LocalDate.of(2024, 7, 1);
    private static final LocalDate END = LocalDate.of(2024, 7, 7);

    private final ScheduleJobStatusService jobStatusService = new ScheduleJobStatusService();

    private final ScheduleService saturatedService = new ScheduleService(null, null, null, null, null, null, null) {
        @Override
        public void simulateAsync(String jobId, LocalDate start, LocalDate end, Collection<Long> projectIds) {
            throw new TaskRejectedException("scheduleExecutor is full");
        }
    };

    private final ScheduleController controller =
            new ScheduleController(saturatedService, jobStatusService, null, null);

    @Test
    void rejectedSubmission_failsTheJobAndReportsBusy() {
        assertThatThrownBy(() -> controller.simulateAsync(new ScheduleController.PlanRequest(START, END, null)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> {
                    BusinessException busy = (BusinessException) e;
                    assertThat(busy.getErrorCode()).isEqualTo(ScheduleService.SCHEDULER_BUSY);
                    String jobId = (String) busy.getParameters()[0];
                    ScheduleJobStatusService.Status status = jobStatusService.get(jobId).orElseThrow();
                    assertThat(status.running).isFalse();
                    assertThat(status.failed).isTrue();
                    assertThat(status.done).isTrue();
                });
    }
}
