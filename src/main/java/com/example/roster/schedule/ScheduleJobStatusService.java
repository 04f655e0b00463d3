package com.example.roster.schedule;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 非同期シミュレーションの進捗をジョブIDごとに保持する。メモリ上のみで、再起動で消える。
 * 終了したジョブは新しい順に {@code roster.schedule.jobs.retained} 件だけ残す。実行中のジョブは消さない。
 */
@Component
public class ScheduleJobStatusService {

    public static class Status {
        public final String jobId;
        public final LocalDate start;
        public final LocalDate end;
        public volatile boolean running;
        public volatile boolean done;
        public volatile boolean failed;
        public volatile String error;
        public volatile LocalDateTime startedAt;
        public volatile LocalDateTime finishedAt;
        public volatile PlanResult result;

        Status(String jobId, LocalDate start, LocalDate end) {
            this.jobId = jobId;
            this.start = start;
            this.end = end;
        }
    }

    static final int DEFAULT_RETAINED_JOBS = 50;

    private final Map<String, Status> jobs = new ConcurrentHashMap<>();
    private final Deque<String> finishedJobs = new ConcurrentLinkedDeque<>();

    @Value("${roster.schedule.jobs.retained:50}")
    private int retainedJobs = DEFAULT_RETAINED_JOBS;

    public String start(LocalDate start, LocalDate end) {
        String jobId = UUID.randomUUID().toString();
        Status s = new Status(jobId, start, end);
        s.running = true;
        s.startedAt = LocalDateTime.now();
        jobs.put(jobId, s);
        return jobId;
    }

    public void finish(String jobId, PlanResult result) {
        Status s = require(jobId);
        s.result = result;
        s.running = false;
        s.done = true;
        s.finishedAt = LocalDateTime.now();
        retire(jobId);
    }

    public void fail(String jobId, String error) {
        Status s = require(jobId);
        s.error = error;
        s.failed = true;
        s.running = false;
        s.done = true;
        s.finishedAt = LocalDateTime.now();
        retire(jobId);
    }

    public Optional<Status> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    private void retire(String jobId) {
        finishedJobs.addLast(jobId);
        while (finishedJobs.size() > Math.max(0, retainedJobs)) {
            String oldest = finishedJobs.pollFirst();
            if (oldest == null) {
                break;
            }
            jobs.remove(oldest);
        }
    }

    private Status require(String jobId) {
        Status s = jobs.get(jobId);
        if (s == null) {
            throw new IllegalStateException("Unknown schedule job: " + jobId);
        }
        return s;
    }
}
