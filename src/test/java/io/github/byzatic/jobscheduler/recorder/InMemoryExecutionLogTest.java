package io.github.byzatic.jobscheduler.recorder;

import io.github.byzatic.jobscheduler.base_exceptions.RecorderException;
import io.github.byzatic.jobscheduler.model.ExecutionStatus;
import io.github.byzatic.jobscheduler.model.JobType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryExecutionLogTest {
    private static final Instant T0 = Instant.parse("2025-03-10T23:59:00Z");

    InMemoryExecutionLog log;

    @BeforeEach
    void setUp() {
        log = new InMemoryExecutionLog(Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void startThenFinish() throws Exception {
        String id = log.onStart("job-1", JobType.DATA_BACKUP);
        Execution started = log.find(id).get();
        assertEquals(ExecutionStatus.RUNNING, started.getStatus());
        assertEquals("Job execution started", started.getMessage());
        assertEquals(T0, started.getStartedAt());
        assertNull(started.getCompletedAt());
        assertNull(started.getDuration());

        log.onFinish(id, ExecutionStatus.SUCCESS, "Job completed successfully", 5);
        Execution done = log.find(id).get();
        assertEquals(ExecutionStatus.SUCCESS, done.getStatus());
        assertEquals("Job completed successfully", done.getMessage());
        assertEquals(T0, done.getCompletedAt());
        assertEquals(5, done.getDuration());
        assertEquals("job-1", done.getJobId());
        assertEquals(JobType.DATA_BACKUP, done.getJobType());
    }

    @Test
    void finishIsAcceptedOnce() throws Exception {
        String id = log.onStart("job-1", JobType.CUSTOM);
        log.onFinish(id, ExecutionStatus.ERROR, "Job failed: boom", 0);
        assertThrows(RecorderException.class, () -> log.onFinish(id, ExecutionStatus.SUCCESS, null, 1));
        assertEquals(ExecutionStatus.ERROR, log.find(id).get().getStatus());
    }

    @Test
    void finishRejectsUnknownIdAndRunningStatus() throws Exception {
        assertThrows(RecorderException.class, () -> log.onFinish("nope", ExecutionStatus.SUCCESS, null, 1));
        String id = log.onStart("job-1", JobType.CUSTOM);
        assertThrows(RecorderException.class, () -> log.onFinish(id, ExecutionStatus.RUNNING, null, 1));
    }

    @Test
    void recentAndForJobAreNewestFirst() throws Exception {
        String a = log.onStart("job-1", JobType.CUSTOM);
        String b = log.onStart("job-2", JobType.CUSTOM);
        String c = log.onStart("job-1", JobType.CUSTOM);

        List<Execution> recent = log.recent(2);
        assertEquals(2, recent.size());
        assertEquals(c, recent.get(0).getId());
        assertEquals(b, recent.get(1).getId());

        List<Execution> job1 = log.forJob("job-1", 10);
        assertEquals(2, job1.size());
        assertEquals(c, job1.get(0).getId());
        assertEquals(a, job1.get(1).getId());
        assertEquals(3, log.size());
    }

    @Test
    void statisticsAggregateHistory() throws Exception {
        String a = log.onStart("job-1", JobType.DATA_BACKUP);
        String b = log.onStart("job-2", JobType.API_CALL);
        log.onStart("job-3", JobType.API_CALL);
        log.onFinish(a, ExecutionStatus.SUCCESS, "Job completed successfully", 4);
        log.onFinish(b, ExecutionStatus.ERROR, "Job failed: HTTP 500", 1);

        ExecutionStatistics stats = log.statistics();
        assertEquals(3, stats.totalExecutions);
        assertEquals(1, stats.successfulExecutions);
        assertEquals(1, stats.failedExecutions);
        assertEquals(1, stats.runningExecutions);
        assertEquals(2L, stats.executionsByJobType.get(JobType.API_CALL));
        assertEquals(1L, stats.executionsByJobType.get(JobType.DATA_BACKUP));
        assertEquals(3L, stats.executionsByDate.get(LocalDate.of(2025, 3, 10)));
        assertEquals(2.5, stats.averageDurationSeconds.getAsDouble(), 1e-9);
    }

    @Test
    void emptyLogHasNoAverage() {
        ExecutionStatistics stats = log.statistics();
        assertEquals(0, stats.totalExecutions);
        assertTrue(stats.averageDurationSeconds.isEmpty());
    }

    @Test
    void retentionCapEvictsOldestFinished() throws Exception {
        InMemoryExecutionLog capped = new InMemoryExecutionLog(Clock.fixed(T0, ZoneOffset.UTC), 2);
        String running = capped.onStart("job-1", JobType.CUSTOM);
        String a = capped.onStart("job-2", JobType.CUSTOM);
        capped.onFinish(a, ExecutionStatus.SUCCESS, null, 1);
        String b = capped.onStart("job-3", JobType.CUSTOM);

        assertEquals(2, capped.size());
        assertTrue(capped.find(running).isPresent());
        assertTrue(capped.find(a).isEmpty());
        assertTrue(capped.find(b).isPresent());

        capped.onFinish(running, ExecutionStatus.SUCCESS, null, 3);
        assertEquals(ExecutionStatus.SUCCESS, capped.find(running).get().getStatus());
        assertThrows(IllegalArgumentException.class, () -> new InMemoryExecutionLog(Clock.systemUTC(), 0));
    }
}
