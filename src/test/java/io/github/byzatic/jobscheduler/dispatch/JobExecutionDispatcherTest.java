package io.github.byzatic.jobscheduler.dispatch;

import io.github.byzatic.jobscheduler.base_exceptions.JobExecutionException;
import io.github.byzatic.jobscheduler.model.JobType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JobExecutionDispatcherTest {

    @Test
    void runsTaskRegisteredForType() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        JobExecutionDispatcher dispatcher = JobExecutionDispatcher.newBuilder()
                .task(JobType.CUSTOM, seen::set)
                .build();
        dispatcher.execute(JobType.CUSTOM, "job-1");
        assertEquals("job-1", seen.get());
    }

    @Test
    void missingTypeFails() {
        JobExecutionDispatcher dispatcher = JobExecutionDispatcher.newBuilder()
                .task(JobType.CUSTOM, id -> { })
                .build();
        assertFalse(dispatcher.supports(JobType.DATA_BACKUP));
        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> dispatcher.execute(JobType.DATA_BACKUP, "job-1"));
        assertEquals("No task registered for job type data_backup", e.getMessage());
    }

    @Test
    void failuresAreWrappedWithTheirMessage() {
        JobExecutionDispatcher dispatcher = JobExecutionDispatcher.newBuilder()
                .task(JobType.CUSTOM, id -> { throw new IOException("disk full"); })
                .task(JobType.FILE_CLEANUP, id -> { throw new IllegalStateException(); })
                .build();

        JobExecutionException checked = assertThrows(JobExecutionException.class,
                () -> dispatcher.execute(JobType.CUSTOM, "job-1"));
        assertEquals("disk full", checked.getMessage());
        assertInstanceOf(IOException.class, checked.getCause());

        JobExecutionException unchecked = assertThrows(JobExecutionException.class,
                () -> dispatcher.execute(JobType.FILE_CLEANUP, "job-1"));
        assertEquals("IllegalStateException", unchecked.getMessage());
    }

    @Test
    void jobExecutionExceptionPassesThrough() {
        JobExecutionException thrown = new JobExecutionException("HTTP 500 from http://localhost");
        JobExecutionDispatcher dispatcher = JobExecutionDispatcher.newBuilder()
                .task(JobType.API_CALL, id -> { throw thrown; })
                .build();
        assertSame(thrown, assertThrows(JobExecutionException.class,
                () -> dispatcher.execute(JobType.API_CALL, "job-1")));
    }

    @Test
    void interruptionIsReportedAndFlagRestored() {
        JobExecutionDispatcher dispatcher = JobExecutionDispatcher.newBuilder()
                .task(JobType.CUSTOM, new CustomTask(Duration.ofSeconds(10)))
                .build();
        Thread.currentThread().interrupt();
        try {
            JobExecutionException e = assertThrows(JobExecutionException.class,
                    () -> dispatcher.execute(JobType.CUSTOM, "job-1"));
            assertEquals("Interrupted", e.getMessage());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void defaultTasksCoverEveryJobType() {
        JobExecutionDispatcher dispatcher = JobExecutionDispatcher.withDefaultTasks();
        assertEquals(EnumSet.allOf(JobType.class), dispatcher.supportedTypes());
    }

    @Test
    void simulatedTasksHaveStockWorkTimes() {
        assertEquals(Duration.ofSeconds(2), new EmailNotificationTask().getWorkTime());
        assertEquals(Duration.ofSeconds(5), new DataBackupTask().getWorkTime());
        assertEquals(Duration.ofSeconds(10), new ReportGenerationTask().getWorkTime());
        assertEquals(Duration.ofSeconds(3), new FileCleanupTask().getWorkTime());
        assertEquals(Duration.ofSeconds(1), new CustomTask().getWorkTime());
        assertThrows(IllegalArgumentException.class, () -> new CustomTask(Duration.ofSeconds(-1)));
    }

    @Test
    void simulatedTaskCompletes() throws Exception {
        JobExecutionDispatcher dispatcher = JobExecutionDispatcher.newBuilder()
                .task(JobType.EMAIL_NOTIFICATION, new EmailNotificationTask(Duration.ofMillis(20)))
                .build();
        dispatcher.execute(JobType.EMAIL_NOTIFICATION, "job-1");
    }
}
