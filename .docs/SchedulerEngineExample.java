import io.github.byzatic.jobscheduler.engine.JobEventListener;
import io.github.byzatic.jobscheduler.engine.RestoreReport;
import io.github.byzatic.jobscheduler.engine.SchedulerEngine;
import io.github.byzatic.jobscheduler.engine.SchedulerEngineInterface;
import io.github.byzatic.jobscheduler.engine.SkipReason;
import io.github.byzatic.jobscheduler.model.FrequencyType;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobType;
import io.github.byzatic.jobscheduler.recorder.InMemoryExecutionLog;
import io.github.byzatic.jobscheduler.store.InMemoryJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

class SchedulerEngineExample {
    private static final Logger logger = LoggerFactory.getLogger(SchedulerEngineExample.class);

    public static void main(String[] args) throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        InMemoryExecutionLog executions = new InMemoryExecutionLog();

        // Jobs persisted by a previous run
        store.save(Job.newBuilder()
                .setName("Nightly backup")
                .setJobType(JobType.DATA_BACKUP)
                .setFrequencyType(FrequencyType.CRON)
                .putFrequencyConfig("cron_expression", "0 2 * * *")
                .putFrequencyConfig("timezone", "Europe/Berlin")
                .build());
        store.save(Job.newBuilder()
                .setName("Ping API")
                .setJobType(JobType.API_CALL)
                .setFrequencyType(FrequencyType.INTERVAL)
                .putFrequencyConfig("seconds", 10)
                .build());

        try (SchedulerEngineInterface scheduler = new SchedulerEngine.Builder()
                .recorder(executions)
                .maxConcurrentExecutions(3)
                .shutdownGrace(Duration.ofSeconds(15))
                .addListener(new MyEventListener())
                .build()
        ) {
            RestoreReport report = scheduler.restoreAll(store);
            logger.debug("[MAIN] Restore: " + report);

            // One-shot job, five seconds from now
            String reminder = scheduler.add(Job.newBuilder()
                    .setName("Reminder")
                    .setJobType(JobType.EMAIL_NOTIFICATION)
                    .setFrequencyType(FrequencyType.DATE)
                    .putFrequencyConfig("run_date", Instant.now().plusSeconds(5).toString())
                    .build());

            scheduler.start();
            Thread.sleep(30_000);

            scheduler.query(reminder).ifPresent(info ->
                    logger.debug("[MAIN] Reminder state: " + info)
            );
            logger.debug("[MAIN] Scheduler: " + scheduler.statistics());
            logger.debug("[MAIN] Executions: " + executions.statistics());
        }
    }

    /**
     * Класс листнера событий
     */
    public static class MyEventListener implements JobEventListener {
        @Override
        public void onStart(String jobId, String executionId) {
            logger.debug("[EVENT] Job started: " + jobId + " (execution " + executionId + ")");
        }

        @Override
        public void onComplete(String jobId, int durationSeconds) {
            logger.debug("[EVENT] Job completed: " + jobId + " in " + durationSeconds + "s");
        }

        @Override
        public void onError(String jobId, Throwable error) {
            logger.debug("[EVENT] Job failed: " + jobId + " - " + error.getMessage());
        }

        @Override
        public void onSkipped(String jobId, SkipReason reason) {
            logger.debug("[EVENT] Job skipped: " + jobId + " (" + reason + ")");
        }
    }
}
