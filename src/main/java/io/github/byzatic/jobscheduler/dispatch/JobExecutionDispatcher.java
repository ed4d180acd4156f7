package io.github.byzatic.jobscheduler.dispatch;

import io.github.byzatic.jobscheduler.base_exceptions.JobExecutionException;
import io.github.byzatic.jobscheduler.model.JobType;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps each {@link JobType} to the task body that runs it.
 * <p>
 * The dispatcher adds no retries. Every failure of a body, checked or not, is reported as a
 * {@link JobExecutionException} whose message describes the cause.
 */
public final class JobExecutionDispatcher {
    private final Map<JobType, JobTask> tasks;

    private JobExecutionDispatcher(Builder b) {
        this.tasks = Collections.unmodifiableMap(new EnumMap<>(b.tasks));
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Dispatcher with the stock body for every job type.
     */
    public static JobExecutionDispatcher withDefaultTasks() {
        return newBuilder()
                .task(JobType.EMAIL_NOTIFICATION, new EmailNotificationTask())
                .task(JobType.DATA_BACKUP, new DataBackupTask())
                .task(JobType.REPORT_GENERATION, new ReportGenerationTask())
                .task(JobType.API_CALL, new ApiCallTask())
                .task(JobType.FILE_CLEANUP, new FileCleanupTask())
                .task(JobType.CUSTOM, new CustomTask())
                .build();
    }

    public boolean supports(@NotNull JobType jobType) {
        return tasks.containsKey(jobType);
    }

    public @NotNull Set<JobType> supportedTypes() {
        return tasks.keySet();
    }

    /**
     * Runs the body for {@code jobType} on the calling thread.
     *
     * @throws JobExecutionException if no body is registered or the body fails
     */
    public void execute(@NotNull JobType jobType, @NotNull String jobId) throws JobExecutionException {
        JobTask task = tasks.get(jobType);
        if (task == null) {
            throw new JobExecutionException("No task registered for job type " + jobType);
        }
        try {
            task.execute(jobId);
        } catch (JobExecutionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobExecutionException("Interrupted", e);
        } catch (Exception e) {
            throw new JobExecutionException(describe(e), e);
        }
    }

    static @NotNull String describe(@NotNull Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }

    public static final class Builder {
        private final Map<JobType, JobTask> tasks = new EnumMap<>(JobType.class);

        private Builder() {
        }

        public Builder task(@NotNull JobType jobType, @NotNull JobTask task) {
            tasks.put(Objects.requireNonNull(jobType), Objects.requireNonNull(task));
            return this;
        }

        public JobExecutionDispatcher build() {
            return new JobExecutionDispatcher(this);
        }
    }
}
