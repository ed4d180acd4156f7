package io.github.byzatic.jobscheduler.recorder;

import io.github.byzatic.jobscheduler.model.ExecutionStatus;
import io.github.byzatic.jobscheduler.model.JobType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * One execution attempt of a job. Instances are immutable; finishing produces a new instance.
 */
public final class Execution {
    private final String id;
    private final String jobId;
    private final JobType jobType;
    private final ExecutionStatus status;
    private final String message;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Integer duration;

    private Execution(String id, String jobId, JobType jobType, ExecutionStatus status, String message,
                      Instant startedAt, Instant completedAt, Integer duration) {
        this.id = id;
        this.jobId = jobId;
        this.jobType = jobType;
        this.status = status;
        this.message = message;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.duration = duration;
    }

    static Execution started(String id, String jobId, JobType jobType, Instant startedAt) {
        return new Execution(id, jobId, jobType, ExecutionStatus.RUNNING, "Job execution started", startedAt, null, null);
    }

    Execution finish(ExecutionStatus status, String message, Instant completedAt, int duration) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Finishing status must be terminal: " + status);
        }
        if (this.status.isTerminal()) {
            throw new IllegalStateException("Execution " + id + " is already finished with status " + this.status);
        }
        return new Execution(id, jobId, jobType, status, message, startedAt, completedAt, Math.max(0, duration));
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull String getJobId() {
        return jobId;
    }

    public @NotNull JobType getJobType() {
        return jobType;
    }

    public @NotNull ExecutionStatus getStatus() {
        return status;
    }

    public @Nullable String getMessage() {
        return message;
    }

    public @NotNull Instant getStartedAt() {
        return startedAt;
    }

    /**
     * @return completion time, {@code null} while running
     */
    public @Nullable Instant getCompletedAt() {
        return completedAt;
    }

    /**
     * @return duration in whole seconds, {@code null} while running
     */
    public @Nullable Integer getDuration() {
        return duration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Execution that = (Execution) o;
        return Objects.equals(id, that.id)
                && status == that.status
                && Objects.equals(completedAt, that.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, completedAt);
    }

    @Override
    public String toString() {
        return "Execution{id='" + id + "', jobId='" + jobId + "', jobType=" + jobType + ", status=" + status +
                ", startedAt=" + startedAt + ", completedAt=" + completedAt + ", duration=" + duration +
                (message != null ? ", message='" + message + '\'' : "") + '}';
    }
}
