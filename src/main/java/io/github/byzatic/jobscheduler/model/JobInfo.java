package io.github.byzatic.jobscheduler.model;

import java.time.Instant;

/**
 * Read-only snapshot of a registered job.
 */
public final class JobInfo {
    public final String id;
    public final String name;
    public final JobType jobType;
    public final FrequencyType frequencyType;
    public final boolean active;
    public final JobState state;
    public final Instant lastRun;
    public final Instant nextRun;
    public final ExecutionStatus lastStatus;
    public final String lastError;

    public JobInfo(String id, String name, JobType jobType, FrequencyType frequencyType, boolean active,
                   JobState state, Instant lastRun, Instant nextRun, ExecutionStatus lastStatus, String lastError) {
        this.id = id;
        this.name = name;
        this.jobType = jobType;
        this.frequencyType = frequencyType;
        this.active = active;
        this.state = state;
        this.lastRun = lastRun;
        this.nextRun = nextRun;
        this.lastStatus = lastStatus;
        this.lastError = lastError;
    }

    @Override
    public String toString() {
        return "JobInfo{id='" + id + "', jobType=" + jobType + ", frequencyType=" + frequencyType +
                ", active=" + active + ", state=" + state + ", lastRun=" + lastRun + ", nextRun=" + nextRun +
                (lastStatus != null ? ", lastStatus=" + lastStatus : "") +
                (lastError != null ? ", lastError='" + lastError + '\'' : "") + '}';
    }
}
