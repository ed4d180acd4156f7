package io.github.byzatic.jobscheduler.registry;

import io.github.byzatic.jobscheduler.model.ExecutionStatus;
import io.github.byzatic.jobscheduler.model.FrequencyType;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobInfo;
import io.github.byzatic.jobscheduler.model.JobState;
import io.github.byzatic.jobscheduler.model.JobType;
import io.github.byzatic.jobscheduler.trigger.Trigger;

import java.time.Instant;

// mutable fields are guarded by the owning JobRegistry
final class JobEntry {
    final String id;
    final Job job;
    final JobType jobType;
    final FrequencyType frequencyType;
    final Trigger trigger;

    long version;
    boolean active;
    JobState state = JobState.SCHEDULED;
    Instant lastRun = null;
    Instant nextRun = null;
    ExecutionStatus lastStatus = null;
    String lastError = null;

    JobEntry(String id, Job job, JobType jobType, FrequencyType frequencyType, Trigger trigger, boolean active) {
        this.id = id;
        this.job = job;
        this.jobType = jobType;
        this.frequencyType = frequencyType;
        this.trigger = trigger;
        this.active = active;
    }

    JobInfo toInfo() {
        return new JobInfo(id, job.getName(), jobType, frequencyType, active, state, lastRun, nextRun, lastStatus, lastError);
    }
}
