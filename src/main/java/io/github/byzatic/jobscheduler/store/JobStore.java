package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.model.Job;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Durable source of job definitions, read once at startup to restore the schedule.
 */
public interface JobStore {
    @NotNull List<Job> listActiveJobs() throws Exception;
}
