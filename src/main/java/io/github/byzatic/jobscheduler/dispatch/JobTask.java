package io.github.byzatic.jobscheduler.dispatch;

import org.jetbrains.annotations.NotNull;

/**
 * Task body bound to a job type. May block; any exception marks the execution as failed.
 */
@FunctionalInterface
public interface JobTask {
    void execute(@NotNull String jobId) throws Exception;
}
