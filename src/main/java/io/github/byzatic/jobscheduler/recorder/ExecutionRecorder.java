package io.github.byzatic.jobscheduler.recorder;

import io.github.byzatic.jobscheduler.base_exceptions.RecorderException;
import io.github.byzatic.jobscheduler.model.ExecutionStatus;
import io.github.byzatic.jobscheduler.model.JobType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Receives the execution history produced by the scheduler.
 * <p>
 * Both calls are made from worker threads, never from the timer loop and never while the
 * job registry is locked. A failure is logged by the caller and otherwise ignored.
 */
public interface ExecutionRecorder {

    /**
     * Records the start of an execution with status {@link ExecutionStatus#RUNNING}.
     *
     * @return id of the new execution record
     */
    @NotNull String onStart(@NotNull String jobId, @NotNull JobType jobType) throws RecorderException;

    /**
     * Finalizes an execution. Called exactly once per successful {@link #onStart}.
     *
     * @param status          {@link ExecutionStatus#SUCCESS} or {@link ExecutionStatus#ERROR}
     * @param durationSeconds elapsed whole seconds, never negative
     */
    void onFinish(@NotNull String executionId, @NotNull ExecutionStatus status, @Nullable String message,
                  int durationSeconds) throws RecorderException;
}
