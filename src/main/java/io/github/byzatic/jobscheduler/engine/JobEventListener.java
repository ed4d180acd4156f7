package io.github.byzatic.jobscheduler.engine;

import org.jetbrains.annotations.Nullable;

/**
 * Job event listener. Callbacks run on scheduler threads and must not block.
 */
public interface JobEventListener {
    /**
     * @param executionId id returned by the recorder, {@code null} if recording the start failed
     */
    default void onStart(String jobId, @Nullable String executionId) {
    }

    default void onComplete(String jobId, int durationSeconds) {
    }

    default void onError(String jobId, Throwable error) {
    }

    default void onSkipped(String jobId, SkipReason reason) {
    }
}
