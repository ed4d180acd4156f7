package io.github.byzatic.jobscheduler.trigger;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Optional;

/**
 * Produces fire times for a job. Implementations are immutable and side-effect free.
 */
public interface Trigger {

    /**
     * @param reference instant to search from
     * @return the first fire time strictly after {@code reference}, or empty when the trigger is exhausted
     */
    @NotNull Optional<Instant> nextFireAfter(@NotNull Instant reference);

    /**
     * @return {@code true} if the trigger can fire more than once
     */
    boolean isRecurring();
}
