package io.github.byzatic.jobscheduler;


import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Generates identifiers for jobs and executions.
 */
public class IdProvider {

    /**
     * Generates an id for a job registered without one.
     *
     * @return a random UUID string
     */
    public static @NotNull String generateJobId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Generates an id for a single execution attempt.
     *
     * @return a random UUID string
     */
    public static @NotNull String generateExecutionId() {
        return UUID.randomUUID().toString();
    }
}
