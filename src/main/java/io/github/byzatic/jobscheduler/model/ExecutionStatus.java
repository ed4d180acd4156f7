package io.github.byzatic.jobscheduler.model;

import org.jetbrains.annotations.NotNull;

/**
 * Status of a single execution. RUNNING is the only non-terminal value.
 */
public enum ExecutionStatus {
    RUNNING("running"),
    SUCCESS("success"),
    ERROR("error");

    private final String tag;

    ExecutionStatus(String tag) {
        this.tag = tag;
    }

    public @NotNull String tag() {
        return tag;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @Override
    public String toString() {
        return tag;
    }
}
