package io.github.byzatic.jobscheduler.dispatch;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

public final class CustomTask extends SimulatedTask {
    public static final Duration DEFAULT_WORK_TIME = Duration.ofSeconds(1);

    public CustomTask() {
        this(DEFAULT_WORK_TIME);
    }

    public CustomTask(@NotNull Duration workTime) {
        super(workTime);
    }

    @Override
    protected @NotNull String completionMessage(@NotNull String jobId) {
        return "Custom job executed for job " + jobId;
    }
}
