package io.github.byzatic.jobscheduler.dispatch;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

public final class FileCleanupTask extends SimulatedTask {
    public static final Duration DEFAULT_WORK_TIME = Duration.ofSeconds(3);

    public FileCleanupTask() {
        this(DEFAULT_WORK_TIME);
    }

    public FileCleanupTask(@NotNull Duration workTime) {
        super(workTime);
    }

    @Override
    protected @NotNull String completionMessage(@NotNull String jobId) {
        return "File cleanup completed for job " + jobId;
    }
}
