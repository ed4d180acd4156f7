package io.github.byzatic.jobscheduler.dispatch;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

public final class DataBackupTask extends SimulatedTask {
    public static final Duration DEFAULT_WORK_TIME = Duration.ofSeconds(5);

    public DataBackupTask() {
        this(DEFAULT_WORK_TIME);
    }

    public DataBackupTask(@NotNull Duration workTime) {
        super(workTime);
    }

    @Override
    protected @NotNull String completionMessage(@NotNull String jobId) {
        return "Data backup completed for job " + jobId;
    }
}
