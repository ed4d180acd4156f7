package io.github.byzatic.jobscheduler.dispatch;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

public final class EmailNotificationTask extends SimulatedTask {
    public static final Duration DEFAULT_WORK_TIME = Duration.ofSeconds(2);

    public EmailNotificationTask() {
        this(DEFAULT_WORK_TIME);
    }

    public EmailNotificationTask(@NotNull Duration workTime) {
        super(workTime);
    }

    @Override
    protected @NotNull String completionMessage(@NotNull String jobId) {
        return "Email notification sent for job " + jobId;
    }
}
