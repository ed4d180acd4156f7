package io.github.byzatic.jobscheduler.dispatch;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

public final class ReportGenerationTask extends SimulatedTask {
    public static final Duration DEFAULT_WORK_TIME = Duration.ofSeconds(10);

    public ReportGenerationTask() {
        this(DEFAULT_WORK_TIME);
    }

    public ReportGenerationTask(@NotNull Duration workTime) {
        super(workTime);
    }

    @Override
    protected @NotNull String completionMessage(@NotNull String jobId) {
        return "Report generated for job " + jobId;
    }
}
