package io.github.byzatic.jobscheduler.dispatch;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Base for task bodies that stand in for real work by blocking for a fixed time.
 */
public abstract class SimulatedTask implements JobTask {
    private final static Logger logger = LoggerFactory.getLogger(SimulatedTask.class);
    private final Duration workTime;

    protected SimulatedTask(@NotNull Duration workTime) {
        this.workTime = Objects.requireNonNull(workTime);
        if (workTime.isNegative()) {
            throw new IllegalArgumentException("workTime must not be negative: " + workTime);
        }
    }

    @Override
    public void execute(@NotNull String jobId) throws Exception {
        Thread.sleep(workTime.toMillis());
        logger.info(completionMessage(jobId));
    }

    public @NotNull Duration getWorkTime() {
        return workTime;
    }

    protected abstract @NotNull String completionMessage(@NotNull String jobId);
}
