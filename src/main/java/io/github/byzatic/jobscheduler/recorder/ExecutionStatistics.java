package io.github.byzatic.jobscheduler.recorder;

import io.github.byzatic.jobscheduler.model.JobType;

import java.time.LocalDate;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Aggregates over an execution history.
 */
public final class ExecutionStatistics {
    public final long totalExecutions;
    public final long successfulExecutions;
    public final long failedExecutions;
    public final long runningExecutions;
    public final Map<JobType, Long> executionsByJobType;
    public final Map<LocalDate, Long> executionsByDate;
    public final OptionalDouble averageDurationSeconds;

    ExecutionStatistics(long totalExecutions, long successfulExecutions, long failedExecutions, long runningExecutions,
                        Map<JobType, Long> executionsByJobType, Map<LocalDate, Long> executionsByDate,
                        OptionalDouble averageDurationSeconds) {
        this.totalExecutions = totalExecutions;
        this.successfulExecutions = successfulExecutions;
        this.failedExecutions = failedExecutions;
        this.runningExecutions = runningExecutions;
        this.executionsByJobType = Map.copyOf(executionsByJobType);
        this.executionsByDate = Map.copyOf(executionsByDate);
        this.averageDurationSeconds = averageDurationSeconds;
    }

    @Override
    public String toString() {
        return "ExecutionStatistics{total=" + totalExecutions + ", successful=" + successfulExecutions +
                ", failed=" + failedExecutions + ", running=" + runningExecutions +
                ", byJobType=" + executionsByJobType + ", byDate=" + executionsByDate +
                ", averageDuration=" + averageDurationSeconds + '}';
    }
}
