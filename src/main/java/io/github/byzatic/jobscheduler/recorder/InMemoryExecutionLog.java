package io.github.byzatic.jobscheduler.recorder;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobscheduler.IdProvider;
import io.github.byzatic.jobscheduler.base_exceptions.RecorderException;
import io.github.byzatic.jobscheduler.model.ExecutionStatus;
import io.github.byzatic.jobscheduler.model.JobType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Execution history kept in memory, in start order.
 * <p>
 * With a retention cap, the oldest finished executions are evicted once the cap is exceeded; running
 * executions are never evicted. Queries and statistics only cover the retained history.
 */
@ThreadSafe
public class InMemoryExecutionLog implements ExecutionRecorder {
    private final static Logger logger = LoggerFactory.getLogger(InMemoryExecutionLog.class);

    private final Clock clock;
    private final int maxEntries;

    @GuardedBy("this")
    private final Map<String, Execution> executions = new LinkedHashMap<>();

    public InMemoryExecutionLog() {
        this(Clock.systemUTC());
    }

    public InMemoryExecutionLog(@NotNull Clock clock) {
        this(clock, Integer.MAX_VALUE);
    }

    /**
     * @param maxEntries retention cap, at least 1
     */
    public InMemoryExecutionLog(@NotNull Clock clock, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.clock = Objects.requireNonNull(clock);
        this.maxEntries = maxEntries;
    }

    @Override
    public synchronized @NotNull String onStart(@NotNull String jobId, @NotNull JobType jobType) {
        String id = IdProvider.generateExecutionId();
        executions.put(id, Execution.started(id, jobId, jobType, clock.instant()));
        logger.debug("Execution {} of job {} started", id, jobId);
        evictFinished();
        return id;
    }

    @GuardedBy("this")
    private void evictFinished() {
        Iterator<Execution> it = executions.values().iterator();
        while (executions.size() > maxEntries && it.hasNext()) {
            Execution e = it.next();
            if (e.getStatus().isTerminal()) {
                it.remove();
                logger.trace("Evicted execution {} of job {}", e.getId(), e.getJobId());
            }
        }
    }

    @Override
    public synchronized void onFinish(@NotNull String executionId, @NotNull ExecutionStatus status,
                                      @Nullable String message, int durationSeconds) throws RecorderException {
        Execution current = executions.get(executionId);
        if (current == null) {
            throw new RecorderException("Unknown execution: " + executionId);
        }
        try {
            executions.put(executionId, current.finish(status, message, clock.instant(), durationSeconds));
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new RecorderException(e.getMessage(), e);
        }
        logger.debug("Execution {} of job {} finished with status {}", executionId, current.getJobId(), status);
    }

    public synchronized @NotNull Optional<Execution> find(@NotNull String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    /**
     * @return up to {@code limit} executions, most recently started first
     */
    public synchronized @NotNull List<Execution> recent(int limit) {
        List<Execution> out = new ArrayList<>();
        List<Execution> all = new ArrayList<>(executions.values());
        for (int i = all.size() - 1; i >= 0 && out.size() < limit; i--) {
            out.add(all.get(i));
        }
        return out;
    }

    /**
     * @return up to {@code limit} executions of one job, most recently started first
     */
    public synchronized @NotNull List<Execution> forJob(@NotNull String jobId, int limit) {
        List<Execution> out = new ArrayList<>();
        List<Execution> all = new ArrayList<>(executions.values());
        for (int i = all.size() - 1; i >= 0 && out.size() < limit; i--) {
            if (all.get(i).getJobId().equals(jobId)) out.add(all.get(i));
        }
        return out;
    }

    public synchronized int size() {
        return executions.size();
    }

    public synchronized @NotNull ExecutionStatistics statistics() {
        long success = 0;
        long error = 0;
        long running = 0;
        long durationSum = 0;
        long durationCount = 0;
        Map<JobType, Long> byType = new EnumMap<>(JobType.class);
        Map<LocalDate, Long> byDate = new TreeMap<>();
        for (Execution e : executions.values()) {
            switch (e.getStatus()) {
                case SUCCESS:
                    success++;
                    break;
                case ERROR:
                    error++;
                    break;
                default:
                    running++;
            }
            if (e.getDuration() != null) {
                durationSum += e.getDuration();
                durationCount++;
            }
            byType.merge(e.getJobType(), 1L, Long::sum);
            byDate.merge(LocalDate.ofInstant(e.getStartedAt(), ZoneOffset.UTC), 1L, Long::sum);
        }
        OptionalDouble average = durationCount == 0
                ? OptionalDouble.empty()
                : OptionalDouble.of((double) durationSum / durationCount);
        return new ExecutionStatistics(executions.size(), success, error, running, byType, byDate, average);
    }
}
