package io.github.byzatic.jobscheduler.engine;

import io.github.byzatic.jobscheduler.IdProvider;
import io.github.byzatic.jobscheduler.base_exceptions.JobExecutionException;
import io.github.byzatic.jobscheduler.base_exceptions.NotFoundException;
import io.github.byzatic.jobscheduler.base_exceptions.RecorderException;
import io.github.byzatic.jobscheduler.base_exceptions.ValidationException;
import io.github.byzatic.jobscheduler.dispatch.JobExecutionDispatcher;
import io.github.byzatic.jobscheduler.model.ExecutionStatus;
import io.github.byzatic.jobscheduler.model.FrequencyType;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobInfo;
import io.github.byzatic.jobscheduler.model.JobState;
import io.github.byzatic.jobscheduler.model.JobType;
import io.github.byzatic.jobscheduler.recorder.ExecutionRecorder;
import io.github.byzatic.jobscheduler.registry.FireDecision;
import io.github.byzatic.jobscheduler.registry.JobRegistry;
import io.github.byzatic.jobscheduler.store.JobStore;
import io.github.byzatic.jobscheduler.trigger.Trigger;
import io.github.byzatic.jobscheduler.trigger.TriggerFactory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * SchedulerEngine
 * - Cron, interval and one-shot date triggers
 * - One timer thread taking fire events from a DelayQueue
 * - Bounded worker pool (3 concurrent executions by default)
 * - At most one running execution per job; overlapping fire events are dropped
 * - Execution history reported to an {@link ExecutionRecorder}
 * - Add/update/pause/resume/remove at runtime, restore from a {@link JobStore} at startup
 */
public final class SchedulerEngine implements SchedulerEngineInterface {
    private final static Logger logger = LoggerFactory.getLogger(SchedulerEngine.class);

    static final String SUCCESS_MESSAGE = "Job completed successfully";
    static final String FAILURE_PREFIX = "Job failed: ";

    private final ThreadPoolExecutor executor;
    private final JobExecutionDispatcher dispatcher;
    private final ExecutionRecorder recorder;
    private final Clock clock;
    private final long shutdownGraceMillis;
    private final List<JobEventListener> listeners;
    private final JobRegistry registry = new JobRegistry();
    private final DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Thread timer;

    private SchedulerEngine(Builder b) {
        this.executor = b.executor;
        this.dispatcher = b.dispatcher;
        this.recorder = b.recorder;
        this.clock = b.clock;
        this.shutdownGraceMillis = b.shutdownGraceMillis;
        this.listeners = new CopyOnWriteArrayList<>(b.listeners);

        this.timer = new Thread(this::dispatchLoop, "job-scheduler-dispatcher");
        this.timer.setDaemon(true);
    }

    public static final class Builder {
        private ThreadPoolExecutor executor;
        private JobExecutionDispatcher dispatcher;
        private ExecutionRecorder recorder;
        private Clock clock = Clock.systemUTC();
        private int maxConcurrentExecutions = 3;
        private long shutdownGraceMillis = 10_000; // 10s
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        /**
         * Receiver of the execution history. Required.
         */
        public Builder recorder(ExecutionRecorder recorder) {
            this.recorder = Objects.requireNonNull(recorder);
            return this;
        }

        /**
         * Task bodies per job type. Defaults to {@link JobExecutionDispatcher#withDefaultTasks()}.
         */
        public Builder dispatcher(JobExecutionDispatcher dispatcher) {
            this.dispatcher = Objects.requireNonNull(dispatcher);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * Global ceiling of simultaneous executions. Ignored when a custom executor is set.
         */
        public Builder maxConcurrentExecutions(int maxConcurrentExecutions) {
            if (maxConcurrentExecutions < 1) {
                throw new IllegalArgumentException("maxConcurrentExecutions must be positive: " + maxConcurrentExecutions);
            }
            this.maxConcurrentExecutions = maxConcurrentExecutions;
            return this;
        }

        /**
         * Provide your own custom thread pool.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * How long {@link SchedulerEngine#shutdown(boolean)} waits for running executions.
         */
        public Builder shutdownGrace(Duration grace) {
            this.shutdownGraceMillis = Objects.requireNonNull(grace).toMillis();
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public SchedulerEngine build() {
            if (recorder == null) {
                throw new IllegalStateException("An ExecutionRecorder is required");
            }
            if (dispatcher == null) {
                dispatcher = JobExecutionDispatcher.withDefaultTasks();
            }
            if (executor == null) {
                AtomicInteger threadSeq = new AtomicInteger();
                executor = new ThreadPoolExecutor(
                        maxConcurrentExecutions,
                        maxConcurrentExecutions,
                        60, TimeUnit.SECONDS,
                        new LinkedBlockingQueue<>(),
                        r -> {
                            Thread t = new Thread(r, "job-exec-" + threadSeq.incrementAndGet());
                            t.setDaemon(false);
                            t.setUncaughtExceptionHandler((th, ex) ->
                                    logger.error("Uncaught in {}", th.getName(), ex));
                            return t;
                        }
                );
                executor.allowCoreThreadTimeOut(true);
            }
            return new SchedulerEngine(this);
        }
    }

    // ======== Public API ========

    @Override
    public void addListener(JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    @Override
    public void removeListener(JobEventListener l) {
        listeners.remove(l);
    }

    /**
     * Registers a job. A job with an id that is already registered replaces the prior registration.
     *
     * @return the job id, generated when the job has none
     * @throws ValidationException if the job type or the frequency configuration is invalid; nothing is registered
     */
    @Override
    public @NotNull String add(@NotNull Job job) throws ValidationException {
        Objects.requireNonNull(job);
        ensureOpen();
        String id = register(job, clock.instant());
        logger.info("Added job {} with job type {}", id, job.getJobType());
        return id;
    }

    /**
     * Replaces the trigger and definition of a registered job. A running execution is not affected.
     */
    @Override
    public void update(@NotNull Job job) throws ValidationException, NotFoundException {
        Objects.requireNonNull(job);
        ensureOpen();
        String id = job.getId();
        if (id == null || id.isBlank()) {
            throw new ValidationException("Job id is required for update");
        }
        Instant now = clock.instant();
        Resolved r = resolve(job, now, now);
        Instant first = r.trigger.nextFireAfter(now).orElse(null);
        long version = registry.replace(id, Job.newBuilder(job).setId(id).build(), r.jobType, r.frequencyType, r.trigger, first);
        enqueue(id, version, first);
        logger.info("Updated job {}", id);
    }

    /**
     * Deactivates a job. Its pending fire time is kept; fire events are dropped while paused.
     */
    @Override
    public void pause(@NotNull String jobId) throws NotFoundException {
        registry.setActive(jobId, false);
        logger.info("Paused job {}", jobId);
    }

    /**
     * Reactivates a job without recomputing its next fire time.
     */
    @Override
    public void resume(@NotNull String jobId) throws NotFoundException {
        registry.setActive(jobId, true);
        logger.info("Resumed job {}", jobId);
    }

    /**
     * Unregisters a job. A running execution completes and is still recorded.
     */
    @Override
    public void remove(@NotNull String jobId) throws NotFoundException {
        if (!registry.remove(jobId)) {
            throw new NotFoundException("Job not found: " + jobId);
        }
        logger.info("Removed job {}", jobId);
    }

    /**
     * Registers a job loaded from the store at startup. Interval triggers are anchored on the job's last run.
     *
     * @return {@code false} if the job could not be registered; the failure is logged
     */
    @Override
    public boolean restore(@NotNull Job job) {
        return restoreOne(job) == null;
    }

    /**
     * Restores every active job of {@code store}. A failing job never prevents the others from being restored.
     */
    @Override
    public @NotNull RestoreReport restoreAll(@NotNull JobStore store) {
        List<Job> jobs;
        try {
            jobs = store.listActiveJobs();
        } catch (Exception e) {
            logger.error("Failed to restore jobs: could not list active jobs", e);
            return new RestoreReport(List.of(), Map.of(), describe(e));
        }
        List<String> restored = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            String failure = restoreOne(job);
            String key = job.getId() != null ? job.getId() : "#" + i;
            if (failure == null) {
                restored.add(key);
            } else {
                failed.put(key, failure);
            }
        }
        logger.info("Restored {} active jobs ({} failed)", restored.size(), failed.size());
        return new RestoreReport(restored, failed, null);
    }

    @Override
    public @NotNull Optional<JobInfo> query(@NotNull String jobId) {
        return registry.lookup(jobId);
    }

    @Override
    public @NotNull List<JobInfo> listJobs() {
        return registry.snapshot();
    }

    @Override
    public @NotNull SchedulerStatistics statistics() {
        int active = 0;
        int runningJobs = 0;
        int completed = 0;
        List<JobInfo> jobs = registry.snapshot();
        for (JobInfo info : jobs) {
            if (info.active) active++;
            if (info.state == JobState.RUNNING || info.state == JobState.FIRING) runningJobs++;
            if (info.state == JobState.COMPLETED) completed++;
        }
        return new SchedulerStatistics(jobs.size(), active, jobs.size() - active, runningJobs, completed);
    }

    /**
     * Starts the timer thread. Fire times reached before the start are processed immediately.
     */
    @Override
    public void start() {
        ensureOpen();
        if (running.compareAndSet(false, true)) {
            timer.start();
            logger.info("Scheduler started");
        }
    }

    /**
     * Stops the timer thread and the worker pool.
     *
     * @param waitForRunning wait up to the shutdown grace period for running executions before interrupting them
     */
    @Override
    public void shutdown(boolean waitForRunning) {
        if (!closed.compareAndSet(false, true)) return;
        running.set(false);
        timer.interrupt();
        queue.clear();
        executor.shutdown();
        if (waitForRunning) {
            try {
                if (!executor.awaitTermination(shutdownGraceMillis, TimeUnit.MILLISECONDS)) {
                    logger.warn("Executions still running after {} ms, interrupting", shutdownGraceMillis);
                    executor.shutdownNow();
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        } else {
            executor.shutdownNow();
        }
        logger.info("Scheduler shut down");
    }

    @Override
    public void close() {
        shutdown(true);
    }

    // ======== Internal ========

    /**
     * Processes every due fire event on the calling thread.
     *
     * @return number of fire events taken from the queue
     */
    int runPendingFireEvents() {
        if (closed.get()) return 0;
        int handled = 0;
        ScheduledEntry entry;
        while ((entry = queue.poll()) != null) {
            try {
                handle(entry);
            } catch (RuntimeException e) {
                logger.error("Failed to process fire event {}", entry, e);
            }
            handled++;
        }
        return handled;
    }

    int pendingFireEvents() {
        return queue.size();
    }

    private void dispatchLoop() {
        while (running.get()) {
            try {
                ScheduledEntry entry = queue.take(); // blocks until the earliest fire time
                handle(entry);
            } catch (InterruptedException ie) {
                if (!running.get()) break;
            } catch (Throwable t) {
                logger.error("Dispatcher error", t);
            }
        }
    }

    private void handle(ScheduledEntry entry) {
        Instant now = clock.instant();
        Instant fireTime = Instant.ofEpochMilli(entry.triggerAtMillis);
        FireDecision decision = registry.beginFiring(entry.jobId, entry.version, now);
        switch (decision.kind) {
            case STALE:
                logger.debug("Dropping stale fire event {}", entry);
                break;
            case SKIP_INACTIVE:
                logger.debug("Job {} is paused, skipping fire time {}", decision.jobId, fireTime);
                scheduleNext(decision, fireTime, now);
                fire(l -> l.onSkipped(decision.jobId, SkipReason.PAUSED));
                break;
            case SKIP_OVERLAP:
                logger.warn("Job {} is still running, skipping fire time {}", decision.jobId, fireTime);
                scheduleNext(decision, fireTime, now);
                fire(l -> l.onSkipped(decision.jobId, SkipReason.ALREADY_RUNNING));
                break;
            case RUN:
                logger.debug("Firing job {} scheduled for {}", decision.jobId, fireTime);
                scheduleNext(decision, fireTime, now);
                submitRun(decision);
                break;
        }
    }

    // Missed fire times are not replayed: the next one is searched from now.
    private void scheduleNext(FireDecision decision, Instant fireTime, Instant now) {
        Instant reference = fireTime.isAfter(now) ? fireTime : now;
        Instant next = decision.trigger.nextFireAfter(reference).orElse(null);
        OptionalLong version = registry.reschedule(decision.jobId, decision.version, next);
        if (version.isPresent()) {
            queue.offer(new ScheduledEntry(decision.jobId, version.getAsLong(), next.toEpochMilli(), clock));
        } else if (next == null) {
            logger.info("Job {} has no further fire times", decision.jobId);
        }
    }

    private void submitRun(FireDecision decision) {
        try {
            executor.execute(() -> runExecution(decision));
        } catch (RejectedExecutionException e) {
            registry.abortRun(decision.jobId);
            logger.warn("Execution of job {} rejected: {}", decision.jobId, e.getMessage());
        }
    }

    private void runExecution(FireDecision decision) {
        String jobId = decision.jobId;
        JobType jobType = decision.jobType;
        registry.markRunning(jobId);
        Instant startedAt = clock.instant();
        String executionId = recordStart(jobId, jobType);
        fire(l -> l.onStart(jobId, executionId));
        logger.info("Starting job execution: {} ({})", jobId, jobType);

        ExecutionStatus status = ExecutionStatus.ERROR;
        String message = null;
        Throwable failure = null;
        int duration = 0;
        try {
            try {
                dispatcher.execute(jobType, jobId);
                status = ExecutionStatus.SUCCESS;
                message = SUCCESS_MESSAGE;
            } catch (JobExecutionException e) {
                failure = e;
                message = FAILURE_PREFIX + e.getMessage();
            } catch (Throwable t) {
                failure = t;
                message = FAILURE_PREFIX + t;
            }
            duration = elapsedSeconds(startedAt);
            if (executionId != null) {
                recordFinish(executionId, jobId, status, message, duration);
            }
        } finally {
            registry.finishRun(jobId, status, message);
        }

        if (failure == null) {
            logger.info("Job completed successfully: {} ({}) in {}s", jobId, jobType, duration);
            int completedIn = duration;
            fire(l -> l.onComplete(jobId, completedIn));
        } else {
            logger.error("Job failed: {} ({}) - {}", jobId, jobType, message);
            Throwable error = failure;
            fire(l -> l.onError(jobId, error));
        }
    }

    private @Nullable String recordStart(String jobId, JobType jobType) {
        try {
            return recorder.onStart(jobId, jobType);
        } catch (RecorderException | RuntimeException e) {
            logger.warn("Failed to record start of job {}: {}", jobId, describe(e), e);
            return null;
        }
    }

    private void recordFinish(String executionId, String jobId, ExecutionStatus status, String message, int duration) {
        try {
            recorder.onFinish(executionId, status, message, duration);
        } catch (RecorderException | RuntimeException e) {
            logger.warn("Failed to record {} of job {} (execution {}): {}", status, jobId, executionId, describe(e), e);
        }
    }

    private int elapsedSeconds(Instant startedAt) {
        long seconds = Duration.between(startedAt, clock.instant()).getSeconds();
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, seconds));
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (RuntimeException e) {
                logger.warn("Job event listener {} failed", l, e);
            }
        }
    }

    private @NotNull String register(Job job, Instant anchor) throws ValidationException {
        String id = job.getId() == null || job.getId().isBlank() ? IdProvider.generateJobId() : job.getId();
        Instant now = clock.instant();
        Resolved r = resolve(job, anchor, now);
        Instant first = r.trigger.nextFireAfter(now).orElse(null);
        if (first == null) {
            logger.warn("Job {} has no future fire time, registering it as completed", id);
        }
        long version = registry.insert(id, Job.newBuilder(job).setId(id).build(), r.jobType, r.frequencyType, r.trigger, first);
        enqueue(id, version, first);
        return id;
    }

    private @Nullable String restoreOne(Job job) {
        try {
            ensureOpen();
            Instant anchor = job.getLastRun() != null ? job.getLastRun() : clock.instant();
            String id = register(job, anchor);
            logger.info("Restored job {}", id);
            return null;
        } catch (ValidationException | RuntimeException e) {
            logger.error("Failed to restore job {}: {}", job.getId(), describe(e));
            return describe(e);
        }
    }

    private void enqueue(String id, long version, @Nullable Instant fireTime) {
        if (fireTime != null) {
            queue.offer(new ScheduledEntry(id, version, fireTime.toEpochMilli(), clock));
        }
    }

    private Resolved resolve(Job job, Instant anchor, Instant now) throws ValidationException {
        JobType jobType = JobType.fromTag(job.getJobType());
        if (!dispatcher.supports(jobType)) {
            throw new ValidationException("No task registered for job type " + jobType);
        }
        FrequencyType frequencyType = FrequencyType.fromTag(job.getFrequencyType());
        Trigger trigger = TriggerFactory.resolve(frequencyType, job.getFrequencyConfig(), anchor, now);
        return new Resolved(jobType, frequencyType, trigger);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Scheduler is shut down");
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static final class Resolved {
        final JobType jobType;
        final FrequencyType frequencyType;
        final Trigger trigger;

        Resolved(JobType jobType, FrequencyType frequencyType, Trigger trigger) {
            this.jobType = jobType;
            this.frequencyType = frequencyType;
            this.trigger = trigger;
        }
    }
}
