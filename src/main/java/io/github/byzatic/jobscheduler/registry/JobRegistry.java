package io.github.byzatic.jobscheduler.registry;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobscheduler.base_exceptions.NotFoundException;
import io.github.byzatic.jobscheduler.model.ExecutionStatus;
import io.github.byzatic.jobscheduler.model.FrequencyType;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobInfo;
import io.github.byzatic.jobscheduler.model.JobState;
import io.github.byzatic.jobscheduler.model.JobType;
import io.github.byzatic.jobscheduler.trigger.Trigger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * In-memory table of scheduled jobs.
 * <p>
 * Every method is atomic with respect to every other. The run flag is kept per job id,
 * apart from the entries, so an execution started under one registration still blocks
 * overlapping runs after the job is replaced, removed or registered again.
 * <p>
 * Each (re)scheduling assigns a new version. Fire events carry the version they were
 * queued with; an event whose version is no longer current is stale.
 */
@ThreadSafe
public class JobRegistry {

    @GuardedBy("this")
    private final Map<String, JobEntry> jobs = new LinkedHashMap<>();

    @GuardedBy("this")
    private final Set<String> running = new HashSet<>();

    @GuardedBy("this")
    private long versionSeq = 0;

    /**
     * Registers a job, replacing any entry with the same id. Run history of a replaced entry is kept.
     *
     * @param nextRun first fire time, {@code null} when the trigger is already exhausted
     * @return version of the new schedule
     */
    public synchronized long insert(@NotNull String id, @NotNull Job job, @NotNull JobType jobType,
                                    @NotNull FrequencyType frequencyType, @NotNull Trigger trigger,
                                    @Nullable Instant nextRun) {
        JobEntry previous = jobs.get(id);
        JobEntry entry = new JobEntry(id, job, jobType, frequencyType, trigger, job.isActive());
        entry.lastRun = job.getLastRun();
        if (previous != null) {
            if (entry.lastRun == null) entry.lastRun = previous.lastRun;
            entry.lastStatus = previous.lastStatus;
            entry.lastError = previous.lastError;
        }
        return install(entry, nextRun);
    }

    /**
     * Replaces the definition and trigger of a registered job. Active flag and run state are preserved.
     *
     * @return version of the new schedule
     */
    public synchronized long replace(@NotNull String id, @NotNull Job job, @NotNull JobType jobType,
                                     @NotNull FrequencyType frequencyType, @NotNull Trigger trigger,
                                     @Nullable Instant nextRun) throws NotFoundException {
        JobEntry previous = require(id);
        JobEntry entry = new JobEntry(id, job, jobType, frequencyType, trigger, previous.active);
        entry.lastRun = previous.lastRun;
        entry.lastStatus = previous.lastStatus;
        entry.lastError = previous.lastError;
        return install(entry, nextRun);
    }

    @GuardedBy("this")
    private long install(JobEntry entry, Instant nextRun) {
        entry.version = ++versionSeq;
        entry.nextRun = nextRun;
        entry.state = idleState(entry);
        jobs.put(entry.id, entry);
        return entry.version;
    }

    public synchronized boolean remove(@NotNull String id) {
        return jobs.remove(id) != null;
    }

    public synchronized void setActive(@NotNull String id, boolean active) throws NotFoundException {
        require(id).active = active;
    }

    public synchronized boolean isRunning(@NotNull String id) {
        return running.contains(id);
    }

    public synchronized @NotNull Optional<JobInfo> lookup(@NotNull String id) {
        JobEntry entry = jobs.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.toInfo());
    }

    public synchronized @NotNull List<JobInfo> snapshot() {
        List<JobInfo> out = new ArrayList<>(jobs.size());
        for (JobEntry entry : jobs.values()) out.add(entry.toInfo());
        return out;
    }

    public synchronized int size() {
        return jobs.size();
    }

    // ======== Firing transitions ========

    /**
     * Decides what a fire event for {@code id} queued with {@code version} does. On {@code RUN}
     * the run flag is claimed and the job moves to {@link JobState#FIRING}.
     */
    public synchronized @NotNull FireDecision beginFiring(@NotNull String id, long version, @NotNull Instant now) {
        JobEntry entry = jobs.get(id);
        if (entry == null || entry.version != version) {
            return FireDecision.stale(id);
        }
        if (!entry.active) {
            return FireDecision.of(FireDecision.Kind.SKIP_INACTIVE, entry);
        }
        if (running.contains(id)) {
            return FireDecision.of(FireDecision.Kind.SKIP_OVERLAP, entry);
        }
        running.add(id);
        entry.state = JobState.FIRING;
        entry.lastRun = now;
        return FireDecision.of(FireDecision.Kind.RUN, entry);
    }

    /**
     * Moves a fired job to {@link JobState#RUNNING} once its body starts on a worker.
     */
    public synchronized void markRunning(@NotNull String id) {
        JobEntry entry = jobs.get(id);
        if (entry != null && running.contains(id)) {
            entry.state = JobState.RUNNING;
        }
    }

    /**
     * Stores the next fire time after a fire event, if the schedule was not changed in the meantime.
     *
     * @param next next fire time, {@code null} when the trigger is exhausted
     * @return version to queue the next fire event with; empty when there is nothing to queue
     */
    public synchronized @NotNull OptionalLong reschedule(@NotNull String id, long version, @Nullable Instant next) {
        JobEntry entry = jobs.get(id);
        if (entry == null || entry.version != version) {
            return OptionalLong.empty();
        }
        entry.version = ++versionSeq;
        entry.nextRun = next;
        if (!running.contains(id)) {
            entry.state = idleState(entry);
        }
        return next == null ? OptionalLong.empty() : OptionalLong.of(entry.version);
    }

    /**
     * Releases the run flag and stores the outcome on the current entry, if any.
     */
    public synchronized void finishRun(@NotNull String id, @NotNull ExecutionStatus status, @Nullable String error) {
        running.remove(id);
        JobEntry entry = jobs.get(id);
        if (entry != null) {
            entry.lastStatus = status;
            entry.lastError = status == ExecutionStatus.ERROR ? error : null;
            entry.state = idleState(entry);
        }
    }

    /**
     * Releases the run flag of an execution that never started.
     */
    public synchronized void abortRun(@NotNull String id) {
        running.remove(id);
        JobEntry entry = jobs.get(id);
        if (entry != null) {
            entry.state = idleState(entry);
        }
    }

    @GuardedBy("this")
    private JobState idleState(JobEntry entry) {
        if (running.contains(entry.id)) return JobState.RUNNING;
        return entry.nextRun == null ? JobState.COMPLETED : JobState.SCHEDULED;
    }

    @GuardedBy("this")
    private JobEntry require(String id) throws NotFoundException {
        JobEntry entry = jobs.get(Objects.requireNonNull(id));
        if (entry == null) {
            throw new NotFoundException("Job not found: " + id);
        }
        return entry;
    }
}
