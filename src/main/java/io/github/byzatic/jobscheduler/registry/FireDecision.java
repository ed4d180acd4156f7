package io.github.byzatic.jobscheduler.registry;

import io.github.byzatic.jobscheduler.model.JobType;
import io.github.byzatic.jobscheduler.trigger.Trigger;
import org.jetbrains.annotations.NotNull;

/**
 * Outcome of a fire event, decided atomically by {@link JobRegistry#beginFiring}.
 */
public final class FireDecision {

    public enum Kind {
        /**
         * The job was removed or rescheduled since the event was queued. Nothing to do.
         */
        STALE,
        /**
         * The job is paused. The event is dropped and the trigger advanced; the job state is left as it is.
         */
        SKIP_INACTIVE,
        /**
         * A previous execution of the job is still running. The event is dropped and the trigger advanced.
         */
        SKIP_OVERLAP,
        /**
         * The run flag was claimed; the caller must execute and then call {@link JobRegistry#finishRun}.
         */
        RUN
    }

    public final Kind kind;
    public final String jobId;
    public final JobType jobType;
    public final Trigger trigger;
    public final long version;

    private FireDecision(Kind kind, String jobId, JobType jobType, Trigger trigger, long version) {
        this.kind = kind;
        this.jobId = jobId;
        this.jobType = jobType;
        this.trigger = trigger;
        this.version = version;
    }

    static FireDecision stale(@NotNull String jobId) {
        return new FireDecision(Kind.STALE, jobId, null, null, -1);
    }

    static FireDecision of(@NotNull Kind kind, @NotNull JobEntry entry) {
        return new FireDecision(kind, entry.id, entry.jobType, entry.trigger, entry.version);
    }

    @Override
    public String toString() {
        return "FireDecision{kind=" + kind + ", jobId='" + jobId + "', version=" + version + '}';
    }
}
