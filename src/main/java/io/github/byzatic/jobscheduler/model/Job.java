package io.github.byzatic.jobscheduler.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Job definition as supplied by a caller or a job store.
 * <p>
 * Job type and frequency type are kept as their external tags; the engine resolves and
 * validates them on registration.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String description;
    private final String jobType;
    private final String frequencyType;
    private final Map<String, Object> frequencyConfig;
    private final boolean active;
    private final Instant lastRun;

    private Job(Builder builder) {
        id = builder.id;
        name = builder.name;
        description = builder.description;
        jobType = builder.jobType;
        frequencyType = builder.frequencyType;
        frequencyConfig = Collections.unmodifiableMap(new LinkedHashMap<>(builder.frequencyConfig));
        active = builder.active;
        lastRun = builder.lastRun;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(Job copy) {
        Builder builder = new Builder();
        builder.id = copy.id;
        builder.name = copy.name;
        builder.description = copy.description;
        builder.jobType = copy.jobType;
        builder.frequencyType = copy.frequencyType;
        builder.frequencyConfig = new LinkedHashMap<>(copy.frequencyConfig);
        builder.active = copy.active;
        builder.lastRun = copy.lastRun;
        return builder;
    }

    /**
     * @return the job id, or {@code null} when the engine should generate one
     */
    public @Nullable String getId() {
        return id;
    }

    public @Nullable String getName() {
        return name;
    }

    public @Nullable String getDescription() {
        return description;
    }

    public @Nullable String getJobType() {
        return jobType;
    }

    public @Nullable String getFrequencyType() {
        return frequencyType;
    }

    public @NotNull Map<String, Object> getFrequencyConfig() {
        return frequencyConfig;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Last run time known to the store. Interval triggers restored at startup are anchored on it.
     */
    public @Nullable Instant getLastRun() {
        return lastRun;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return active == job.active
                && Objects.equals(id, job.id)
                && Objects.equals(name, job.name)
                && Objects.equals(description, job.description)
                && Objects.equals(jobType, job.jobType)
                && Objects.equals(frequencyType, job.frequencyType)
                && Objects.equals(frequencyConfig, job.frequencyConfig)
                && Objects.equals(lastRun, job.lastRun);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, jobType, frequencyType, frequencyConfig, active, lastRun);
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", jobType='" + jobType + '\'' +
                ", frequencyType='" + frequencyType + '\'' +
                ", frequencyConfig=" + frequencyConfig +
                ", active=" + active +
                ", lastRun=" + lastRun +
                '}';
    }

    /**
     * {@code Job} builder static inner class.
     */
    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private String jobType;
        private String frequencyType;
        private Map<String, Object> frequencyConfig = new LinkedHashMap<>();
        private boolean active = true;
        private Instant lastRun;

        private Builder() {
        }

        public Builder setId(String id) {
            this.id = id;
            return this;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        /**
         * Sets the job type tag, e.g. {@code "data_backup"}.
         *
         * @param jobType the tag to set
         * @return a reference to this Builder
         */
        public Builder setJobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder setJobType(@NotNull JobType jobType) {
            this.jobType = jobType.tag();
            return this;
        }

        /**
         * Sets the frequency type tag: {@code cron}, {@code interval} or {@code date}.
         *
         * @param frequencyType the tag to set
         * @return a reference to this Builder
         */
        public Builder setFrequencyType(String frequencyType) {
            this.frequencyType = frequencyType;
            return this;
        }

        public Builder setFrequencyType(@NotNull FrequencyType frequencyType) {
            this.frequencyType = frequencyType.tag();
            return this;
        }

        public Builder setFrequencyConfig(@NotNull Map<String, ?> frequencyConfig) {
            this.frequencyConfig = new LinkedHashMap<>(frequencyConfig);
            return this;
        }

        public Builder putFrequencyConfig(@NotNull String key, Object value) {
            this.frequencyConfig.put(key, value);
            return this;
        }

        public Builder setActive(boolean active) {
            this.active = active;
            return this;
        }

        public Builder setLastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
