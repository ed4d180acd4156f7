package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.IdProvider;
import io.github.byzatic.jobscheduler.base_exceptions.NotFoundException;
import io.github.byzatic.jobscheduler.model.Job;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Job store backed by a map. Jobs are listed in id order.
 */
public class InMemoryJobStore implements JobStore {
    private final Map<String, Job> jobs = new ConcurrentSkipListMap<>();

    /**
     * Saves or replaces a job. A job without an id gets a generated one.
     *
     * @return the stored job
     */
    public @NotNull Job save(@NotNull Job job) {
        Job stored = job.getId() == null || job.getId().isBlank()
                ? Job.newBuilder(job).setId(IdProvider.generateJobId()).build()
                : job;
        jobs.put(stored.getId(), stored);
        return stored;
    }

    public @NotNull Optional<Job> find(@NotNull String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public boolean delete(@NotNull String id) {
        return jobs.remove(id) != null;
    }

    public void setActive(@NotNull String id, boolean active) throws NotFoundException {
        Job updated = jobs.computeIfPresent(id, (key, job) -> Job.newBuilder(job).setActive(active).build());
        if (updated == null) {
            throw new NotFoundException("Job not found: " + id);
        }
    }

    public @NotNull List<Job> listAll() {
        return new ArrayList<>(jobs.values());
    }

    @Override
    public @NotNull List<Job> listActiveJobs() {
        List<Job> out = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.isActive()) out.add(job);
        }
        return out;
    }
}
