package io.github.byzatic.jobscheduler.engine;

import io.github.byzatic.jobscheduler.base_exceptions.NotFoundException;
import io.github.byzatic.jobscheduler.base_exceptions.ValidationException;
import io.github.byzatic.jobscheduler.model.Job;
import io.github.byzatic.jobscheduler.model.JobInfo;
import io.github.byzatic.jobscheduler.store.JobStore;

import java.util.List;
import java.util.Optional;

public interface SchedulerEngineInterface extends AutoCloseable {
    void addListener(JobEventListener l);

    void removeListener(JobEventListener l);

    String add(Job job) throws ValidationException;

    void update(Job job) throws ValidationException, NotFoundException;

    void pause(String jobId) throws NotFoundException;

    void resume(String jobId) throws NotFoundException;

    void remove(String jobId) throws NotFoundException;

    boolean restore(Job job);

    RestoreReport restoreAll(JobStore store);

    Optional<JobInfo> query(String jobId);

    List<JobInfo> listJobs();

    SchedulerStatistics statistics();

    void start();

    void shutdown(boolean waitForRunning);

    @Override
    void close();
}
