package io.github.byzatic.jobscheduler.engine;

import java.time.Clock;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

final class ScheduledEntry implements Delayed {
    final String jobId;
    final long version;
    final long triggerAtMillis;
    private final Clock clock;

    ScheduledEntry(String jobId, long version, long triggerAtMillis, Clock clock) {
        this.jobId = jobId;
        this.version = version;
        this.triggerAtMillis = triggerAtMillis;
        this.clock = clock;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        long diff = triggerAtMillis - clock.millis();
        return unit.convert(diff, TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        return Long.compare(this.triggerAtMillis, ((ScheduledEntry) o).triggerAtMillis);
    }

    @Override
    public String toString() {
        return "ScheduledEntry{jobId='" + jobId + "', version=" + version + ", triggerAtMillis=" + triggerAtMillis + '}';
    }
}
