package io.github.byzatic.jobscheduler.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledEntryTest {

    @Test
    void compareOrdersByTriggerTime() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        long now = clock.millis();
        ScheduledEntry early = new ScheduledEntry("a", 1, now + 1000, clock);
        ScheduledEntry late = new ScheduledEntry("b", 2, now + 2000, clock);
        assertTrue(early.compareTo(late) < 0);
        assertTrue(late.compareTo(early) > 0);
    }

    @Test
    void delayFollowsTheClock() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        ScheduledEntry e = new ScheduledEntry("a", 1, clock.millis() + 200, clock);
        assertEquals(200, e.getDelay(TimeUnit.MILLISECONDS));
        clock.advance(Duration.ofMillis(120));
        assertEquals(80, e.getDelay(TimeUnit.MILLISECONDS));
        clock.advance(Duration.ofMillis(100));
        assertTrue(e.getDelay(TimeUnit.MILLISECONDS) < 0);
    }

    @Test
    void queueReleasesOnlyDueEntries() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
        queue.offer(new ScheduledEntry("late", 1, clock.millis() + 2000, clock));
        queue.offer(new ScheduledEntry("early", 2, clock.millis() + 1000, clock));
        assertNull(queue.poll());

        clock.advance(Duration.ofSeconds(1));
        assertEquals("early", queue.poll().jobId);
        assertNull(queue.poll());
    }
}
