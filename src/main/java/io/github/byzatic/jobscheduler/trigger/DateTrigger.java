package io.github.byzatic.jobscheduler.trigger;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One-shot trigger.
 */
public final class DateTrigger implements Trigger {
    private final Instant runDate;

    DateTrigger(Instant runDate) {
        this.runDate = Objects.requireNonNull(runDate);
    }

    @Override
    public @NotNull Optional<Instant> nextFireAfter(@NotNull Instant reference) {
        return runDate.isAfter(reference) ? Optional.of(runDate) : Optional.empty();
    }

    @Override
    public boolean isRecurring() {
        return false;
    }

    public @NotNull Instant getRunDate() {
        return runDate;
    }

    @Override
    public String toString() {
        return "DateTrigger{runDate=" + runDate + '}';
    }
}
