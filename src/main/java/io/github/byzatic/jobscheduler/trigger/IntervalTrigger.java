package io.github.byzatic.jobscheduler.trigger;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires at {@code anchor + k * period} for k &gt;= 1. Fire times never drift, however late they are evaluated.
 */
public final class IntervalTrigger implements Trigger {
    private final Instant anchor;
    private final Duration period;

    IntervalTrigger(Instant anchor, Duration period) {
        this.anchor = Objects.requireNonNull(anchor);
        this.period = Objects.requireNonNull(period);
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + period);
        }
    }

    @Override
    public @NotNull Optional<Instant> nextFireAfter(@NotNull Instant reference) {
        if (reference.isBefore(anchor)) {
            return Optional.of(anchor.plus(period));
        }
        long elapsed = Duration.between(anchor, reference).toMillis();
        long periods = elapsed / period.toMillis() + 1;
        return Optional.of(anchor.plus(period.multipliedBy(periods)));
    }

    @Override
    public boolean isRecurring() {
        return true;
    }

    public @NotNull Instant getAnchor() {
        return anchor;
    }

    public @NotNull Duration getPeriod() {
        return period;
    }

    @Override
    public String toString() {
        return "IntervalTrigger{anchor=" + anchor + ", period=" + period + '}';
    }
}
