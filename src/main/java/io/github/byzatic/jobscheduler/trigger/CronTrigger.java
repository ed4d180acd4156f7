package io.github.byzatic.jobscheduler.trigger;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

public final class CronTrigger implements Trigger {
    private final CronExpr expr;
    private final ZoneId zone;

    CronTrigger(CronExpr expr, ZoneId zone) {
        this.expr = Objects.requireNonNull(expr);
        this.zone = Objects.requireNonNull(zone);
    }

    @Override
    public @NotNull Optional<Instant> nextFireAfter(@NotNull Instant reference) {
        return expr.next(reference, zone);
    }

    @Override
    public boolean isRecurring() {
        return true;
    }

    public @NotNull ZoneId getZone() {
        return zone;
    }

    @Override
    public String toString() {
        return "CronTrigger{expression='" + expr + "', zone=" + zone + '}';
    }
}
