package io.github.byzatic.jobscheduler.trigger;

import io.github.byzatic.jobscheduler.base_exceptions.ValidationException;
import io.github.byzatic.jobscheduler.model.FrequencyType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a frequency type and its configuration map into a {@link Trigger}.
 * <p>
 * Configuration keys:
 * <ul>
 *   <li>{@code cron}: {@code cron_expression} (required), {@code timezone} (IANA name, default UTC)</li>
 *   <li>{@code interval}: at least one of {@code seconds}, {@code minutes}, {@code hours}, {@code days}; summed</li>
 *   <li>{@code date}: {@code run_date} (ISO-8601)</li>
 * </ul>
 * Every failure is reported as a {@link ValidationException}.
 */
public final class TriggerFactory {
    public static final String CRON_EXPRESSION = "cron_expression";
    public static final String TIMEZONE = "timezone";
    public static final String SECONDS = "seconds";
    public static final String MINUTES = "minutes";
    public static final String HOURS = "hours";
    public static final String DAYS = "days";
    public static final String RUN_DATE = "run_date";

    private static final List<String> INTERVAL_KEYS = List.of(SECONDS, MINUTES, HOURS, DAYS);
    private static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private TriggerFactory() {
    }

    /**
     * @param now current time; also the anchor of interval triggers
     */
    public static @NotNull Trigger resolve(@Nullable String frequencyType, @Nullable Map<String, ?> config,
                                           @NotNull Instant now) throws ValidationException {
        return resolve(FrequencyType.fromTag(frequencyType), config, now, now);
    }

    public static @NotNull Trigger resolve(@NotNull FrequencyType frequencyType, @Nullable Map<String, ?> config,
                                           @NotNull Instant now) throws ValidationException {
        return resolve(frequencyType, config, now, now);
    }

    /**
     * @param anchor start point of interval triggers: the registration time, or the last run on restore
     * @param now    current time, from which a cron expression must still have a fire time
     */
    public static @NotNull Trigger resolve(@NotNull FrequencyType frequencyType, @Nullable Map<String, ?> config,
                                           @NotNull Instant anchor, @NotNull Instant now) throws ValidationException {
        Objects.requireNonNull(frequencyType, "frequencyType");
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(now, "now");
        if (config == null) {
            throw new ValidationException("frequency_config is required for " + frequencyType + " frequency");
        }
        switch (frequencyType) {
            case CRON:
                return cron(config, now);
            case INTERVAL:
                return interval(config, anchor);
            case DATE:
                return date(config);
            default:
                throw new ValidationException("Unsupported frequency type: " + frequencyType);
        }
    }

    private static Trigger cron(Map<String, ?> config, Instant now) throws ValidationException {
        Object expression = config.get(CRON_EXPRESSION);
        if (!(expression instanceof String) || ((String) expression).isBlank()) {
            throw new ValidationException("cron_expression is required for cron frequency");
        }
        ZoneId zone = DEFAULT_ZONE;
        Object timezone = config.get(TIMEZONE);
        if (timezone != null) {
            try {
                zone = ZoneId.of(String.valueOf(timezone));
            } catch (DateTimeException e) {
                throw new ValidationException("Unknown timezone: " + timezone, e);
            }
        }
        CronExpr expr;
        try {
            expr = CronExpr.parse((String) expression);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron_expression '" + expression + "': " + e.getMessage(), e);
        }
        if (expr.next(now, zone).isEmpty()) {
            throw new ValidationException("Cron has no future fire time: " + expression);
        }
        return new CronTrigger(expr, zone);
    }

    private static Trigger interval(Map<String, ?> config, Instant anchor) throws ValidationException {
        for (String key : config.keySet()) {
            if (!INTERVAL_KEYS.contains(key)) {
                throw new ValidationException("Unsupported interval key: " + key);
            }
        }
        if (INTERVAL_KEYS.stream().noneMatch(config::containsKey)) {
            throw new ValidationException("At least one interval (seconds, minutes, hours, days) must be specified");
        }
        Duration period;
        try {
            period = Duration.ofSeconds(component(config, SECONDS))
                    .plusMinutes(component(config, MINUTES))
                    .plusHours(component(config, HOURS))
                    .plusDays(component(config, DAYS));
        } catch (ArithmeticException e) {
            throw new ValidationException("Interval is too large: " + config, e);
        }
        if (period.isZero()) {
            throw new ValidationException("Interval must be positive: " + config);
        }
        // fire times are computed in milliseconds from the anchor
        try {
            period.toMillis();
            anchor.plus(period);
        } catch (ArithmeticException | DateTimeException e) {
            throw new ValidationException("Interval is too large: " + config, e);
        }
        return new IntervalTrigger(anchor, period);
    }

    private static long component(Map<String, ?> config, String key) throws ValidationException {
        Object raw = config.get(key);
        if (raw == null) return 0;
        long value;
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            value = ((Number) raw).longValue();
        } else if (raw instanceof BigInteger) {
            try {
                value = ((BigInteger) raw).longValueExact();
            } catch (ArithmeticException e) {
                throw new ValidationException("Interval " + key + " is too large: " + raw, e);
            }
        } else if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new ValidationException("Interval " + key + " must be an integer: " + raw);
            }
            value = (long) d;
        } else if (raw instanceof String) {
            try {
                value = Long.parseLong(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Interval " + key + " must be an integer: " + raw, e);
            }
        } else {
            throw new ValidationException("Interval " + key + " must be an integer: " + raw);
        }
        if (value < 0) {
            throw new ValidationException("Interval " + key + " must not be negative: " + raw);
        }
        return value;
    }

    private static Trigger date(Map<String, ?> config) throws ValidationException {
        Object raw = config.get(RUN_DATE);
        if (raw == null) {
            throw new ValidationException("run_date is required for date frequency");
        }
        return new DateTrigger(toInstant(raw));
    }

    static @NotNull Instant toInstant(@NotNull Object raw) throws ValidationException {
        if (raw instanceof Instant) return (Instant) raw;
        if (raw instanceof OffsetDateTime) return ((OffsetDateTime) raw).toInstant();
        if (raw instanceof ZonedDateTime) return ((ZonedDateTime) raw).toInstant();
        if (raw instanceof LocalDateTime) return ((LocalDateTime) raw).toInstant(ZoneOffset.UTC);
        if (raw instanceof Date) return ((Date) raw).toInstant();
        if (!(raw instanceof String)) {
            throw new ValidationException("run_date must be an ISO-8601 timestamp: " + raw);
        }
        String text = ((String) raw).trim();
        // "2025-01-01 10:00:00" is accepted as well as the ISO 'T' separator
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ValidationException("run_date is not a valid ISO-8601 timestamp: " + raw, e);
        }
    }
}
