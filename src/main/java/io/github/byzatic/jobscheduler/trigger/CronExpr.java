package io.github.byzatic.jobscheduler.trigger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.BitSet;
import java.util.Locale;
import java.util.Optional;

// ======== Cron expression with optional seconds field (6 fields) ========
final class CronExpr {
    // 6 fields: sec min hour dom mon dow
    // 5 fields:     min hour dom mon dow  (sec=0)
    private static final String[] MONTH_NAMES = {"JAN", "FEB", "MAR", "APR", "MAY", "JUN",
            "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"};
    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    private final String source;
    private final BitSet seconds = new BitSet(60);
    private final BitSet minutes = new BitSet(60);
    private final BitSet hours = new BitSet(24);
    private final BitSet dom = new BitSet(32);  // 1..31
    private final BitSet months = new BitSet(13); // 1..12
    private final BitSet dow = new BitSet(8);  // 0..7 (0 and 7 = Sunday)

    private CronExpr(String source) {
        this.source = source;
    }

    static CronExpr parse(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String[] p = s.trim().split("\\s+");
        if (p.length != 5 && p.length != 6)
            throw new IllegalArgumentException("Cron must have 5 or 6 fields (with seconds): " + s);

        CronExpr ce = new CronExpr(s.trim());
        int idx = 0;
        try {
            if (p.length == 6) {
                ce.parseField(p[idx++], 0, 59, ce.seconds, null);
            } else {
                ce.seconds.set(0);
            }
            ce.parseField(p[idx++], 0, 59, ce.minutes, null);
            ce.parseField(p[idx++], 0, 23, ce.hours, null);
            ce.parseField(p[idx++], 1, 31, ce.dom, null);
            ce.parseField(p[idx++], 1, 12, ce.months, MONTH_NAMES);
            ce.parseField(p[idx], 0, 7, ce.dow, DAY_NAMES);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in cron expression '" + s + "': " + e.getMessage(), e);
        }
        if (ce.dow.get(7)) {
            ce.dow.set(0);
            ce.dow.clear(7);
        }

        if (ce.seconds.isEmpty() || ce.minutes.isEmpty() || ce.hours.isEmpty()
                || ce.dom.isEmpty() || ce.months.isEmpty() || ce.dow.isEmpty()) {
            throw new IllegalArgumentException("Cron field parsed to empty set: " + s);
        }
        return ce;
    }

    private void parseField(String f, int min, int max, BitSet out, String[] names) {
        if (f.equals("*") || f.equals("?")) {
            out.set(min, max + 1);
            return;
        }
        for (String part : f.split(",")) {
            String stepPart = part;
            int step = 1;
            if (part.contains("/")) {
                String[] ar = part.split("/");
                if (ar.length != 2) {
                    throw new IllegalArgumentException("Invalid step: " + part);
                }
                stepPart = ar[0];
                step = Integer.parseInt(ar[1]);
                if (step <= 0) {
                    throw new IllegalArgumentException("Step must be positive: " + part);
                }
            }
            int start, end;
            if (stepPart.equals("*") || stepPart.equals("?")) {
                start = min;
                end = max;
            } else if (stepPart.contains("-")) {
                String[] r = stepPart.split("-");
                if (r.length != 2) {
                    throw new IllegalArgumentException("Invalid range: " + part);
                }
                start = value(r[0], names);
                end = value(r[1], names);
            } else {
                start = value(stepPart, names);
                // "a/n" runs from a to the end of the field
                end = part.contains("/") ? max : start;
            }
            if (start < min || end > max || start > end) {
                throw new IllegalArgumentException("Out of range: " + part);
            }
            for (int v = start; v <= end; v += step) out.set(v);
        }
    }

    private static int value(String token, String[] names) {
        if (names != null) {
            String upper = token.toUpperCase(Locale.ROOT);
            for (int i = 0; i < names.length; i++) {
                if (names[i].equals(upper)) {
                    // months are 1-based, days of week 0-based
                    return names.length == 12 ? i + 1 : i;
                }
            }
        }
        return Integer.parseInt(token);
    }

    /**
     * First matching instant strictly after {@code from}, or empty if the expression never matches.
     */
    Optional<Instant> next(Instant from, ZoneId zone) {
        ZonedDateTime z = ZonedDateTime.ofInstant(from, zone)
                .plusSeconds(1)
                .withNano(0);

        // The Gregorian calendar repeats every 400 years: no match in that window means no match at all
        ZonedDateTime limit = z.plusYears(400);

        // Walk forward, skipping whole units that cannot match
        for (int i = 0; i < 366 * 24 * 60 * 60 * 2 && !z.isAfter(limit); i++) {
            if (!months.get(z.getMonthValue())) {
                z = z.plusMonths(1).withDayOfMonth(1).withHour(0).withMinute(0).withSecond(0);
                continue;
            }
            if (!dom.get(z.getDayOfMonth())) {
                z = z.plusDays(1).withHour(0).withMinute(0).withSecond(0);
                continue;
            }
            if (!dow.get(z.getDayOfWeek().getValue() % 7)) {
                z = z.plusDays(1).withHour(0).withMinute(0).withSecond(0);
                continue;
            }
            if (!hours.get(z.getHour())) {
                z = z.plusHours(1).withMinute(0).withSecond(0);
                continue;
            }
            if (!minutes.get(z.getMinute())) {
                z = z.plusMinutes(1).withSecond(0);
                continue;
            }
            if (!seconds.get(z.getSecond())) {
                z = z.plusSeconds(1);
                continue;
            }
            return Optional.of(z.toInstant());
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return source;
    }
}
