package io.github.byzatic.jobscheduler.trigger;

import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CronExprTest {
    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void parsesFiveFields_defaultsSecondsToZero_andFindsNextMinute() {
        CronExpr expr = CronExpr.parse("* * * * *");
        Instant now = Instant.parse("2025-08-08T11:23:20Z");
        Optional<Instant> next = expr.next(now, UTC);
        assertTrue(next.isPresent());
        assertEquals(Instant.parse("2025-08-08T11:24:00Z"), next.get());
    }

    @Test
    void parsesSixFields_secondsStepEvery10s() {
        CronExpr expr = CronExpr.parse("*/10 * * * * *");
        Instant now = Instant.parse("2025-08-08T11:23:25Z");
        assertEquals(Instant.parse("2025-08-08T11:23:30Z"), expr.next(now, UTC).get());
    }

    @Test
    void nextIsStrictlyAfterReference() {
        CronExpr expr = CronExpr.parse("0 * * * *");
        Instant onTheHour = Instant.parse("2025-08-08T11:00:00Z");
        assertEquals(Instant.parse("2025-08-08T12:00:00Z"), expr.next(onTheHour, UTC).get());
    }

    @Test
    void respectsMonthDayHourMinuteSecondFilters() {
        CronExpr expr = CronExpr.parse("0 0 12 12 8 *");
        Instant now = Instant.parse("2025-08-08T00:00:00Z");
        assertEquals(Instant.parse("2025-08-12T12:00:00Z"), expr.next(now, UTC).get());
    }

    @Test
    void dayOfMonthAndDayOfWeekMustBothMatch() {
        // 12 August that falls on a Friday
        CronExpr expr = CronExpr.parse("0 0 12 12 8 5");
        Instant t = expr.next(Instant.parse("2025-08-08T00:00:00Z"), UTC).get();
        ZonedDateTime z = ZonedDateTime.ofInstant(t, UTC);
        assertEquals(12, z.getDayOfMonth());
        assertEquals(8, z.getMonthValue());
        assertEquals(DayOfWeek.FRIDAY, z.getDayOfWeek());
    }

    @Test
    void respectsDayOfWeekFilter() {
        CronExpr expr = CronExpr.parse("0 30 9 * * 5"); // every Friday at 09:30:00
        Instant now = Instant.parse("2025-08-08T00:00:00Z"); // a Friday
        assertEquals(Instant.parse("2025-08-08T09:30:00Z"), expr.next(now, UTC).get());
    }

    @Test
    void acceptsMonthAndDayNames() {
        CronExpr byName = CronExpr.parse("30 9 * AUG fri");
        CronExpr byNumber = CronExpr.parse("30 9 * 8 5");
        Instant now = Instant.parse("2025-08-08T10:00:00Z");
        assertEquals(byNumber.next(now, UTC), byName.next(now, UTC));
    }

    @Test
    void sevenIsSunday() {
        CronExpr expr = CronExpr.parse("0 0 * * 7");
        Instant next = expr.next(Instant.parse("2025-08-08T00:00:00Z"), UTC).get();
        assertEquals(DayOfWeek.SUNDAY, ZonedDateTime.ofInstant(next, UTC).getDayOfWeek());
    }

    @Test
    void singleValueWithStepRunsToEndOfField() {
        CronExpr expr = CronExpr.parse("5/20 * * * *");
        Instant now = Instant.parse("2025-08-08T11:06:00Z");
        assertEquals(Instant.parse("2025-08-08T11:25:00Z"), expr.next(now, UTC).get());
    }

    @Test
    void honoursZone() {
        CronExpr expr = CronExpr.parse("0 9 * * *");
        Instant next = expr.next(Instant.parse("2025-01-15T00:00:00Z"), ZoneId.of("Europe/Berlin")).get();
        assertEquals(Instant.parse("2025-01-15T08:00:00Z"), next);
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("* * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("61 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("*/0 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("a * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse("5-1 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronExpr.parse(" "));
    }

    @Test
    void impossibleDateHasNoNextFireTime() {
        CronExpr expr = CronExpr.parse("0 0 30 2 *");
        assertTrue(expr.next(Instant.parse("2025-01-01T00:00:00Z"), UTC).isEmpty());
    }
}
