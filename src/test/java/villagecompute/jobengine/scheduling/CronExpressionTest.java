package villagecompute.jobengine.scheduling;

import org.junit.jupiter.api.Test;
import villagecompute.jobengine.exceptions.ScheduleMisconfiguredException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CronExpression}: the macros, {@code ?}, case folding, strictness and error mapping layered on
 * the cron-utils Unix definition.
 */
class CronExpressionTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    private static Instant next(String expression, String after) {
        return CronExpression.parse(expression).nextAfter(Instant.parse(after), UTC);
    }

    @Test
    void testNextAfter_dailyAtTwoJustAfterSlot() {
        assertEquals(Instant.parse("2024-01-02T02:00:00Z"), next("0 2 * * *", "2024-01-01T02:00:01Z"));
    }

    @Test
    void testNextAfter_isStrictlyAfterReference() {
        assertEquals(Instant.parse("2024-01-02T02:00:00Z"), next("0 2 * * *", "2024-01-01T02:00:00Z"));
        assertEquals(Instant.parse("2024-01-01T02:00:00Z"), next("0 2 * * *", "2024-01-01T01:59:59Z"));
    }

    @Test
    void testNextAfter_lowercaseNamesAndQuestionMark() {
        // 2024-01-01 is a Monday
        assertEquals(Instant.parse("2024-01-02T06:00:00Z"), next("0 6 ? * tue-thu", "2024-01-01T07:00:00Z"));
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), next("0 0 1 mar ?", "2024-01-01T00:00:00Z"));
    }

    @Test
    void testMacros() {
        assertEquals(Instant.parse("2024-01-01T11:00:00Z"), next("@hourly", "2024-01-01T10:30:00Z"));
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), next("@daily", "2024-01-01T10:30:00Z"));
        assertEquals(Instant.parse("2024-02-01T00:00:00Z"), next("@monthly", "2024-01-01T10:30:00Z"));
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), next("@yearly", "2024-01-01T10:30:00Z"));
        assertEquals(Instant.parse("2024-01-07T00:00:00Z"), next("@WEEKLY", "2024-01-01T10:30:00Z"));
    }

    @Test
    void testNextAfter_timezoneShiftsTheSlot() {
        CronExpression daily = CronExpression.parse("0 9 * * *");
        Instant next = daily.nextAfter(Instant.parse("2024-01-10T00:00:00Z"), ZoneId.of("Europe/Amsterdam"));
        assertEquals(Instant.parse("2024-01-10T08:00:00Z"), next);
    }

    @Test
    void testNextAfter_fallBackSecondHourKeepsRepeatedSlots() {
        ZoneId newYork = ZoneId.of("America/New_York");
        CronExpression everyHalfHour = CronExpression.parse("*/30 * * * *");

        // 06:10Z is 01:10 EST, inside the repeated hour; 01:30 EST (06:30Z) is still ahead
        assertEquals(Instant.parse("2024-11-03T06:30:00Z"),
                everyHalfHour.nextAfter(Instant.parse("2024-11-03T06:10:00Z"), newYork));
        assertEquals(Instant.parse("2024-11-03T07:00:00Z"),
                everyHalfHour.nextAfter(Instant.parse("2024-11-03T06:30:00Z"), newYork));
    }

    @Test
    void testParse_invalidExpressions() {
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parse(null));
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parse("  "));
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parse("0 2 * *"));
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parse("0 2 * * * *"));
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parse("60 * * * *"));
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parse("* 24 * * *"));
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parse("* * * 13 *"));
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parse("abc * * * *"));
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parse("@fortnightly"));
    }

    @Test
    void testParseZone() {
        assertEquals(ZoneId.of("UTC"), CronExpression.parseZone(null));
        assertEquals(ZoneId.of("Europe/Amsterdam"), CronExpression.parseZone(" Europe/Amsterdam "));
        assertThrows(ScheduleMisconfiguredException.class, () -> CronExpression.parseZone("Mars/Olympus_Mons"));
    }
}
