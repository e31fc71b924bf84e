package io.rota4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronSupportTest {

    @Test
    void nextAfterShouldSupportFiveFieldCron() {
        Instant next = CronSupport.nextAfter("*/5 * * * *", ZoneOffset.UTC, Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), next);
    }

    @Test
    void nextAfterShouldBeStrictlyAfterBase() {
        Instant next = CronSupport.nextAfter("0 * * * *", ZoneOffset.UTC, Instant.parse("2026-01-01T10:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T11:00:00Z"), next);
    }

    @Test
    void nextAfterShouldKeepLocalTimeAcrossDst() {
        ZoneId newYork = ZoneId.of("America/New_York");

        Instant beforeShift = CronSupport.nextAfter("0 14 * * *", newYork, Instant.parse("2026-03-06T20:00:00Z"));
        Instant afterShift = CronSupport.nextAfter("0 14 * * *", newYork, beforeShift.plusSeconds(60));

        assertEquals(Instant.parse("2026-03-07T19:00:00Z"), beforeShift);
        assertEquals(Instant.parse("2026-03-08T18:00:00Z"), afterShift);
        assertEquals(14, ZonedDateTime.ofInstant(afterShift, newYork).getHour());
    }

    @Test
    void dayOfWeekShouldUseStandardCronNumbering() {
        Instant thursday = Instant.parse("2026-01-01T00:00:00Z");

        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), CronSupport.nextAfter("0 9 * * 1", ZoneOffset.UTC, thursday));
        assertEquals(Instant.parse("2026-01-04T09:00:00Z"), CronSupport.nextAfter("0 9 * * 0", ZoneOffset.UTC, thursday));
        assertEquals(Instant.parse("2026-01-04T09:00:00Z"), CronSupport.nextAfter("0 9 * * 7", ZoneOffset.UTC, thursday));
        assertEquals(Instant.parse("2026-01-05T09:00:00Z"),
                CronSupport.nextAfter("0 9 * * 1-5", ZoneOffset.UTC, Instant.parse("2026-01-03T00:00:00Z")));
    }

    @Test
    void normalizeCronShouldProduceQuartzSyntax() {
        assertEquals(List.of("0 0 0 1 * ?"), CronSupport.normalizeCron("0 0 1 * *"));
        assertEquals(List.of("0 30 9 ? * 2-6"), CronSupport.normalizeCron("30 9 * * 1-5"));
        assertEquals(List.of("15 * * * * ?"), CronSupport.normalizeCron("15 * * * * *"));
        assertEquals(List.of("0 0 9 1 * ?", "0 0 9 ? * 2"), CronSupport.normalizeCron("0 9 1 * 1"));
    }

    @Test
    void restrictedDayOfMonthAndDayOfWeekShouldBothFire() {
        // Saturday 2026-01-31: the 1st (a Sunday) comes before the next Monday
        assertEquals(Instant.parse("2026-02-01T09:00:00Z"),
                CronSupport.nextAfter("0 9 1 * 1", ZoneOffset.UTC, Instant.parse("2026-01-31T12:00:00Z")));
        // the following Monday fires as well
        assertEquals(Instant.parse("2026-02-02T09:00:00Z"),
                CronSupport.nextAfter("0 9 1 * 1", ZoneOffset.UTC, Instant.parse("2026-02-01T09:00:00Z")));
        // and then nothing until the next Monday, not every day
        assertEquals(Instant.parse("2026-02-09T09:00:00Z"),
                CronSupport.nextAfter("0 9 1 * 1", ZoneOffset.UTC, Instant.parse("2026-02-02T09:00:00Z")));
        assertTrue(CronSupport.isValid("0 9 1,15 * 1-5"));
    }

    @Test
    void invalidCronShouldBeRejected() {
        assertFalse(CronSupport.isValid("not a cron"));
        assertFalse(CronSupport.isValid("61 * * * *"));
        assertFalse(CronSupport.isValid(""));
        assertTrue(CronSupport.isValid("0 0 * * *"));

        assertThrows(IllegalArgumentException.class,
                () -> CronSupport.nextAfter("61 * * * *", ZoneOffset.UTC, Instant.now()));
    }
}
