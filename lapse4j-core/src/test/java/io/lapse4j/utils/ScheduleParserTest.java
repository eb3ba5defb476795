package io.lapse4j.utils;

import io.lapse4j.schedule.CronSchedule;
import io.lapse4j.schedule.IntervalSchedule;
import io.lapse4j.schedule.IntervalUnit;
import io.lapse4j.schedule.InvalidExpressionException;
import io.lapse4j.schedule.ScheduleExpression;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleParserTest {

    private static final ZoneId TAIPEI = ZoneId.of("Asia/Taipei");

    @Test
    void parseCronShouldReadThreeFields() {
        ScheduleExpression expr = ScheduleParser.parse("0 */15 22-23,0-2");
        assertEquals(CronSchedule.of("0", "*/15", "22-23,0-2"), expr);
    }

    @Test
    void parseIntervalShouldReadAmountUnitAndAnchor() {
        ScheduleExpression expr = ScheduleParser.parse("every 15 minutes from 2026-01-01T00:00:00Z");
        assertEquals(new IntervalSchedule(15, IntervalUnit.MINUTES, Instant.parse("2026-01-01T00:00:00Z")), expr);
    }

    @Test
    void formatShouldRoundTrip() {
        String[] texts = {
                "0 */15 22-23,0-2",
                "*/30 * *",
                "0 0 6-18/3",
                "every 15 minutes from 2026-01-01T00:00:00Z",
                "every 1 hour from 2026-03-01T06:30:00Z",
        };
        for (String text : texts) {
            assertEquals(text, ScheduleParser.format(ScheduleParser.parse(text)));
        }
    }

    @Test
    void parseAnchorShouldApplyZoneToLocalTimes() {
        Instant expected = Instant.parse("2026-01-01T00:00:00Z");
        assertEquals(expected, ScheduleParser.parseAnchor("2026-01-01T08:00:00", TAIPEI));
        assertEquals(expected, ScheduleParser.parseAnchor("2026-01-01T08:00:00+08:00", ZoneId.of("UTC")));
        assertEquals(expected, ScheduleParser.parseAnchor("2026-01-01T00:00:00Z", TAIPEI));
    }

    @Test
    void invalidTextShouldBeRejected() {
        assertFalse(ScheduleParser.isValid("0 0"));
        assertFalse(ScheduleParser.isValid("every 0 minutes from 2026-01-01T00:00:00Z"));
        assertFalse(ScheduleParser.isValid("every 5 fortnights from 2026-01-01T00:00:00Z"));
        assertFalse(ScheduleParser.isValid("every 5 minutes"));
        assertTrue(ScheduleParser.isValid("0 0 8"));
        assertThrows(InvalidExpressionException.class, () -> ScheduleParser.parseAnchor("yesterday", TAIPEI));
    }

    @Test
    void toQuartzCronShouldRunEveryDay() {
        assertEquals("0 */15 22-23,0-2 * * ?", ScheduleParser.toQuartzCron(CronSchedule.of("0", "*/15", "22-23,0-2")));
    }

    @Test
    void nextCronFireTimeShouldUseZone() {
        ZonedDateTime eightInTaipei = Instant.parse("2026-01-01T00:00:00Z").atZone(TAIPEI);

        Optional<ZonedDateTime> next = ScheduleParser.nextCronFireTime(CronSchedule.of("0", "0", "8"), eightInTaipei);

        assertEquals(Optional.of(Instant.parse("2026-01-02T00:00:00Z").atZone(TAIPEI)), next);
    }

    @Test
    void intervalWhosePeriodOverflowsShouldBeRejected() {
        InvalidExpressionException ex = assertThrows(InvalidExpressionException.class,
                () -> ScheduleParser.parse("every 1000000000000000 hours from 2026-01-01T00:00:00Z"));
        assertTrue(ex.getMessage().contains("out of range"));
        assertThrows(InvalidExpressionException.class,
                () -> new IntervalSchedule(Long.MAX_VALUE, IntervalUnit.HOURS, Instant.parse("2026-01-01T00:00:00Z")));
    }

    @Test
    void localAnchorShouldBeReadInGivenZone() {
        ScheduleExpression expr = ScheduleParser.parse("every 5 minutes from 2026-01-01T06:00:00", TAIPEI);
        assertEquals(new IntervalSchedule(5, IntervalUnit.MINUTES, Instant.parse("2025-12-31T22:00:00Z")), expr);
    }
}
