package io.lapse4j.schedule;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleBuilderTest {

    @Test
    void hourWindowShouldCoverAllShapes() {
        assertEquals("*", ScheduleBuilder.hourWindow(0, 0).toString());
        assertEquals("6", ScheduleBuilder.hourWindow(6, 6).toString());
        assertEquals("6-18", ScheduleBuilder.hourWindow(6, 18).toString());
        assertEquals("22-23,0-2", ScheduleBuilder.hourWindow(22, 2).toString());
        assertEquals("1-23,0", ScheduleBuilder.hourWindow(1, 0).toString());
    }

    @Test
    void toCronShouldBuildMinuteSchedules() {
        CronSchedule cron = ScheduleBuilder.toCron(new ScheduleBuilder.Fields(22, 2, 15, IntervalUnit.MINUTES));
        assertEquals("0 */15 22-23,0-2", cron.toText());
    }

    @Test
    void toCronShouldBuildSecondSchedules() {
        CronSchedule cron = ScheduleBuilder.toCron(new ScheduleBuilder.Fields(0, 0, 30, IntervalUnit.SECONDS));
        assertEquals("*/30 * *", cron.toText());
    }

    @Test
    void toCronShouldStepHours() {
        assertEquals("0 0 */2",
                ScheduleBuilder.toCron(new ScheduleBuilder.Fields(0, 0, 2, IntervalUnit.HOURS)).toText());
        assertEquals("0 0 6-18/3",
                ScheduleBuilder.toCron(new ScheduleBuilder.Fields(6, 18, 3, IntervalUnit.HOURS)).toText());
    }

    @Test
    void toCronShouldFallBackToTopOfUnitForLargeAmounts() {
        assertEquals("0 0 *",
                ScheduleBuilder.toCron(new ScheduleBuilder.Fields(0, 0, 90, IntervalUnit.MINUTES)).toText());
    }

    @Test
    void readShouldInvertToCron() {
        ScheduleBuilder.Fields[] all = {
                new ScheduleBuilder.Fields(22, 2, 15, IntervalUnit.MINUTES),
                new ScheduleBuilder.Fields(6, 18, 15, IntervalUnit.MINUTES),
                new ScheduleBuilder.Fields(0, 0, 1, IntervalUnit.MINUTES),
                new ScheduleBuilder.Fields(0, 0, 30, IntervalUnit.SECONDS),
                new ScheduleBuilder.Fields(0, 0, 2, IntervalUnit.HOURS),
                new ScheduleBuilder.Fields(6, 18, 3, IntervalUnit.HOURS),
        };
        for (ScheduleBuilder.Fields fields : all) {
            ScheduleBuilder.Reading reading = ScheduleBuilder.read(ScheduleBuilder.toCron(fields));
            assertFalse(reading.isAdvanced(), fields.toString());
            assertEquals(fields, reading.fields());
        }
    }

    @Test
    void readShouldKeepUnrepresentableExpressionsAsAdvanced() {
        String[] advanced = {"0 0 6,18", "0 5,35 *", "0 */15 6-18/2", "15 0 *"};
        for (String text : advanced) {
            String[] parts = text.split(" ");
            ScheduleBuilder.Reading reading = ScheduleBuilder.read(CronSchedule.of(parts[0], parts[1], parts[2]));
            assertTrue(reading.isAdvanced(), text);
            assertEquals(text, reading.advancedText());
        }
    }

    @Test
    void summaryShouldDescribeWindow() {
        assertEquals("Every 15 minutes, 10 PM - 2 AM",
                ScheduleBuilder.summary(new ScheduleBuilder.Fields(22, 2, 15, IntervalUnit.MINUTES)));
        assertEquals("Every 1 hour, all day",
                ScheduleBuilder.summary(new ScheduleBuilder.Fields(0, 0, 1, IntervalUnit.HOURS)));
        assertEquals("Every 30 seconds, at 12 PM only",
                ScheduleBuilder.summary(new ScheduleBuilder.Fields(12, 12, 30, IntervalUnit.SECONDS)));
    }

    @Test
    void fieldsShouldRejectInvalidValues() {
        assertThrows(InvalidExpressionException.class, () -> new ScheduleBuilder.Fields(24, 0, 1, IntervalUnit.HOURS));
        assertThrows(InvalidExpressionException.class, () -> new ScheduleBuilder.Fields(0, 0, 0, IntervalUnit.MINUTES));
    }

    @Test
    void editorAmountIsRoundedAndClamped() {
        assertEquals(15, ScheduleBuilder.Fields.of(0, 0, 14.6, IntervalUnit.MINUTES).amount());
        assertEquals(1, ScheduleBuilder.Fields.of(0, 0, 0, IntervalUnit.MINUTES).amount());
        assertEquals(1, ScheduleBuilder.Fields.of(0, 0, -3, IntervalUnit.HOURS).amount());
    }
}
