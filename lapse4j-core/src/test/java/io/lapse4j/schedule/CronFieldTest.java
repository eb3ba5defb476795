package io.lapse4j.schedule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronFieldTest {

    @Test
    void stepExpressionShouldExpandFromLowerBound() {
        CronField minutes = CronField.parse("*/15", FieldRange.MINUTE);
        assertEquals(List.of(0, 15, 30, 45), minutes.values());
    }

    @Test
    void wrapAroundHoursShouldExpandInAscendingOrder() {
        CronField hours = CronField.parse("22-23,0-2", FieldRange.HOUR);
        assertEquals(List.of(0, 1, 2, 22, 23), hours.values());
        List<Integer> active = List.of(22, 23, 0, 1, 2);
        for (int h = 0; h <= 23; h++) {
            assertEquals(active.contains(h), hours.matches(h), "hour " + h);
        }
    }

    @Test
    void mixedListShouldDeduplicate() {
        CronField minutes = CronField.parse("0-2,5,*/20", FieldRange.MINUTE);
        assertEquals(List.of(0, 1, 2, 5, 20, 40), minutes.values());
    }

    @Test
    void steppedRangeShouldStartAtRangeStart() {
        CronField hours = CronField.parse("6-18/4", FieldRange.HOUR);
        assertEquals(List.of(6, 10, 14, 18), hours.values());
    }

    @Test
    void expandShouldStopAtMaxItems() {
        CronField seconds = CronField.parse("*", FieldRange.SECOND);
        assertEquals(List.of(0, 1, 2), seconds.expand(3));
    }

    @Test
    void parseShouldNormalizeRedundantForms() {
        assertEquals("*", CronField.parse("*/1", FieldRange.MINUTE).toString());
        assertEquals("7", CronField.parse("7-7", FieldRange.HOUR).toString());
        assertTrue(CronField.parse("*/1", FieldRange.MINUTE).isWildcard());
    }

    @Test
    void toStringShouldParseBackToEqualField() {
        CronField field = CronField.parse("22-23,0-2/2,5", FieldRange.HOUR);
        assertEquals(field, CronField.parse(field.toString(), FieldRange.HOUR));
    }

    @Test
    void invalidExpressionsShouldBeRejected() {
        assertThrows(InvalidExpressionException.class, () -> CronField.parse("60", FieldRange.MINUTE));
        assertThrows(InvalidExpressionException.class, () -> CronField.parse("*/0", FieldRange.MINUTE));
        assertThrows(InvalidExpressionException.class, () -> CronField.parse("23-2", FieldRange.HOUR));
        assertThrows(InvalidExpressionException.class, () -> CronField.parse("5/2", FieldRange.HOUR));
        assertThrows(InvalidExpressionException.class, () -> CronField.parse("1,,2", FieldRange.HOUR));
        assertThrows(InvalidExpressionException.class, () -> CronField.parse("a", FieldRange.HOUR));
        assertThrows(InvalidExpressionException.class, () -> CronField.parse(" ", FieldRange.HOUR));
    }

    @Test
    void errorMessageShouldNameFieldAndInput() {
        InvalidExpressionException ex = assertThrows(InvalidExpressionException.class,
                () -> CronField.parse("25", FieldRange.HOUR));
        assertEquals("hour", ex.field());
        assertEquals("25", ex.expression());
        assertTrue(ex.getMessage().contains("out of range 0-23"));
    }
}
