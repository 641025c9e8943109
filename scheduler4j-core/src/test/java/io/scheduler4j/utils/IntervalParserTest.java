package io.scheduler4j.utils;

import io.scheduler4j.core.TaskValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IntervalParserTest {

    @Test
    void parseHumanDurationShouldWork() {
        assertEquals(Duration.ofMinutes(5), IntervalParser.parseDuration("5 minutes"));
        assertEquals(Duration.ofHours(27), IntervalParser.parseDuration("1 day 3 hours"));
    }

    @Test
    void parseCompactAndPlainSeconds() {
        assertEquals(Duration.ofSeconds(30), IntervalParser.parseDuration("30s"));
        assertEquals(Duration.ofDays(14), IntervalParser.parseDuration("2w"));
        assertEquals(Duration.ofSeconds(90), IntervalParser.parseDuration("90"));
    }

    @Test
    void parseIsoDuration() {
        assertEquals(Duration.ofMinutes(15), IntervalParser.parseDuration("PT15M"));
    }

    @Test
    void duplicateUnitIsRejected() {
        assertThrows(TaskValidationException.class, () -> IntervalParser.parseDuration("1 hour 2 hours"));
    }

    @Test
    void unknownUnitIsRejected() {
        assertThrows(TaskValidationException.class, () -> IntervalParser.parseDuration("3 fortnights"));
    }

    @Test
    void positiveIntervalRejectsZero() {
        assertThrows(TaskValidationException.class, () -> IntervalParser.parsePositive("0"));
        assertThrows(TaskValidationException.class, () -> IntervalParser.parsePositive("0 minutes"));
    }

    @Test
    void ofSecondsRequiresWholePositiveNumber() {
        assertEquals(Duration.ofSeconds(10), IntervalParser.ofSeconds(10));
        assertThrows(TaskValidationException.class, () -> IntervalParser.ofSeconds(-1));
        assertThrows(TaskValidationException.class, () -> IntervalParser.ofSeconds(1.5));
    }

    @Test
    void oversizedNumbersAreValidationErrors() {
        assertThrows(TaskValidationException.class, () -> IntervalParser.parseDuration("99999999999999999999s"));
        assertThrows(TaskValidationException.class, () -> IntervalParser.parseDuration("99999999999999999999"));
        assertThrows(TaskValidationException.class, () -> IntervalParser.parseDuration("99999999999999999999 hours"));
    }

    @Test
    void unitArithmeticOverflowIsRejected() {
        assertThrows(TaskValidationException.class, () -> IntervalParser.parseDuration("15250284452472 weeks"));
        assertThrows(TaskValidationException.class, () -> IntervalParser.parseDuration("2000000000000000000w"));
        assertThrows(TaskValidationException.class,
                () -> IntervalParser.parseDuration("9223372036854775807 seconds 1 minute"));
    }
}
