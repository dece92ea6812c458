package me.christianrobert.bsontranspiler.transformer.evaluator;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsDatesTest {

    private static long millis(String instant) {
        return Instant.parse(instant).toEpochMilli();
    }

    @Test
    void parseIsoVariants() {
        assertEquals(millis("2019-01-15T00:00:00Z"), JsDates.parse("2019-01-15"));
        assertEquals(millis("2019-01-01T00:00:00Z"), JsDates.parse("2019"));
        assertEquals(millis("2019-01-15T10:20:30.123Z"), JsDates.parse("2019-01-15T10:20:30.123Z"));
        assertEquals(millis("2019-01-15T08:00:00Z"), JsDates.parse("2019-01-15T10:00:00+0200"));
        assertEquals(millis("2019-01-16T00:00:00Z"), JsDates.parse("2019-01-15T24:00"));
    }

    @Test
    void parseRfc1123() {
        assertEquals(millis("2008-06-03T11:05:30Z"), JsDates.parse("Tue, 3 Jun 2008 11:05:30 GMT"));
    }

    @Test
    void parseRejectsGarbage() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> JsDates.parse("yesterday"));
        assertEquals(JsDates.INVALID_DATE, e.getMessage());
        assertThrows(EvaluationException.class, () -> JsDates.parse("2019-13-01"));
    }

    @Test
    void componentsAreZeroBasedMonths() {
        assertEquals(millis("2019-02-28T10:20:30.400Z"), JsDates.fromComponents(List.of(2019.0, 1.0, 28.0, 10.0, 20.0, 30.0, 400.0)));
    }

    @Test
    void componentsOverflow() {
        assertEquals(millis("2019-03-01T00:00:00Z"), JsDates.fromComponents(List.of(2019.0, 1.0, 29.0)));
        assertEquals(millis("2018-12-01T00:00:00Z"), JsDates.fromComponents(List.of(2019.0, -1.0)));
    }

    @Test
    void twoDigitYears() {
        assertEquals(millis("1950-01-01T00:00:00Z"), JsDates.fromComponents(List.of(50.0, 0.0)));
    }

    @Test
    void componentsRejectNaN() {
        assertThrows(EvaluationException.class, () -> JsDates.fromComponents(List.of(2019.0, Double.NaN)));
    }

    @Test
    void componentsRejectYearsOutsideTheDateRange() {
        assertThrows(EvaluationException.class, () -> JsDates.fromComponents(List.of(4294969315.0, 0.0, 1.0)));
        assertThrows(EvaluationException.class, () -> JsDates.fromComponents(List.of(-275761.0, 0.0)));
        assertDoesNotThrow(() -> JsDates.fromComponents(List.of(275760.0, 0.0)));
    }

    @Test
    void epochMillisRange() {
        assertEquals(0L, JsDates.fromEpochMillis(0));
        assertEquals(-1000L, JsDates.fromEpochMillis(-1000.7));
        assertThrows(EvaluationException.class, () -> JsDates.fromEpochMillis(8.64e15 + 1));
        assertThrows(EvaluationException.class, () -> JsDates.fromEpochMillis(Double.NaN));
    }
}
