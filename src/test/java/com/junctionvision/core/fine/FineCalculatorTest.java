package com.junctionvision.core.fine;

import com.junctionvision.core.profile.ProfileAggregate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FineCalculatorTest {

    private static final FineCalculator.Params P = FineCalculator.Params.DEFAULTS;
    private static final LocalDateTime NOON = LocalDateTime.of(2024, 5, 1, 12, 0);

    private static ProfileAggregate withViolations(int n) {
        return new ProfileAggregate("AB123", n, Instant.EPOCH, 3 * n, 1.5, List.of());
    }

    @Test
    void firstOffenceDaytimeIsBase() {
        assertEquals(100.00, FineCalculator.compute(null, null, NOON, P));
    }

    @Test
    void twoPriorViolationsDoublesFine() {
        // 1 + 2 * 0.5 = 2.0
        assertEquals(200.00, FineCalculator.compute(withViolations(2), ZoneFactors.NONE, NOON, P));
    }

    @Test
    void schoolZoneAndNightStack() {
        LocalDateTime night = LocalDateTime.of(2024, 5, 1, 23, 30);
        // 100 * 1.5 * 2.0 * 1.2
        assertEquals(360.00, FineCalculator.compute(withViolations(1), new ZoneFactors(true), night, P));
    }

    @Test
    void roundedToTwoDecimals() {
        FineCalculator.Params p = new FineCalculator.Params(33.333, 1.5, 2.0, 22, 6, 1.2);
        assertEquals(33.33, FineCalculator.compute(null, null, NOON, p));
    }

    @Test
    void nightWrapsMidnight() {
        assertTrue(FineCalculator.isNightHour(LocalTime.of(22, 0), 22, 6));
        assertTrue(FineCalculator.isNightHour(LocalTime.of(3, 15), 22, 6));
        assertFalse(FineCalculator.isNightHour(LocalTime.of(6, 0), 22, 6));
        assertFalse(FineCalculator.isNightHour(LocalTime.of(21, 59), 22, 6));
    }

    @Test
    void nonWrappingRangeIsDaytime() {
        // start ≤ end: [start, end) - день
        assertFalse(FineCalculator.isNightHour(LocalTime.of(12, 0), 6, 22));
        assertTrue(FineCalculator.isNightHour(LocalTime.of(23, 0), 6, 22));
        assertTrue(FineCalculator.isNightHour(LocalTime.of(5, 59), 6, 22));
    }

    @Test
    void invalidHoursRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FineCalculator.Params(100, 1.5, 2.0, 24, 6, 1.2));
    }

    @Test
    void roundsExactBinaryValue() {
        // 2.675 хранится как 2.67499999…
        FineCalculator.Params p = new FineCalculator.Params(2.675, 1.5, 2.0, 22, 6, 1.2);
        assertEquals(2.67, FineCalculator.compute(null, ZoneFactors.NONE, NOON, p));
    }

    @Test
    void negativeFactorsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FineCalculator.Params(100, -1.5, 2.0, 22, 6, 1.2));
        assertThrows(IllegalArgumentException.class, () -> new FineCalculator.Params(100, 1.5, -2.0, 22, 6, 1.2));
        assertThrows(IllegalArgumentException.class, () -> new FineCalculator.Params(100, 1.5, 2.0, 22, 6, -1.2));
    }
}
