package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowTest {

    private static final Instant NOW = Instant.parse("2024-03-15T08:30:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void testResolve_NoBoundsIsLastThirtyDays() {
        TimeWindow window = TimeWindow.resolve(null, null, clock, 30);

        assertEquals(NOW, window.getEnd());
        assertEquals(NOW.minus(Duration.ofDays(30)), window.getStart());
    }

    @Test
    void testResolve_OnlyEndGiven() {
        Instant end = Instant.parse("2024-01-31T00:00:00Z");

        TimeWindow window = TimeWindow.resolve(null, end, clock, 30);

        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), window.getStart());
        assertEquals(end, window.getEnd());
    }

    @Test
    void testResolve_OnlyStartGivenEndsNow() {
        Instant start = Instant.parse("2024-03-01T00:00:00Z");

        TimeWindow window = TimeWindow.resolve(start, null, clock, 30);

        assertEquals(start, window.getStart());
        assertEquals(NOW, window.getEnd());
    }

    @Test
    void testOf_StartAfterEndRejected() {
        assertThrows(InvalidInputException.class, () -> TimeWindow.of(NOW, NOW.minusMillis(1)));
    }

    @Test
    void testOf_MissingBoundRejected() {
        assertThrows(InvalidInputException.class, () -> TimeWindow.of(null, NOW));
        assertThrows(InvalidInputException.class, () -> TimeWindow.of(NOW, null));
    }

    @Test
    void testContains_BoundsAreInclusive() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-01T23:59:59Z");
        TimeWindow window = TimeWindow.of(start, end);

        assertTrue(window.contains(start));
        assertTrue(window.contains(end));
        assertFalse(window.contains(end.plusMillis(1)));
        assertFalse(window.contains(start.minusMillis(1)));
    }

    @Test
    void testPeriodKey_IsUtcStartDate() {
        TimeWindow window = TimeWindow.of(
                Instant.parse("2024-01-01T23:30:00Z"),
                Instant.parse("2024-01-02T05:00:00Z"));

        assertEquals("2024-01-01", window.periodKey());
    }

    @Test
    void testOf_SingleInstantWindowAllowed() {
        TimeWindow window = TimeWindow.of(NOW, NOW);

        assertTrue(window.contains(NOW));
    }
}
