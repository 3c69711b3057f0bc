package com.junctionvision.core.signal;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameTimelineTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void timestampFromIndexAndFps() {
        FrameTimeline t = new FrameTimeline(START, 25.0, List.of(), false);
        assertEquals(START, t.timestampAt(0));
        assertEquals(START.plusMillis(40), t.timestampAt(1));
        assertEquals(START.plusSeconds(4), t.timestampAt(100));
    }

    @Test
    void intervalBoundsInclusive() {
        RedInterval iv = new RedInterval(START.plusSeconds(1), START.plusSeconds(2));
        FrameTimeline t = new FrameTimeline(START, 10.0, List.of(iv), false);
        assertFalse(t.isRedAt(9));
        assertTrue(t.isRedAt(10));
        assertTrue(t.isRedAt(20));
        assertFalse(t.isRedAt(21));
    }

    @Test
    void forceRedOverridesIntervals() {
        FrameTimeline t = new FrameTimeline(START, 30.0, List.of(), true);
        assertTrue(t.isRedAt(12345));
    }

    @Test
    void nonPositiveFpsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FrameTimeline(START, 0, List.of(), false));
    }

    @Test
    void invertedIntervalRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RedInterval(START.plusSeconds(1), START));
    }
}
