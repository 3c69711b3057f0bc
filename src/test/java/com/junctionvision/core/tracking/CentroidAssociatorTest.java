package com.junctionvision.core.tracking;

import com.junctionvision.core.detection.BoundingBox;
import com.junctionvision.core.detection.TrackedBox;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CentroidAssociatorTest {

    private static BoundingBox box(int cx, int bottom) {
        return new BoundingBox(cx - 20, bottom - 30, cx + 20, bottom);
    }

    @Test
    void nearbyBoxKeepsId() {
        CentroidAssociator a = new CentroidAssociator(50, 3);
        int id = a.assign(List.of(box(100, 200))).get(0).trackId();
        assertEquals(id, a.assign(List.of(box(110, 215))).get(0).trackId());
    }

    @Test
    void farBoxGetsNewId() {
        CentroidAssociator a = new CentroidAssociator(50, 3);
        int id = a.assign(List.of(box(100, 200))).get(0).trackId();
        int other = a.assign(List.of(box(400, 200))).get(0).trackId();
        assertNotEquals(id, other);
    }

    @Test
    void greedyPrefersClosestPair() {
        CentroidAssociator a = new CentroidAssociator(100, 3);
        List<TrackedBox> first = a.assign(List.of(box(100, 200), box(160, 200)));
        // обе рамки сдвинулись вправо на 20: ближайшие пары (100→120) и (160→180)
        List<TrackedBox> second = a.assign(List.of(box(180, 200), box(120, 200)));
        assertEquals(first.get(1).trackId(), second.get(0).trackId());
        assertEquals(first.get(0).trackId(), second.get(1).trackId());
    }

    @Test
    void trackSurvivesMissedFramesThenExpires() {
        CentroidAssociator a = new CentroidAssociator(50, 2);
        int id = a.assign(List.of(box(100, 200))).get(0).trackId();
        a.assign(List.of());
        a.assign(List.of());
        assertEquals(id, a.assign(List.of(box(100, 200))).get(0).trackId());

        a.assign(List.of());
        a.assign(List.of());
        a.assign(List.of());
        assertEquals(0, a.activeCount());
        assertTrue(a.assign(List.of(box(100, 200))).get(0).trackId() > id);
    }

    @Test
    void idsAreNeverReused() {
        CentroidAssociator a = new CentroidAssociator(10, 0);
        int prev = 0;
        for (int i = 0; i < 5; i++) {
            int id = a.assign(List.of(box(100 + i * 100, 200))).get(0).trackId();
            assertTrue(id > prev);
            prev = id;
        }
    }
}
