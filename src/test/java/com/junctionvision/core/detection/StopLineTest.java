package com.junctionvision.core.detection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StopLineTest {

    @Test void parsesWithSpaces() {
        assertEquals(new StopLine(10, 400, 900, 420), StopLine.parse(" 10, 400 ,900,420 "));
    }

    @Test void threeCoordinatesRejected() {
        assertThrows(IllegalArgumentException.class, () -> StopLine.parse("1,2,3"));
    }

    @Test void nonNumberRejected() {
        assertThrows(IllegalArgumentException.class, () -> StopLine.parse("1,2,x,4"));
    }

    @Test void blankRejected() {
        assertThrows(IllegalArgumentException.class, () -> StopLine.parse(" "));
    }

    @Test void bottomCenterCentroid() {
        assertEquals(new Centroid(15, 40), new BoundingBox(10, 20, 21, 40).centroid());
    }
}
