package com.trailtag.core.geo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeoTest {

    @Test
    void oneDegreeOfLatitude() {
        assertEquals(111_195.08, Geo.haversine(0, 0, 1, 0), 0.01);
        assertEquals(0.0, Geo.haversine(47.1, 8.5, 47.1, 8.5), 1e-9);
    }

    @Test
    void bearingsOnCardinalDirections() {
        assertEquals(0.0, Geo.bearing(0, 0, 1, 0), 1e-9);
        assertEquals(90.0, Geo.bearing(0, 0, 0, 1), 1e-9);
        assertEquals(180.0, Geo.bearing(1, 0, 0, 0), 1e-9);
        assertEquals(270.0, Geo.bearing(0, 1, 0, 0), 1e-9);
    }

    @Test
    void normalizeAndDeltas() {
        assertEquals(350.0, Geo.normalize360(-10), 1e-9);
        assertEquals(0.0, Geo.normalize360(360), 1e-9);
        assertEquals(20.0, Geo.diffBearing(350, 10), 1e-9);
        assertEquals(20.0, Geo.signedDelta(350, 10), 1e-9);
        assertEquals(-20.0, Geo.signedDelta(10, 350), 1e-9);
        assertEquals(5.0, Geo.offsetBearing(355, 10), 1e-9);
    }
}
