package com.wangbin.meshinfo.common.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeoUtilTest {

    @Test
    void distanceAlongEquator() {
        assertEquals(111.195, GeoUtil.distance(0, 0, 0, 1), 0.001);
        assertEquals(0.0, GeoUtil.distance(39.7, -104.9, 39.7, -104.9), 0.0);
    }

    @Test
    void bearingCardinalDirections() {
        assertEquals(0.0, GeoUtil.bearing(0, 0, 1, 0), 1e-9);
        assertEquals(90.0, GeoUtil.bearing(0, 0, 0, 1), 1e-9);
        assertEquals(180.0, GeoUtil.bearing(1, 0, 0, 0), 1e-9);
        assertEquals(270.0, GeoUtil.bearing(0, 1, 0, 0), 1e-9);
    }

    @Test
    void bearingIsAlwaysInRange() {
        double[][] points = {{39.7, -104.9}, {40.0, -105.3}, {-33.9, 151.2}, {51.5, -0.1}, {0, 179.9}, {0, -179.9}};
        for (double[] from : points) {
            for (double[] to : points) {
                double bearing = GeoUtil.bearing(from[0], from[1], to[0], to[1]);
                assertTrue(bearing >= 0 && bearing < 360, "bearing " + bearing);
            }
        }
    }

    @Test
    void normalizeBearingWrapsIntoRange() {
        assertEquals(270.0, GeoUtil.normalizeBearing(-90.0), 1e-9);
        assertEquals(0.0, GeoUtil.normalizeBearing(360.0), 1e-9);
        assertEquals(0.5, GeoUtil.normalizeBearing(720.5), 1e-9);
        assertEquals(Double.doubleToLongBits(0.0), Double.doubleToLongBits(GeoUtil.normalizeBearing(-0.0)));
    }
}
