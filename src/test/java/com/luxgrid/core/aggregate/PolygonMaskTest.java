package com.luxgrid.core.aggregate;

import com.luxgrid.core.model.Region;
import com.luxgrid.core.raster.Raster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolygonMaskTest {

    private static List<Region.Vertex> polygon(double... xy) {
        var vertices = new Region.Vertex[xy.length / 2];
        for (int i = 0; i < vertices.length; i++) {
            vertices[i] = new Region.Vertex(xy[2 * i], xy[2 * i + 1]);
        }
        return List.of(vertices);
    }

    private static Raster uniform(int width, int height, float value) {
        float[] samples = new float[width * height];
        Arrays.fill(samples, value);
        return new Raster("r", Path.of("r.hdr"), width, height, samples);
    }

    // -- Containment ----------------------------------------------------------

    @Nested
    @DisplayName("containment")
    class Containment {

        @Test
        @DisplayName("square on integer corners covers its four boundary pixels")
        void unitSquare() {
            var mask = PolygonMask.build(polygon(1, 1, 2, 1, 2, 2, 1, 2), 4, 4);

            assertEquals(4, mask.pixelCount());
            assertTrue(mask.covers(1, 1));
            assertTrue(mask.covers(2, 2));
            assertFalse(mask.covers(0, 0));
            assertFalse(mask.covers(3, 2));
        }

        @Test
        @DisplayName("points on an edge or vertex count as inside")
        void boundaryInclusive() {
            var triangle = polygon(0, 0, 4, 0, 0, 4);

            assertTrue(PolygonMask.contains(triangle, 0, 0));
            assertTrue(PolygonMask.contains(triangle, 2, 0));
            assertTrue(PolygonMask.contains(triangle, 2, 2));
            assertTrue(PolygonMask.contains(triangle, 1, 1));
            assertFalse(PolygonMask.contains(triangle, 3, 3));
        }

        @Test
        @DisplayName("concave polygons use the even-odd rule")
        void concave() {
            // U shape open at the top
            var u = polygon(0, 0, 6, 0, 6, 6, 4, 6, 4, 2, 2, 2, 2, 6, 0, 6);

            assertTrue(PolygonMask.contains(u, 1, 4));
            assertTrue(PolygonMask.contains(u, 5, 4));
            assertFalse(PolygonMask.contains(u, 3, 4));
        }

        @Test
        @DisplayName("bounding box is clipped to the raster")
        void clipped() {
            var mask = PolygonMask.build(polygon(-5, -5, 1, -5, 1, 1, -5, 1), 4, 4);
            assertEquals(4, mask.pixelCount());
        }

        @Test
        @DisplayName("polygon fully outside the raster yields an empty mask")
        void outside() {
            var mask = PolygonMask.build(polygon(10, 10, 12, 10, 11, 12), 4, 4);

            assertEquals(0, mask.pixelCount());
            assertEquals(0, mask.countAbove(uniform(4, 4, 1f), 0.0));
        }
    }

    // -- Counting -------------------------------------------------------------

    @Test
    @DisplayName("all-lit raster passes every masked pixel")
    void allLit() {
        var mask = PolygonMask.build(polygon(1, 1, 2, 1, 2, 2, 1, 2), 4, 4);
        assertEquals(4, mask.countAbove(uniform(4, 4, 1f), 0.5));
    }

    @Test
    @DisplayName("threshold comparison is strict")
    void strictThreshold() {
        var mask = PolygonMask.build(polygon(0, 0, 3, 0, 3, 3, 0, 3), 4, 4);

        assertEquals(16, mask.pixelCount());
        assertEquals(0, mask.countAbove(uniform(4, 4, 0.5f), 0.5));
        assertEquals(0, mask.countAbove(uniform(4, 4, 0f), 0.0));
    }

    @Test
    @DisplayName("counts only masked pixels above the threshold")
    void partial() {
        float[] samples = new float[16];
        samples[1 * 4 + 1] = 2f;
        samples[0] = 2f;
        var raster = new Raster("r", Path.of("r.hdr"), 4, 4, samples);
        var mask = PolygonMask.build(polygon(1, 1, 2, 1, 2, 2, 1, 2), 4, 4);

        assertEquals(1, mask.countAbove(raster, 1.0));
    }
}
