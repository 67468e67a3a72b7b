package com.luxgrid.core.aggregate;

import com.luxgrid.core.model.Region;
import com.luxgrid.core.raster.Raster;

import java.util.BitSet;
import java.util.List;

/**
 * The set of raster pixels inside a region polygon.
 *
 * <p>Pixel {@code (x, y)} is tested at its integer coordinate with an even-odd
 * ray cast. Points lying on an edge or a vertex count as inside. Only the
 * polygon's bounding box, clipped to the raster, is scanned; a polygon fully
 * outside the raster yields an empty mask.
 */
public final class PolygonMask {

    private static final double EPSILON = 1e-9;

    private final int minX;
    private final int minY;
    private final int boxWidth;
    private final int boxHeight;
    private final BitSet bits;
    private final int pixelCount;

    private PolygonMask(int minX, int minY, int boxWidth, int boxHeight, BitSet bits) {
        this.minX = minX;
        this.minY = minY;
        this.boxWidth = boxWidth;
        this.boxHeight = boxHeight;
        this.bits = bits;
        this.pixelCount = bits.cardinality();
    }

    public static PolygonMask build(List<Region.Vertex> polygon, int width, int height) {
        double lowX = Double.MAX_VALUE, lowY = Double.MAX_VALUE;
        double highX = -Double.MAX_VALUE, highY = -Double.MAX_VALUE;
        for (var v : polygon) {
            lowX = Math.min(lowX, v.x());
            lowY = Math.min(lowY, v.y());
            highX = Math.max(highX, v.x());
            highY = Math.max(highY, v.y());
        }
        int x0 = (int) Math.max(0, Math.ceil(lowX));
        int y0 = (int) Math.max(0, Math.ceil(lowY));
        int x1 = (int) Math.min(width - 1, Math.floor(highX));
        int y1 = (int) Math.min(height - 1, Math.floor(highY));
        if (polygon.size() < 3 || x0 > x1 || y0 > y1) {
            return new PolygonMask(0, 0, 0, 0, new BitSet());
        }

        int w = x1 - x0 + 1;
        int h = y1 - y0 + 1;
        var bits = new BitSet(w * h);
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                if (contains(polygon, x, y)) {
                    bits.set((y - y0) * w + (x - x0));
                }
            }
        }
        return new PolygonMask(x0, y0, w, h, bits);
    }

    /**
     * Even-odd containment with boundary points treated as inside.
     */
    public static boolean contains(List<Region.Vertex> polygon, double px, double py) {
        boolean inside = false;
        int n = polygon.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            var a = polygon.get(i);
            var b = polygon.get(j);
            if (onSegment(a, b, px, py)) {
                return true;
            }
            if ((a.y() > py) != (b.y() > py)) {
                double crossX = a.x() + (py - a.y()) * (b.x() - a.x()) / (b.y() - a.y());
                if (px < crossX) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }

    private static boolean onSegment(Region.Vertex a, Region.Vertex b, double px, double py) {
        double cross = (b.x() - a.x()) * (py - a.y()) - (b.y() - a.y()) * (px - a.x());
        if (Math.abs(cross) > EPSILON) {
            return false;
        }
        return px >= Math.min(a.x(), b.x()) - EPSILON && px <= Math.max(a.x(), b.x()) + EPSILON
                && py >= Math.min(a.y(), b.y()) - EPSILON && py <= Math.max(a.y(), b.y()) + EPSILON;
    }

    public int pixelCount() {
        return pixelCount;
    }

    public boolean covers(int x, int y) {
        int bx = x - minX;
        int by = y - minY;
        if (bx < 0 || by < 0 || bx >= boxWidth || by >= boxHeight) {
            return false;
        }
        return bits.get(by * boxWidth + bx);
    }

    /**
     * Visits masked pixels row by row, left to right.
     */
    public void forEachPixel(PixelVisitor visitor) {
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            visitor.visit(minX + i % boxWidth, minY + i / boxWidth);
        }
    }

    /**
     * Counts masked pixels whose value is strictly greater than {@code threshold}.
     */
    public int countAbove(Raster raster, double threshold) {
        int passing = 0;
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            int x = minX + i % boxWidth;
            int y = minY + i / boxWidth;
            if (raster.value(x, y) > threshold) {
                passing++;
            }
        }
        return passing;
    }

    @FunctionalInterface
    public interface PixelVisitor {
        void visit(int x, int y);
    }
}
