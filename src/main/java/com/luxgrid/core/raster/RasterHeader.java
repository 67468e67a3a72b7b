package com.luxgrid.core.raster;

import java.nio.file.Path;

/**
 * Parsed Radiance picture header.
 *
 * @param view       framing from the last {@code VIEW=} line, or {@code null} if absent
 * @param dataOffset byte offset of the first scanline
 */
public record RasterHeader(Path artifact, String format, double exposure, ViewFraming view,
                           int width, int height, long dataOffset) {

    public static final String RGBE_FORMAT = "32-bit_rle_rgbe";
}
