package com.luxgrid.core.raster;

import java.nio.file.Path;

/**
 * A decoded picture: one brightness sample per pixel, row-major with row 0 at the top.
 */
public final class Raster {

    private final String id;
    private final Path source;
    private final int width;
    private final int height;
    private final float[] samples;

    public Raster(String id, Path source, int width, int height, float[] samples) {
        if (samples.length != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height) + " samples, got " + samples.length);
        }
        this.id = id;
        this.source = source;
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    /** Raster id for a picture file: the file name without extension. */
    public static String idOf(Path artifact) {
        String name = artifact.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public String id() { return id; }
    public Path source() { return source; }
    public int width() { return width; }
    public int height() { return height; }

    public float value(int x, int y) {
        return samples[y * width + x];
    }
}
