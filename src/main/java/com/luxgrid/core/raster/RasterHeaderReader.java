package com.luxgrid.core.raster;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the text header of a Radiance picture: the magic line, variable lines
 * ({@code FORMAT=}, {@code EXPOSURE=}, {@code VIEW=}), a blank line and the
 * resolution string. Only the standard {@code -Y height +X width} orientation
 * is accepted.
 */
public final class RasterHeaderReader {

    private static final int MAX_HEADER_BYTES = 64 * 1024;

    /** Largest picture a single float array can hold. */
    static final long MAX_PIXELS = Integer.MAX_VALUE - 8;

    /** Default decode limit: 2^28 pixels, 1 GiB of float samples. */
    public static final long DEFAULT_MAX_PIXELS = 1L << 28;

    private RasterHeaderReader() {}

    public static RasterHeader read(Path artifact) {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(artifact))) {
            return read(artifact, in);
        } catch (IOException e) {
            throw new ArtifactParseException(artifact, "cannot read header", e);
        }
    }

    /**
     * Reads the header from {@code in}, leaving the stream positioned at the first scanline.
     */
    static RasterHeader read(Path artifact, InputStream in) throws IOException {
        long[] consumed = {0};
        String magic = readLine(artifact, in, consumed);
        if (magic == null || !(magic.startsWith("#?RADIANCE") || magic.startsWith("#?RGBE"))) {
            throw new ArtifactParseException(artifact, "not a Radiance picture");
        }

        String format = RasterHeader.RGBE_FORMAT;
        double exposure = 1.0;
        String viewOptions = null;
        String line;
        while ((line = readLine(artifact, in, consumed)) != null && !line.isEmpty()) {
            if (line.startsWith("FORMAT=")) {
                format = line.substring("FORMAT=".length()).trim();
            } else if (line.startsWith("EXPOSURE=")) {
                exposure *= parseDouble(artifact, line.substring("EXPOSURE=".length()).trim(), "EXPOSURE");
            } else if (line.startsWith("VIEW=")) {
                viewOptions = viewOptions == null
                        ? line.substring("VIEW=".length())
                        : viewOptions + " " + line.substring("VIEW=".length());
            }
        }
        if (line == null) {
            throw new ArtifactParseException(artifact, "header ends before resolution line");
        }

        String resolution = readLine(artifact, in, consumed);
        if (resolution == null) {
            throw new ArtifactParseException(artifact, "missing resolution line");
        }
        String[] parts = resolution.trim().split("\\s+");
        if (parts.length != 4 || !parts[0].equals("-Y") || !parts[2].equals("+X")) {
            throw new ArtifactParseException(artifact, "unsupported resolution line: " + resolution);
        }
        int height = parseInt(artifact, parts[1]);
        int width = parseInt(artifact, parts[3]);
        if (width <= 0 || height <= 0) {
            throw new ArtifactParseException(artifact, "non-positive resolution: " + resolution);
        }
        if ((long) width * height > MAX_PIXELS) {
            throw new ArtifactParseException(artifact, "resolution too large: " + resolution);
        }

        ViewFraming view = null;
        if (viewOptions != null) {
            try {
                view = ViewFraming.parse(viewOptions);
            } catch (IllegalArgumentException e) {
                throw new ArtifactParseException(artifact, "bad VIEW line: " + e.getMessage(), e);
            }
        }
        return new RasterHeader(artifact, format, exposure, view, width, height, consumed[0]);
    }

    /**
     * @throws ArtifactParseException if the picture has more than {@code maxPixels} pixels
     */
    public static void requireWithin(RasterHeader header, long maxPixels) {
        long pixels = (long) header.width() * header.height();
        if (pixels > maxPixels) {
            throw new ArtifactParseException(header.artifact(),
                    pixels + " pixels exceeds the decode limit of " + maxPixels);
        }
    }

    private static String readLine(Path artifact, InputStream in, long[] consumed) throws IOException {
        var buf = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (++consumed[0] > MAX_HEADER_BYTES) {
                throw new ArtifactParseException(artifact, "header exceeds " + MAX_HEADER_BYTES + " bytes");
            }
            if (b == '\n') {
                return buf.toString(StandardCharsets.ISO_8859_1);
            }
            buf.write(b);
        }
        return buf.size() == 0 ? null : buf.toString(StandardCharsets.ISO_8859_1);
    }

    private static int parseInt(Path artifact, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ArtifactParseException(artifact, "bad integer: " + value, e);
        }
    }

    private static double parseDouble(Path artifact, String value, String field) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ArtifactParseException(artifact, "bad " + field + " value: " + value, e);
        }
    }
}
