package com.luxgrid.core.raster;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * In-process RGBE decoder for Radiance pictures.
 *
 * <p>Handles new-style run-length encoded scanlines and flat scanlines. Old-style
 * repeat-count runs are rejected. Each pixel is reduced to photopic brightness
 * {@code 0.265 r + 0.670 g + 0.065 b}, the same value {@code pvalue -b} reports.
 */
public class RadianceHdrDecoder implements RasterDecoder {

    private static final int MIN_RLE_WIDTH = 8;
    private static final int MAX_RLE_WIDTH = 0x7fff;
    private static final int MAX_RUN = 127;

    private final long maxPixels;

    public RadianceHdrDecoder() {
        this(RasterHeaderReader.DEFAULT_MAX_PIXELS);
    }

    /**
     * @param maxPixels pictures with more pixels are rejected before any sample buffer is allocated
     */
    public RadianceHdrDecoder(long maxPixels) {
        this.maxPixels = maxPixels;
    }

    @Override
    public Raster decode(Path artifact) {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(artifact), 1 << 16)) {
            RasterHeader header = RasterHeaderReader.read(artifact, in);
            if (!RasterHeader.RGBE_FORMAT.equals(header.format())) {
                throw new ArtifactParseException(artifact, "unsupported FORMAT " + header.format());
            }
            RasterHeaderReader.requireWithin(header, maxPixels);
            int width = header.width();
            int height = header.height();
            long available = Files.size(artifact) - header.dataOffset();
            if (available < minimumDataBytes(width, height)) {
                throw new ArtifactParseException(artifact, "truncated picture data: " + available
                        + " bytes cannot hold " + width + "x" + height + " pixels");
            }
            float[] samples = new float[width * height];
            byte[] scanline = new byte[width * 4];
            for (int y = 0; y < height; y++) {
                readScanline(artifact, in, scanline, width);
                int row = y * width;
                for (int x = 0; x < width; x++) {
                    samples[row + x] = brightness(scanline, x * 4);
                }
            }
            return new Raster(Raster.idOf(artifact), artifact, width, height, samples);
        } catch (EOFException e) {
            throw new ArtifactParseException(artifact, "truncated picture data", e);
        } catch (IOException e) {
            throw new ArtifactParseException(artifact, "cannot read picture", e);
        }
    }

    /**
     * Fewest bytes that can encode the picture: one two-byte run per 127 pixels
     * and channel for run-length encoded widths, four bytes per pixel otherwise.
     */
    static long minimumDataBytes(int width, int height) {
        long perScanline = width >= MIN_RLE_WIDTH && width <= MAX_RLE_WIDTH
                ? 4 + 4L * 2 * ((width + MAX_RUN - 1) / MAX_RUN)
                : 4L * width;
        return perScanline * height;
    }

    static float brightness(byte[] rgbe, int offset) {
        int e = rgbe[offset + 3] & 0xff;
        if (e == 0) {
            return 0f;
        }
        double f = Math.scalb(1.0, e - (128 + 8));
        double r = ((rgbe[offset] & 0xff) + 0.5) * f;
        double g = ((rgbe[offset + 1] & 0xff) + 0.5) * f;
        double b = ((rgbe[offset + 2] & 0xff) + 0.5) * f;
        return (float) (0.265 * r + 0.670 * g + 0.065 * b);
    }

    /**
     * Fills {@code out} with {@code width} RGBE quadruplets, interleaved.
     */
    private static void readScanline(Path artifact, InputStream in, byte[] out, int width) throws IOException {
        int b0 = readByte(in);
        int b1 = readByte(in);
        int b2 = readByte(in);
        int b3 = readByte(in);

        boolean newRle = width >= MIN_RLE_WIDTH && width <= MAX_RLE_WIDTH
                && b0 == 2 && b1 == 2 && (b2 & 0x80) == 0;
        if (!newRle) {
            readFlat(artifact, in, out, width, b0, b1, b2, b3);
            return;
        }
        if (((b2 << 8) | b3) != width) {
            throw new ArtifactParseException(artifact, "scanline length mismatch");
        }

        for (int channel = 0; channel < 4; channel++) {
            int x = 0;
            while (x < width) {
                int count = readByte(in);
                if (count > 128) {
                    count -= 128;
                    if (x + count > width) {
                        throw new ArtifactParseException(artifact, "run overflows scanline");
                    }
                    byte value = (byte) readByte(in);
                    for (int i = 0; i < count; i++) {
                        out[(x++) * 4 + channel] = value;
                    }
                } else {
                    if (count == 0 || x + count > width) {
                        throw new ArtifactParseException(artifact, "bad literal run length " + count);
                    }
                    for (int i = 0; i < count; i++) {
                        out[(x++) * 4 + channel] = (byte) readByte(in);
                    }
                }
            }
        }
    }

    private static void readFlat(Path artifact, InputStream in, byte[] out, int width,
                                 int b0, int b1, int b2, int b3) throws IOException {
        setPixel(artifact, out, 0, b0, b1, b2, b3);
        for (int x = 1; x < width; x++) {
            setPixel(artifact, out, x, readByte(in), readByte(in), readByte(in), readByte(in));
        }
    }

    private static void setPixel(Path artifact, byte[] out, int x, int r, int g, int b, int e) {
        if (r == 1 && g == 1 && b == 1) {
            throw new ArtifactParseException(artifact, "old-style run-length encoding is not supported");
        }
        int i = x * 4;
        out[i] = (byte) r;
        out[i + 1] = (byte) g;
        out[i + 2] = (byte) b;
        out[i + 3] = (byte) e;
    }

    private static int readByte(InputStream in) throws IOException {
        int b = in.read();
        if (b < 0) {
            throw new EOFException();
        }
        return b;
    }
}
