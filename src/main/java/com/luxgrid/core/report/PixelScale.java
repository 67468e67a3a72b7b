package com.luxgrid.core.report;

import com.luxgrid.core.raster.ArtifactParseException;
import com.luxgrid.core.raster.RasterHeader;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Relation between picture pixels and floor area.
 *
 * <p>Read either from a pixel-to-world map file, whose header carries
 * <pre>
 * # Image dimensions in pixels: width=2048, height=1778
 * # World dimensions in meters: width=29.480000, height=25.590000
 * </pre>
 * or from the {@code VIEW=} framing of a rendered picture.
 */
public record PixelScale(int imageWidth, int imageHeight, double worldWidth, double worldHeight) {

    private static final Pattern DIMENSIONS =
            Pattern.compile("width=\\s*([-+]?\\d*\\.?\\d+)\\s*,\\s*height=\\s*([-+]?\\d*\\.?\\d+)");

    public static PixelScale fromMapFile(Path mapFile) {
        List<String> lines;
        try {
            lines = Files.readAllLines(mapFile);
        } catch (IOException e) {
            throw new ArtifactParseException(mapFile, "cannot read pixel-to-world map", e);
        }
        double[] image = null;
        double[] world = null;
        for (String line : lines) {
            if (line.contains("Image dimensions")) {
                image = dimensions(mapFile, line);
            } else if (line.contains("World dimensions")) {
                world = dimensions(mapFile, line);
            }
            if (image != null && world != null) {
                break;
            }
        }
        if (image == null || world == null) {
            throw new ArtifactParseException(mapFile, "missing image or world dimensions line");
        }
        return new PixelScale((int) image[0], (int) image[1], world[0], world[1]);
    }

    public static PixelScale fromHeader(RasterHeader header) {
        if (header.view() == null) {
            throw new ArtifactParseException(header.artifact(), "no VIEW line to derive pixel scale from");
        }
        return new PixelScale(header.width(), header.height(),
                header.view().worldWidth(), header.view().worldHeight());
    }

    public double pixelWidth() {
        return worldWidth / imageWidth;
    }

    public double pixelHeight() {
        return worldHeight / imageHeight;
    }

    /** Floor area of one pixel in square metres, rounded to 6 decimal places. */
    public double areaPerPixel() {
        return BigDecimal.valueOf(pixelWidth() * pixelHeight())
                .setScale(6, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    private static double[] dimensions(Path mapFile, String line) {
        var m = DIMENSIONS.matcher(line);
        if (!m.find()) {
            throw new ArtifactParseException(mapFile, "bad dimensions line: " + line);
        }
        double width = Double.parseDouble(m.group(1));
        double height = Double.parseDouble(m.group(2));
        if (width <= 0 || height <= 0) {
            throw new ArtifactParseException(mapFile, "non-positive dimensions: " + line);
        }
        return new double[] {width, height};
    }
}
