package com.luxgrid.core.report;

import com.luxgrid.core.raster.ArtifactParseException;
import com.luxgrid.core.raster.RasterHeader;
import com.luxgrid.core.raster.ViewFraming;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PixelScaleTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("reads image and world dimensions from a map file header")
    void fromMapFile() throws IOException {
        Path map = Files.writeString(tempDir.resolve("pixel_to_world.csv"), """
                # Image dimensions in pixels: width=2048, height=1778
                # World dimensions in meters: width=29.480000, height=25.590000
                pixel_x,pixel_y,world_x,world_y
                0,0,-14.74,12.795
                """);

        var scale = PixelScale.fromMapFile(map);

        assertEquals(2048, scale.imageWidth());
        assertEquals(1778, scale.imageHeight());
        assertEquals(29.48 / 2048, scale.pixelWidth(), 1e-12);
        assertEquals(0.000207, scale.areaPerPixel(), 1e-12);
    }

    @Test
    @DisplayName("area per pixel is rounded to six decimals")
    void rounding() {
        assertEquals(0.01, new PixelScale(100, 50, 10, 5).areaPerPixel(), 0.0);
    }

    @Test
    @DisplayName("derives the scale from a parallel view header")
    void fromHeader() {
        var view = new ViewFraming('l', 5, 5, 10, 8, 4);
        var header = new RasterHeader(Path.of("a.hdr"), RasterHeader.RGBE_FORMAT, 1.0, view, 16, 8, 0);

        var scale = PixelScale.fromHeader(header);

        assertEquals(0.5, scale.pixelWidth(), 1e-12);
        assertEquals(0.25, scale.areaPerPixel(), 1e-12);
    }

    @Test
    @DisplayName("missing dimensions or VIEW are parse errors")
    void errors() throws IOException {
        Path map = Files.writeString(tempDir.resolve("map.csv"), "# Image dimensions in pixels: width=10, height=10\n");
        var header = new RasterHeader(Path.of("a.hdr"), RasterHeader.RGBE_FORMAT, 1.0, null, 16, 8, 0);

        assertThrows(ArtifactParseException.class, () -> PixelScale.fromMapFile(map));
        assertThrows(ArtifactParseException.class, () -> PixelScale.fromHeader(header));
    }
}
