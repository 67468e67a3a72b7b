package com.luxgrid.dispatch.cli;

import com.luxgrid.core.LuxgridException;
import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.raster.RasterHeaderReader;
import com.luxgrid.core.report.PixelScale;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Picks the pixel-to-world scale for a report: the map file given on the
 * command line, then the configured map file, then the VIEW header of the
 * first picture matching {@code rasterGlob} in the image directory.
 */
final class ScaleResolver {

    private ScaleResolver() {}

    static PixelScale resolve(Path mapFile, LuxgridProperties properties, Path imageDir, String rasterGlob)
            throws IOException {
        if (mapFile != null) {
            return PixelScale.fromMapFile(mapFile);
        }
        String configured = properties.getAggregation().getPixelToWorldMap();
        if (!configured.isBlank()) {
            return PixelScale.fromMapFile(Path.of(configured));
        }
        var rasters = ArtifactFiles.list(imageDir, rasterGlob);
        if (rasters.isEmpty()) {
            throw new LuxgridException("No pixel-to-world map given and no pictures in "
                    + imageDir + " to read a VIEW from");
        }
        return PixelScale.fromHeader(RasterHeaderReader.read(rasters.get(0)));
    }
}
