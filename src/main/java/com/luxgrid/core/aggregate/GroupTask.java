package com.luxgrid.core.aggregate;

import com.luxgrid.core.model.Region;

import java.nio.file.Path;
import java.util.List;

/**
 * Work message for one worker: the regions of one view, evaluated against
 * every raster rendered from that view.
 *
 * @param name task name used in logs and events
 */
public record GroupTask(String name, String viewId, List<Path> rasters, List<Region> regions,
                        double threshold, Path outputDir) {

    public GroupTask {
        rasters = List.copyOf(rasters);
        regions = List.copyOf(regions);
    }
}
