package com.luxgrid.core.daylight;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one daylight extraction pass.
 *
 * @param written        daylight files written, one per region
 * @param skippedRegions regions whose daylight file already existed
 * @param failedViews    views whose raster could not be decoded
 * @param missingViews   views that have regions but no raster
 * @param decodeCount    rasters decoded, at most one per view
 */
public record DaylightSummary(List<Path> written, List<String> skippedRegions, List<String> failedViews,
                              List<String> missingViews, int decodeCount) {

    public boolean hasFailures() {
        return !failedViews.isEmpty();
    }
}
