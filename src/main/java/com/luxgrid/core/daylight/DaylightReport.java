package com.luxgrid.core.daylight;

import java.util.List;

/**
 * Per-region daylight statistics.
 *
 * @param thresholds daylight factor thresholds in percent, in the order of every
 *                   region's {@link RegionStats#compliance()}
 * @param regions    sorted by region id
 */
public record DaylightReport(double areaPerPixel, List<Double> thresholds, List<RegionStats> regions) {

    /**
     * @param pixels          region pixels with a daylight factor at or above the threshold
     * @param percentOfRegion {@code pixels} as a percentage of the region's pixels
     */
    public record Compliance(double threshold, int pixels, double percentOfRegion, double area) {}

    public record RegionStats(String regionId, int totalPixels, double area,
                              double meanIlluminance, double minIlluminance, double maxIlluminance,
                              double meanDf, double minDf, double maxDf, double medianDf,
                              List<Compliance> compliance) {}
}
