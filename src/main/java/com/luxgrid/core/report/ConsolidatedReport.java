package com.luxgrid.core.report;

import java.util.List;
import java.util.Map;

/**
 * Merged view of every region result file.
 *
 * @param rasterIds pivot columns, sorted
 * @param rows      flat rows sorted by (region, raster)
 * @param pivot     region id to raster id to passing area; absent cells are zero
 * @param regions   per-region totals and longest sunlit run
 */
public record ConsolidatedReport(double areaPerPixel, double timestepHours, List<String> rasterIds,
                                 List<Row> rows, Map<String, Map<String, Double>> pivot,
                                 List<RegionSummary> regions) {

    public record Row(String regionId, String rasterId, int totalPixels, int passingPixels, double passingArea) {}

    /**
     * @param apartment    region id up to the first underscore
     * @param subSpace     region id after the first underscore, empty if none
     * @param longestRun   longest run of consecutive rasters meeting the minimum passing area
     * @param hours        {@code longestRun} in hours, floored to one decimal place
     */
    public record RegionSummary(String regionId, String apartment, String subSpace, int totalPixels,
                                double regionArea, double totalPassingArea, int longestRun, double hours) {}
}
