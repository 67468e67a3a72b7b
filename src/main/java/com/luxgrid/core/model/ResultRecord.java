package com.luxgrid.core.model;

/**
 * Pixel counts for one region evaluated against one raster.
 *
 * @param totalInRegion pixels of the raster grid inside the polygon
 * @param passing       pixels inside the polygon with a value above the threshold
 */
public record ResultRecord(String regionId, String rasterId, int totalInRegion, int passing) {}
