package com.luxgrid.core.model;

import java.util.List;

/**
 * A zone of interest: an immutable polygon in pixel space of the images
 * rendered from {@code viewId}.
 *
 * @param id        region identifier (the region file stem)
 * @param label     owner/label line, e.g. apartment and room
 * @param viewId    viewpoint whose rasters this region is evaluated against
 * @param elevation reference floor elevation in metres
 * @param vertices  polygon vertices in pixel coordinates
 */
public record Region(String id, String label, String viewId, double elevation, List<Vertex> vertices) {

    public Region {
        vertices = List.copyOf(vertices);
    }

    public record Vertex(double x, double y) {}
}
