package com.luxgrid.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Converts a composite HDR image to TIFF for viewing.
 */
public record ConvertJob(Path source, Path output) implements Job {

    @Override
    public Phase phase() {
        return Phase.CONVERT;
    }

    @Override
    public List<Path> inputs() {
        return List.of(source);
    }
}
