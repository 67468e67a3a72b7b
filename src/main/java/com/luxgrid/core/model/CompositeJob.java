package com.luxgrid.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Sums the indirect (ambient sky) and direct (sun) images of one view/condition pair.
 */
public record CompositeJob(Path indirectImage, Path directImage, Path output) implements Job {

    @Override
    public Phase phase() {
        return Phase.COMPOSITE;
    }

    @Override
    public List<Path> inputs() {
        return List.of(indirectImage, directImage);
    }
}
