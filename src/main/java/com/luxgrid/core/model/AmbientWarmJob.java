package com.luxgrid.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Low-resolution overture render that fills the ambient cache file for one viewpoint.
 * The rendered image itself is discarded; the ambient file is the artifact.
 */
public record AmbientWarmJob(Path viewDescriptor, Path compiledScene, Path output) implements Job {

    @Override
    public Phase phase() {
        return Phase.AMBIENT_WARM;
    }

    @Override
    public List<Path> inputs() {
        return List.of(viewDescriptor, compiledScene);
    }
}
