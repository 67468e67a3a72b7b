package com.luxgrid.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders one viewpoint against a compiled octree.
 * <p>
 * {@link Kind#INDIRECT} renders use the ambient sky octree and the warmed ambient
 * file; {@link Kind#DIRECT} renders use a condition octree with no ambient bounces.
 *
 * @param ambientFile warmed ambient cache, {@code null} for direct renders
 */
public record RenderJob(Kind kind, Path viewDescriptor, Path compiledScene, Path ambientFile, Path output)
        implements Job {

    public enum Kind { INDIRECT, DIRECT }

    @Override
    public Phase phase() {
        return Phase.RENDER;
    }

    @Override
    public List<Path> inputs() {
        var inputs = new ArrayList<Path>(List.of(viewDescriptor, compiledScene));
        if (ambientFile != null) {
            inputs.add(ambientFile);
        }
        return List.copyOf(inputs);
    }
}
