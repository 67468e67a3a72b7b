package com.luxgrid.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Compiles the skyless scene together with the ambient sky into one octree.
 */
public record SceneCompileJob(Path sceneOctree, Path ambientSky, Path output) implements Job {

    @Override
    public Phase phase() {
        return Phase.SCENE_COMPILE;
    }

    @Override
    public List<Path> inputs() {
        return List.of(sceneOctree, ambientSky);
    }
}
