package com.luxgrid.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Compiles the skyless scene with one lighting condition.
 *
 * @param stagingCopy private copy of the scene octree used as the compile input,
 *                    created before launch and removed afterwards
 */
public record ConditionCompileJob(Path sceneOctree, Path conditionDescriptor, Path stagingCopy, Path output)
        implements Job {

    @Override
    public Phase phase() {
        return Phase.CONDITION_COMPILE;
    }

    @Override
    public List<Path> inputs() {
        return List.of(sceneOctree, conditionDescriptor);
    }
}
