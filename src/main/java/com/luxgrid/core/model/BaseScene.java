package com.luxgrid.core.model;

import java.nio.file.Path;

/**
 * The compiled scene without any sky, plus the ambient (overcast) sky used to
 * warm the indirect-light cache.
 *
 * @param sceneOctree skyless octree produced by the scene-compilation collaborator
 * @param ambientSky  overcast sky descriptor
 */
public record BaseScene(Path sceneOctree, Path ambientSky) {

    private static final String SKYLESS_SUFFIX = "_skyless";

    /** Octree file stem with a trailing {@code _skyless} removed. */
    public String baseName() {
        String stem = stem(sceneOctree);
        return stem.endsWith(SKYLESS_SUFFIX)
                ? stem.substring(0, stem.length() - SKYLESS_SUFFIX.length())
                : stem;
    }

    public String ambientSkyName() {
        return stem(ambientSky);
    }

    static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
