package com.luxgrid.core.model;

import java.nio.file.Path;

/**
 * One sky descriptor (sun position at a given time step).
 */
public record LightingCondition(String id, Path descriptor) {

    public static LightingCondition of(Path descriptor) {
        return new LightingCondition(BaseScene.stem(descriptor), descriptor);
    }
}
