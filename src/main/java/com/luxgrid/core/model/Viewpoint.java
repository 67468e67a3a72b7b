package com.luxgrid.core.model;

import java.nio.file.Path;

/**
 * One view descriptor (camera position and framing).
 */
public record Viewpoint(String id, Path descriptor) {

    public static Viewpoint of(Path descriptor) {
        return new Viewpoint(BaseScene.stem(descriptor), descriptor);
    }
}
