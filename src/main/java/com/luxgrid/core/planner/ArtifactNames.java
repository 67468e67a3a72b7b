package com.luxgrid.core.planner;

import com.luxgrid.core.model.BaseScene;
import com.luxgrid.core.model.LightingCondition;
import com.luxgrid.core.model.Viewpoint;

import java.nio.file.Path;

/**
 * Output-path contract for every planned artifact.
 * <p>
 * Every method is a pure function of the base name, condition id, viewpoint id
 * and phase. The idempotent filter relies on this: a renamed artifact is a new
 * artifact and will be recomputed.
 * <pre>
 *   scene compile      &lt;sceneDir&gt;/&lt;base&gt;_&lt;ambientSky&gt;.oct
 *   ambient warm       &lt;imageDir&gt;/&lt;base&gt;_&lt;view&gt;__&lt;ambientSky&gt;.amb
 *   indirect render    &lt;imageDir&gt;/&lt;base&gt;_&lt;view&gt;__&lt;ambientSky&gt;.hdr
 *   condition compile  &lt;sceneDir&gt;/&lt;base&gt;_&lt;condition&gt;.oct
 *   direct render      &lt;imageDir&gt;/&lt;base&gt;_&lt;view&gt;_&lt;condition&gt;.hdr
 *   composite          &lt;imageDir&gt;/&lt;base&gt;_&lt;view&gt;_&lt;condition&gt;_combined.hdr
 *   convert            &lt;imageDir&gt;/&lt;base&gt;_&lt;view&gt;_&lt;condition&gt;_combined.tiff
 * </pre>
 */
public final class ArtifactNames {

    private final Path sceneDir;
    private final Path imageDir;

    public ArtifactNames(Path sceneDir, Path imageDir) {
        this.sceneDir = sceneDir;
        this.imageDir = imageDir;
    }

    public Path compiledAmbientScene(BaseScene scene) {
        return sceneDir.resolve(scene.baseName() + "_" + scene.ambientSkyName() + ".oct");
    }

    public Path ambientFile(BaseScene scene, Viewpoint view) {
        return imageDir.resolve(indirectStem(scene, view) + ".amb");
    }

    public Path indirectImage(BaseScene scene, Viewpoint view) {
        return imageDir.resolve(indirectStem(scene, view) + ".hdr");
    }

    public Path compiledConditionScene(BaseScene scene, LightingCondition condition) {
        return sceneDir.resolve(scene.baseName() + "_" + condition.id() + ".oct");
    }

    public Path stagingCopy(BaseScene scene, LightingCondition condition) {
        return sceneDir.resolve(scene.baseName() + "_" + condition.id() + "_temp.oct");
    }

    public Path directImage(BaseScene scene, Viewpoint view, LightingCondition condition) {
        return imageDir.resolve(directStem(scene, view, condition) + ".hdr");
    }

    public Path compositeImage(BaseScene scene, Viewpoint view, LightingCondition condition) {
        return imageDir.resolve(directStem(scene, view, condition) + "_combined.hdr");
    }

    public Path convertedImage(BaseScene scene, Viewpoint view, LightingCondition condition) {
        return imageDir.resolve(directStem(scene, view, condition) + "_combined.tiff");
    }

    private static String indirectStem(BaseScene scene, Viewpoint view) {
        return scene.baseName() + "_" + view.id() + "__" + scene.ambientSkyName();
    }

    private static String directStem(BaseScene scene, Viewpoint view, LightingCondition condition) {
        return scene.baseName() + "_" + view.id() + "_" + condition.id();
    }
}
