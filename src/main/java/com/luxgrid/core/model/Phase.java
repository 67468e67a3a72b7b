package com.luxgrid.core.model;

/**
 * Ordered pipeline stages. Jobs of a later phase only consume artifacts
 * produced by the same or an earlier phase.
 */
public enum Phase {
    SCENE_COMPILE("scene-compile"),
    AMBIENT_WARM("ambient-warm"),
    CONDITION_COMPILE("condition-compile"),
    RENDER("render"),
    COMPOSITE("composite"),
    CONVERT("convert");

    private final String label;

    Phase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
