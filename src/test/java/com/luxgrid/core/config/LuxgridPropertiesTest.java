package com.luxgrid.core.config;

import com.luxgrid.core.model.Phase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LuxgridPropertiesTest {

    private final int cpus = Runtime.getRuntime().availableProcessors();

    @Test
    @DisplayName("defaults match the production layout")
    void defaults() {
        var properties = new LuxgridProperties();

        assertEquals(Path.of("outputs/image"), properties.getImageDir());
        assertEquals(Path.of("outputs/wpd"), properties.getResultDir());
        assertEquals(1024, properties.getRender().getImageWidth());
        assertEquals("*_combined.hdr", properties.getAggregation().getRasterGlob());
        assertTrue(properties.getToolchain().isAtomicOutputs());
        assertEquals(Path.of("outputs/daylight"), properties.getDaylightDir());
        assertEquals(List.of(0.5, 1.0, 2.0), properties.getAggregation().getDfThresholds());
    }

    @Test
    @DisplayName("scene compile always runs on a single worker")
    void sceneCompileSingleWorker() {
        assertEquals(1, new LuxgridProperties().workersFor(Phase.SCENE_COMPILE));
    }

    @Test
    @DisplayName("worker counts are capped at the processor count and floored at one")
    void workerCapping() {
        var properties = new LuxgridProperties();
        properties.getWorkers().setRender(10_000);
        properties.getWorkers().setConvert(0);
        properties.getWorkers().setAggregation(-3);

        assertEquals(cpus, properties.workersFor(Phase.RENDER));
        assertEquals(1, properties.workersFor(Phase.CONVERT));
        assertEquals(1, properties.aggregationWorkers());
    }
}
