package com.luxgrid.core.metrics;

import com.luxgrid.core.model.Phase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LuxgridMetricsTest {

    private SimpleMeterRegistry registry;
    private LuxgridMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LuxgridMetrics(registry);
    }

    @Test
    @DisplayName("recordPhaseDuration creates a timer tagged by phase")
    void recordPhaseDuration() {
        metrics.recordPhaseDuration(Phase.RENDER, 1500);
        var timer = registry.find("luxgrid.phase.duration").tag("phase", "render").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordJob splits the counter by result")
    void recordJob() {
        metrics.recordJob(Phase.CONVERT, true, 10);
        metrics.recordJob(Phase.CONVERT, true, 10);
        metrics.recordJob(Phase.CONVERT, false, 10);

        var succeeded = registry.find("luxgrid.jobs.total").tag("result", "succeeded").counter();
        var failed = registry.find("luxgrid.jobs.total").tag("result", "failed").counter();

        assertNotNull(succeeded);
        assertNotNull(failed);
        assertEquals(2.0, succeeded.count());
        assertEquals(1.0, failed.count());
        assertEquals(3, registry.find("luxgrid.job.duration").timer().count());
    }

    @Test
    @DisplayName("recordSkipped adds the skipped count")
    void recordSkipped() {
        metrics.recordSkipped(Phase.AMBIENT_WARM, 4);
        assertEquals(4.0, registry.find("luxgrid.jobs.skipped").tag("phase", "ambient-warm").counter().count());
    }

    @Test
    @DisplayName("aggregation meters record regions and decodes")
    void aggregationMeters() {
        metrics.recordRegions(3, 2);
        metrics.recordDecodes(5);
        metrics.recordGroupDuration(250);

        assertEquals(3.0, registry.find("luxgrid.aggregation.regions").tag("result", "written").counter().count());
        assertEquals(2.0, registry.find("luxgrid.aggregation.regions").tag("result", "skipped").counter().count());
        var decodes = registry.find("luxgrid.raster.decodes").summary();
        assertNotNull(decodes);
        assertEquals(5.0, decodes.totalAmount());
        assertEquals(1, registry.find("luxgrid.aggregation.group.duration").timer().count());
    }
}
