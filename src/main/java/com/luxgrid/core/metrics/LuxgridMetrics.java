package com.luxgrid.core.metrics;

import com.luxgrid.core.model.Phase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for rendering and aggregation runs.
 */
@Service
public class LuxgridMetrics {

    private final MeterRegistry registry;

    public LuxgridMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPhaseDuration(Phase phase, long ms) {
        Timer.builder("luxgrid.phase.duration")
                .tag("phase", phase.label())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordJob(Phase phase, boolean success, long ms) {
        Counter.builder("luxgrid.jobs.total")
                .tag("phase", phase.label())
                .tag("result", success ? "succeeded" : "failed")
                .register(registry)
                .increment();
        Timer.builder("luxgrid.job.duration")
                .tag("phase", phase.label())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records jobs dropped by the idempotent filter because their output already existed.
     */
    public void recordSkipped(Phase phase, int count) {
        Counter.builder("luxgrid.jobs.skipped")
                .tag("phase", phase.label())
                .register(registry)
                .increment(count);
    }

    public void recordGroupDuration(long ms) {
        Timer.builder("luxgrid.aggregation.group.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRegions(int written, int skipped) {
        Counter.builder("luxgrid.aggregation.regions")
                .tag("result", "written")
                .register(registry)
                .increment(written);
        Counter.builder("luxgrid.aggregation.regions")
                .tag("result", "skipped")
                .register(registry)
                .increment(skipped);
    }

    /**
     * Number of raster decodes one group task performed. With a working cache this
     * equals the number of distinct rasters in the group.
     */
    public void recordDecodes(int decodes) {
        DistributionSummary.builder("luxgrid.raster.decodes")
                .description("Raster decodes per group task")
                .register(registry)
                .record(decodes);
    }
}
