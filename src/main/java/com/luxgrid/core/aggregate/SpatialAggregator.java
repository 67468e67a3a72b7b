package com.luxgrid.core.aggregate;

import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.events.EventBus;
import com.luxgrid.core.events.PipelineEvent;
import com.luxgrid.core.logging.MdcContext;
import com.luxgrid.core.metrics.LuxgridMetrics;
import com.luxgrid.core.model.Region;
import com.luxgrid.core.raster.RasterDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Counts, per region and per raster, the region pixels brighter than a
 * threshold, and writes one result file per region.
 *
 * <p>Regions are grouped by their associated view; a raster joins the group
 * whose view id appears in its file name (the longest such id when several
 * do). Each group becomes one task with its own raster cache, so a raster
 * is decoded once however many regions it is tested against. Regions that
 * already have a result file are skipped.
 */
@Service
public class SpatialAggregator {

    private static final Logger log = LoggerFactory.getLogger(SpatialAggregator.class);

    private final RasterDecoder decoder;
    private final int workers;
    private final Path resultDir;
    private final EventBus eventBus;
    private final LuxgridMetrics metrics;

    @Autowired
    public SpatialAggregator(RasterDecoder decoder, LuxgridProperties properties,
                             EventBus eventBus, LuxgridMetrics metrics) {
        this(decoder, properties.aggregationWorkers(), properties.getResultDir(), eventBus, metrics);
    }

    SpatialAggregator(RasterDecoder decoder, int workers, Path resultDir, EventBus eventBus, LuxgridMetrics metrics) {
        this.decoder = decoder;
        this.workers = workers;
        this.resultDir = resultDir;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @throws AggregationException if there are no rasters or no regions
     */
    public AggregationSummary aggregate(List<Path> rasterArtifacts, List<Region> regions, double threshold) {
        if (rasterArtifacts.isEmpty()) {
            throw new AggregationException("No raster artifacts to aggregate");
        }
        if (regions.isEmpty()) {
            throw new AggregationException("No regions to aggregate");
        }
        createResultDir();

        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        try {
            return doAggregate(runId, rasterArtifacts, regions, threshold);
        } finally {
            MdcContext.clear();
        }
    }

    private AggregationSummary doAggregate(String runId, List<Path> rasterArtifacts, List<Region> regions,
                                           double threshold) {
        var skipped = new ArrayList<String>();
        var regionsByView = new TreeMap<String, List<Region>>();
        for (var region : regions) {
            if (Files.exists(ResultFile.pathFor(resultDir, region.id()))) {
                skipped.add(region.id());
                continue;
            }
            regionsByView.computeIfAbsent(region.viewId(), k -> new ArrayList<>()).add(region);
        }
        if (!skipped.isEmpty()) {
            log.info("Skipping {} regions with existing result files", skipped.size());
        }

        var rastersByView = new TreeMap<String, List<Path>>();
        var unmatched = new ArrayList<Path>();
        for (Path raster : rasterArtifacts) {
            String view = matchView(raster, regionsByView.keySet());
            if (view == null) {
                unmatched.add(raster);
            } else {
                rastersByView.computeIfAbsent(view, k -> new ArrayList<>()).add(raster);
            }
        }
        if (!unmatched.isEmpty()) {
            log.warn("{} rasters match no region view, e.g. {}", unmatched.size(), unmatched.get(0).getFileName());
        }

        var unmatchedViews = new ArrayList<String>();
        var tasks = new ArrayList<GroupTask>();
        for (var entry : regionsByView.entrySet()) {
            String view = entry.getKey();
            List<Path> rasters = rastersByView.getOrDefault(view, List.of());
            if (rasters.isEmpty()) {
                log.warn("View {} has {} regions but no rasters", view, entry.getValue().size());
                unmatchedViews.add(view);
                continue;
            }
            tasks.add(new GroupTask(view, view, rasters, entry.getValue(), threshold, resultDir));
        }

        log.info("Aggregating {} regions over {} views in {} tasks on {} workers",
                regions.size() - skipped.size(), regionsByView.size(), tasks.size(), workers);
        eventBus.publish(PipelineEvent.of("aggregation.started", runId, null,
                Map.of("tasks", tasks.size(), "skippedRegions", skipped.size())));

        var pool = new GroupWorkerPool(decoder, workers);
        List<GroupResult> results = pool.runAll(runId, tasks, result -> {
            if (metrics != null) {
                metrics.recordGroupDuration(result.elapsedMs());
                metrics.recordDecodes(result.decodeCount());
            }
            eventBus.publish(PipelineEvent.of(result.succeeded() ? "group.completed" : "group.failed",
                    runId, result.name(),
                    Map.of("written", result.written().size(), "decodes", result.decodeCount())));
        });

        var summary = new AggregationSummary(List.copyOf(results), List.copyOf(skipped),
                List.copyOf(unmatched), List.copyOf(unmatchedViews));
        if (metrics != null) {
            metrics.recordRegions(summary.filesWritten(), skipped.size());
        }
        eventBus.publish(PipelineEvent.of("aggregation.completed", runId, null,
                Map.of("written", summary.filesWritten(), "failedGroups", summary.failedGroups())));
        log.info("Aggregation complete: {} result files written, {} failed groups",
                summary.filesWritten(), summary.failedGroups());
        return summary;
    }

    public static String matchView(Path raster, Iterable<String> views) {
        String name = raster.getFileName().toString();
        String best = null;
        for (String view : views) {
            if (name.contains(view) && (best == null || view.length() > best.length())) {
                best = view;
            }
        }
        return best;
    }

    private void createResultDir() {
        try {
            Files.createDirectories(resultDir);
        } catch (IOException e) {
            throw new AggregationException("Cannot create result directory " + resultDir, e);
        }
    }
}
