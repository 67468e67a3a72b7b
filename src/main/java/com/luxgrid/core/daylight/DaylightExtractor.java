package com.luxgrid.core.daylight;

import com.luxgrid.core.aggregate.AggregationException;
import com.luxgrid.core.aggregate.PolygonMask;
import com.luxgrid.core.aggregate.SpatialAggregator;
import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.events.EventBus;
import com.luxgrid.core.events.PipelineEvent;
import com.luxgrid.core.logging.MdcContext;
import com.luxgrid.core.metrics.LuxgridMetrics;
import com.luxgrid.core.model.Region;
import com.luxgrid.core.raster.Raster;
import com.luxgrid.core.raster.RasterCache;
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
 * Extracts per-pixel illuminance and daylight factor for every region from a
 * single overcast-sky render per view.
 *
 * <p>Raster samples are radiometric brightness. Illuminance is
 * {@code value * 179} lux, and the daylight factor is that illuminance as a
 * percentage of a 10,000 lux unobstructed sky. Each view's raster is decoded
 * once and sampled for all of the view's regions.
 */
@Service
public class DaylightExtractor {

    private static final Logger log = LoggerFactory.getLogger(DaylightExtractor.class);

    /** Luminous efficacy of the Radiance white-light model, lm/W. */
    public static final double LUMINOUS_EFFICACY = 179.0;

    /** Unobstructed sky illuminance the daylight factor is expressed against, lux. */
    public static final double SKY_ILLUMINANCE = 10_000.0;

    private final RasterDecoder decoder;
    private final Path outputDir;
    private final EventBus eventBus;
    private final LuxgridMetrics metrics;

    @Autowired
    public DaylightExtractor(RasterDecoder decoder, LuxgridProperties properties, EventBus eventBus,
                             LuxgridMetrics metrics) {
        this(decoder, properties.getDaylightDir(), eventBus, metrics);
    }

    DaylightExtractor(RasterDecoder decoder, Path outputDir, EventBus eventBus, LuxgridMetrics metrics) {
        this.decoder = decoder;
        this.outputDir = outputDir;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public static double illuminance(double value) {
        return value * LUMINOUS_EFFICACY;
    }

    public static double daylightFactor(double illuminance) {
        return illuminance * 100 / SKY_ILLUMINANCE;
    }

    /**
     * @throws AggregationException if there are no rasters or no regions, or
     *                              the output directory cannot be created
     */
    public DaylightSummary extract(List<Path> rasterArtifacts, List<Region> regions) {
        if (rasterArtifacts.isEmpty()) {
            throw new AggregationException("No raster artifacts for daylight extraction");
        }
        if (regions.isEmpty()) {
            throw new AggregationException("No regions for daylight extraction");
        }
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new AggregationException("Cannot create daylight directory " + outputDir, e);
        }

        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        try {
            return doExtract(runId, rasterArtifacts, regions);
        } finally {
            MdcContext.clear();
        }
    }

    private DaylightSummary doExtract(String runId, List<Path> rasterArtifacts, List<Region> regions) {
        var skipped = new ArrayList<String>();
        var regionsByView = new TreeMap<String, List<Region>>();
        for (var region : regions) {
            if (Files.exists(DaylightFile.pathFor(outputDir, region.id()))) {
                skipped.add(region.id());
            } else {
                regionsByView.computeIfAbsent(region.viewId(), k -> new ArrayList<>()).add(region);
            }
        }

        var rastersByView = new TreeMap<String, List<Path>>();
        for (Path raster : rasterArtifacts) {
            String view = SpatialAggregator.matchView(raster, regionsByView.keySet());
            if (view != null) {
                rastersByView.computeIfAbsent(view, k -> new ArrayList<>()).add(raster);
            }
        }

        var cache = new RasterCache(decoder, 1);
        var written = new ArrayList<Path>();
        var failedViews = new ArrayList<String>();
        var missingViews = new ArrayList<String>();
        for (var entry : regionsByView.entrySet()) {
            String view = entry.getKey();
            MdcContext.setViewGroup(runId, view);
            List<Path> rasters = rastersByView.getOrDefault(view, List.of());
            if (rasters.isEmpty()) {
                log.warn("View {} has {} regions but no raster", view, entry.getValue().size());
                missingViews.add(view);
                continue;
            }
            rasters.sort(null);
            if (rasters.size() > 1) {
                log.warn("View {} has {} rasters, expected 1; using {}",
                        view, rasters.size(), rasters.get(0).getFileName());
            }

            var decoded = cache.get(rasters.get(0));
            if (decoded.isEmpty()) {
                failedViews.add(view);
                continue;
            }
            Raster raster = decoded.get();
            for (var region : entry.getValue()) {
                try {
                    Path file = DaylightFile.write(outputDir, region.id(), sample(raster, region));
                    written.add(file);
                } catch (IOException e) {
                    log.error("Cannot write daylight file for region {}: {}", region.id(), e.getMessage(), e);
                }
            }
            log.info("View {}: {} regions from {}", view, entry.getValue().size(), raster.id());
        }
        MdcContext.setRun(runId);

        if (metrics != null) {
            metrics.recordDecodes(cache.decodeCount());
            metrics.recordRegions(written.size(), skipped.size());
        }
        var summary = new DaylightSummary(List.copyOf(written), List.copyOf(skipped), List.copyOf(failedViews),
                List.copyOf(missingViews), cache.decodeCount());
        eventBus.publish(PipelineEvent.of("daylight.completed", runId, null,
                Map.of("written", written.size(), "failedViews", failedViews.size())));
        log.info("Daylight extraction complete: {} files written, {} skipped, {} views failed",
                written.size(), skipped.size(), failedViews.size());
        return summary;
    }

    static List<DaylightFile.Sample> sample(Raster raster, Region region) {
        var mask = PolygonMask.build(region.vertices(), raster.width(), raster.height());
        var samples = new ArrayList<DaylightFile.Sample>(mask.pixelCount());
        mask.forEachPixel((x, y) -> {
            double lux = illuminance(raster.value(x, y));
            samples.add(new DaylightFile.Sample(x, y, lux, daylightFactor(lux)));
        });
        return samples;
    }
}
