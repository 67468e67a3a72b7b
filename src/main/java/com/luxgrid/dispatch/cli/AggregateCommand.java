package com.luxgrid.dispatch.cli;

import com.luxgrid.core.aggregate.AggregationException;
import com.luxgrid.core.aggregate.AggregationSummary;
import com.luxgrid.core.aggregate.RegionReader;
import com.luxgrid.core.aggregate.SpatialAggregator;
import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: luxgrid aggregate
 * <p>
 * Counts, for every region file, the pixels above the threshold in each
 * rendered picture of the region's view and writes one result file per region.
 */
@Command(name = "aggregate", mixinStandardHelpOptions = true,
        description = "Count passing pixels per region and picture")
@Component
public class AggregateCommand implements Callable<Integer> {

    static final String REGION_GLOB = "*.aoi";

    @Option(names = "--image-dir", description = "Rendered pictures; defaults to luxgrid.directories.image-dir")
    private Path imageDir;

    @Option(names = "--region-dir", description = "Region files (*.aoi); defaults to luxgrid.directories.region-dir")
    private Path regionDir;

    @Option(names = {"--threshold", "-t"}, description = "Pixels strictly above this value pass")
    private Double threshold;

    @Option(names = "--glob", description = "Picture file pattern; defaults to luxgrid.aggregation.raster-glob")
    private String glob;

    private final SpatialAggregator aggregator;
    private final EventBus eventBus;
    private final LuxgridProperties properties;

    public AggregateCommand(SpatialAggregator aggregator, EventBus eventBus, LuxgridProperties properties) {
        this.aggregator = aggregator;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var aggregation = properties.getAggregation();

        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        try {
            var rasters = ArtifactFiles.list(imageDir != null ? imageDir : properties.getImageDir(),
                    glob != null ? glob : aggregation.getRasterGlob());
            var regionFiles = ArtifactFiles.list(regionDir != null ? regionDir : properties.getRegionDir(),
                    REGION_GLOB);
            var regions = RegionReader.readAll(regionFiles);
            if (regions.size() < regionFiles.size()) {
                ConsoleOutput.warn((regionFiles.size() - regions.size()) + " malformed region files skipped");
            }
            ConsoleOutput.info(rasters.size() + " pictures, " + regions.size() + " regions");

            AggregationSummary summary = aggregator.aggregate(rasters, regions,
                    threshold != null ? threshold : aggregation.getThreshold());
            printSummary(summary);
            return summary.failedGroups() > 0 ? 1 : 0;
        } catch (AggregationException e) {
            ConsoleOutput.error("Aggregation failed: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot list inputs: " + e.getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
    }

    private static void printSummary(AggregationSummary summary) {
        System.out.println("──────────────────────────────────");
        if (!summary.skippedRegions().isEmpty()) {
            ConsoleOutput.info(summary.skippedRegions().size() + " regions already had result files");
        }
        if (!summary.unmatchedRasters().isEmpty()) {
            ConsoleOutput.warn(summary.unmatchedRasters().size() + " pictures matched no region view");
        }
        for (String view : summary.unmatchedViews()) {
            ConsoleOutput.warn("No pictures for view " + view);
        }
        String line = summary.filesWritten() + " result files written, " + summary.totalDecodes() + " decodes";
        if (summary.failedGroups() > 0) {
            ConsoleOutput.error(line + ", " + summary.failedGroups() + " failed groups");
        } else {
            ConsoleOutput.success(line);
        }
    }
}
