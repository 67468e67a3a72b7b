package com.luxgrid.dispatch.cli;

import com.luxgrid.core.LuxgridException;
import com.luxgrid.core.aggregate.RegionReader;
import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.daylight.DaylightExtractor;
import com.luxgrid.core.daylight.DaylightReporter;
import com.luxgrid.core.daylight.DaylightSummary;
import com.luxgrid.core.report.PixelScale;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: luxgrid daylight
 * <p>
 * Samples the daylight factor of every region from one overcast-sky picture
 * per view, then writes daylight_summary.csv and daylight_report.json with
 * the area at or above each threshold.
 */
@Command(name = "daylight", mixinStandardHelpOptions = true,
        description = "Extract per-region daylight factor and compliance areas")
@Component
public class DaylightCommand implements Callable<Integer> {

    @Option(names = "--image-dir", description = "Rendered pictures; defaults to luxgrid.directories.image-dir")
    private Path imageDir;

    @Option(names = "--region-dir", description = "Region files (*.aoi); defaults to luxgrid.directories.region-dir")
    private Path regionDir;

    @Option(names = "--glob", description = "Picture file pattern; defaults to luxgrid.aggregation.daylight-raster-glob")
    private String glob;

    @Option(names = {"--map", "-m"}, description = "Pixel-to-world map file")
    private Path mapFile;

    @Option(names = {"--out", "-o"}, description = "Output directory; defaults to luxgrid.directories.daylight-dir")
    private Path outputDir;

    @Option(names = {"--df-threshold", "-t"}, split = ",",
            description = "Daylight factor thresholds in percent; defaults to luxgrid.aggregation.df-thresholds")
    private List<Double> thresholds;

    private final DaylightExtractor extractor;
    private final DaylightReporter reporter;
    private final LuxgridProperties properties;

    public DaylightCommand(DaylightExtractor extractor, DaylightReporter reporter, LuxgridProperties properties) {
        this.extractor = extractor;
        this.reporter = reporter;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var aggregation = properties.getAggregation();
        Path images = imageDir != null ? imageDir : properties.getImageDir();
        String pattern = glob != null ? glob : aggregation.getDaylightRasterGlob();
        try {
            var rasters = ArtifactFiles.list(images, pattern);
            var regionFiles = ArtifactFiles.list(regionDir != null ? regionDir : properties.getRegionDir(),
                    AggregateCommand.REGION_GLOB);
            var regions = RegionReader.readAll(regionFiles);
            if (regions.size() < regionFiles.size()) {
                ConsoleOutput.warn((regionFiles.size() - regions.size()) + " malformed region files skipped");
            }
            ConsoleOutput.info(rasters.size() + " pictures, " + regions.size() + " regions");

            DaylightSummary summary = extractor.extract(rasters, regions);
            for (String view : summary.missingViews()) {
                ConsoleOutput.warn("No picture for view " + view);
            }
            for (String view : summary.failedViews()) {
                ConsoleOutput.error("Picture for view " + view + " could not be decoded");
            }

            PixelScale scale = ScaleResolver.resolve(mapFile, properties, images, pattern);
            var report = reporter.summarize(properties.getDaylightDir(), scale.areaPerPixel(),
                    thresholds != null ? thresholds : aggregation.getDfThresholds());
            var written = reporter.write(report, outputDir != null ? outputDir : properties.getDaylightDir());
            for (var region : report.regions()) {
                System.out.printf("  %-30s mean DF %6.2f%%  median %6.2f%%%n",
                        region.regionId(), region.meanDf(), region.medianDf());
            }
            written.forEach(p -> ConsoleOutput.success("Wrote " + p));
            return summary.hasFailures() ? 1 : 0;
        } catch (LuxgridException e) {
            ConsoleOutput.error("Daylight extraction failed: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read inputs or write report: " + e.getMessage());
            return 1;
        }
    }
}
