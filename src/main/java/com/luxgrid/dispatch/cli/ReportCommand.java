package com.luxgrid.dispatch.cli;

import com.luxgrid.core.LuxgridException;
import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.report.PixelScale;
import com.luxgrid.core.report.ReportMerger;
import com.luxgrid.core.report.ReportWriter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: luxgrid report
 * <p>
 * Merges every region result file into results.csv, pivot.csv and report.json.
 * The pixel area comes from a pixel-to-world map file, or failing that from the
 * VIEW header of the first rendered picture.
 */
@Command(name = "report", mixinStandardHelpOptions = true,
        description = "Merge region results into CSV and JSON reports")
@Component
public class ReportCommand implements Callable<Integer> {

    @Option(names = "--result-dir", description = "Region result files; defaults to luxgrid.directories.result-dir")
    private Path resultDir;

    @Option(names = {"--map", "-m"}, description = "Pixel-to-world map file")
    private Path mapFile;

    @Option(names = {"--out", "-o"}, description = "Output directory; defaults to the result directory")
    private Path outputDir;

    private final ReportMerger merger;
    private final ReportWriter writer;
    private final LuxgridProperties properties;

    public ReportCommand(ReportMerger merger, ReportWriter writer, LuxgridProperties properties) {
        this.merger = merger;
        this.writer = writer;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path results = resultDir != null ? resultDir : properties.getResultDir();
        try {
            PixelScale scale = ScaleResolver.resolve(mapFile, properties, properties.getImageDir(),
                    properties.getAggregation().getRasterGlob());
            ConsoleOutput.info(String.format("Pixel %.4f m x %.4f m, area %s m2",
                    scale.pixelWidth(), scale.pixelHeight(), scale.areaPerPixel()));

            var report = merger.merge(results, scale.areaPerPixel());
            var written = writer.write(report, outputDir != null ? outputDir : results);
            for (var summary : report.regions()) {
                System.out.printf("  %-30s %3d timesteps  %4.1f h%n",
                        summary.regionId(), summary.longestRun(), summary.hours());
            }
            written.forEach(p -> ConsoleOutput.success("Wrote " + p));
            return 0;
        } catch (LuxgridException e) {
            ConsoleOutput.error("Report failed: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write report: " + e.getMessage());
            return 1;
        }
    }
}
