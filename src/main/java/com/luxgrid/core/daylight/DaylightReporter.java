package com.luxgrid.core.daylight;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.luxgrid.core.aggregate.AggregationException;
import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.raster.ArtifactParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Summarises daylight files into {@code daylight_summary.csv} and
 * {@code daylight_report.json}.
 */
@Service
public class DaylightReporter {

    private static final Logger log = LoggerFactory.getLogger(DaylightReporter.class);

    public static final String SUMMARY_CSV = "daylight_summary.csv";
    public static final String REPORT_JSON = "daylight_report.json";

    private final ObjectMapper objectMapper;
    private final List<Double> defaultThresholds;

    @Autowired
    public DaylightReporter(ObjectMapper objectMapper, LuxgridProperties properties) {
        this(objectMapper, properties.getAggregation().getDfThresholds());
    }

    DaylightReporter(ObjectMapper objectMapper, List<Double> defaultThresholds) {
        this.objectMapper = objectMapper;
        this.defaultThresholds = List.copyOf(defaultThresholds);
    }

    public DaylightReport summarize(Path daylightDir, double areaPerPixel) {
        return summarize(daylightDir, areaPerPixel, defaultThresholds);
    }

    /**
     * Regions whose file holds no pixels are left out of the report.
     *
     * @throws AggregationException if the directory holds no usable daylight files
     */
    public DaylightReport summarize(Path daylightDir, double areaPerPixel, List<Double> thresholds) {
        if (!Files.isDirectory(daylightDir)) {
            throw new AggregationException("Daylight directory not found: " + daylightDir);
        }
        List<Path> files;
        try (var stream = Files.list(daylightDir)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(DaylightFile.EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new AggregationException("Cannot list " + daylightDir, e);
        }

        var sortedThresholds = thresholds.stream().sorted().toList();
        var regions = new ArrayList<DaylightReport.RegionStats>();
        for (Path file : files) {
            DaylightFile.Contents contents;
            try {
                contents = DaylightFile.read(file);
            } catch (ArtifactParseException e) {
                log.warn("Skipping daylight file {}", e.getMessage());
                continue;
            }
            if (contents.samples().isEmpty()) {
                log.warn("Region {} has no pixels; left out of the daylight report", contents.regionId());
                continue;
            }
            regions.add(stats(contents, areaPerPixel, sortedThresholds));
        }
        if (regions.isEmpty()) {
            throw new AggregationException("No daylight data found in " + daylightDir);
        }
        regions.sort(Comparator.comparing(DaylightReport.RegionStats::regionId));
        log.info("Summarised daylight for {} regions against thresholds {}", regions.size(), sortedThresholds);
        return new DaylightReport(areaPerPixel, sortedThresholds, List.copyOf(regions));
    }

    static DaylightReport.RegionStats stats(DaylightFile.Contents contents, double areaPerPixel,
                                            List<Double> thresholds) {
        var samples = contents.samples();
        double[] lux = samples.stream().mapToDouble(DaylightFile.Sample::illuminance).toArray();
        double[] df = samples.stream().mapToDouble(DaylightFile.Sample::dfPercent).toArray();
        int total = contents.totalPixels();

        var compliance = new ArrayList<DaylightReport.Compliance>(thresholds.size());
        for (double threshold : thresholds) {
            int pixels = (int) Arrays.stream(df).filter(v -> v >= threshold).count();
            double percent = total > 0 ? pixels * 100.0 / total : 0.0;
            compliance.add(new DaylightReport.Compliance(threshold, pixels, percent, pixels * areaPerPixel));
        }
        return new DaylightReport.RegionStats(contents.regionId(), total, total * areaPerPixel,
                Arrays.stream(lux).average().orElse(0), Arrays.stream(lux).min().orElse(0),
                Arrays.stream(lux).max().orElse(0),
                Arrays.stream(df).average().orElse(0), Arrays.stream(df).min().orElse(0),
                Arrays.stream(df).max().orElse(0), median(df), List.copyOf(compliance));
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
    }

    public List<Path> write(DaylightReport report, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path csv = outputDir.resolve(SUMMARY_CSV);
        Files.write(csv, summaryLines(report));
        Path json = outputDir.resolve(REPORT_JSON);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(json.toFile(), report);
        log.info("Daylight report written to {}", outputDir);
        return List.of(csv, json);
    }

    static List<String> summaryLines(DaylightReport report) {
        var header = new ArrayList<>(List.of("region", "total_pixels", "area_m2",
                "mean_illuminance_lux", "min_illuminance_lux", "max_illuminance_lux",
                "mean_df_percent", "min_df_percent", "max_df_percent", "median_df_percent"));
        for (double threshold : report.thresholds()) {
            String label = label(threshold);
            header.add("pixels_df_gte_" + label + "pct");
            header.add("pct_area_df_gte_" + label + "pct");
            header.add("area_df_gte_" + label + "pct_m2");
        }

        var lines = new ArrayList<String>(report.regions().size() + 1);
        lines.add(String.join(",", header));
        for (var r : report.regions()) {
            var cells = new ArrayList<>(List.of(csv(r.regionId()), String.valueOf(r.totalPixels()),
                    format("%.4f", r.area()),
                    format("%.2f", r.meanIlluminance()), format("%.2f", r.minIlluminance()),
                    format("%.2f", r.maxIlluminance()),
                    format("%.4f", r.meanDf()), format("%.4f", r.minDf()), format("%.4f", r.maxDf()),
                    format("%.4f", r.medianDf())));
            for (var c : r.compliance()) {
                cells.add(String.valueOf(c.pixels()));
                cells.add(format("%.2f", c.percentOfRegion()));
                cells.add(format("%.4f", c.area()));
            }
            lines.add(String.join(",", cells));
        }
        return lines;
    }

    /** {@code 0.5 -> "0.5"}, {@code 1.0 -> "1"}. */
    static String label(double threshold) {
        return BigDecimal.valueOf(threshold).stripTrailingZeros().toPlainString();
    }

    private static String csv(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
