package com.luxgrid.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes a {@link ConsolidatedReport} as {@code results.csv} (flat rows),
 * {@code pivot.csv} (region by raster passing area with totals and the
 * longest sunlit run) and {@code report.json}.
 */
@Service
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public static final String RESULTS_CSV = "results.csv";
    public static final String PIVOT_CSV = "pivot.csv";
    public static final String REPORT_JSON = "report.json";

    private final ObjectMapper objectMapper;

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Path> write(ConsolidatedReport report, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);

        Path results = outputDir.resolve(RESULTS_CSV);
        Files.write(results, resultLines(report));

        Path pivot = outputDir.resolve(PIVOT_CSV);
        Files.write(pivot, pivotLines(report));

        Path json = outputDir.resolve(REPORT_JSON);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(json.toFile(), report);

        log.info("Report written to {}", outputDir);
        return List.of(results, pivot, json);
    }

    static List<String> resultLines(ConsolidatedReport report) {
        var lines = new ArrayList<String>(report.rows().size() + 1);
        lines.add("region,raster,total_pixels,passing_pixels,passing_area_m2");
        for (var row : report.rows()) {
            lines.add(String.join(",", csv(row.regionId()), csv(row.rasterId()),
                    String.valueOf(row.totalPixels()), String.valueOf(row.passingPixels()),
                    number(row.passingArea())));
        }
        return lines;
    }

    static List<String> pivotLines(ConsolidatedReport report) {
        var lines = new ArrayList<String>(report.regions().size() + 1);
        var header = new ArrayList<String>(List.of("region", "apartment", "sub_space",
                "region_area_m2", "total_passing_area_m2", "consecutive_timesteps", "hours_of_direct_sun"));
        report.rasterIds().forEach(id -> header.add(csv(id)));
        lines.add(String.join(",", header));

        for (var summary : report.regions()) {
            var cells = new ArrayList<String>(List.of(
                    csv(summary.regionId()), csv(summary.apartment()), csv(summary.subSpace()),
                    number(summary.regionArea()), number(summary.totalPassingArea()),
                    String.valueOf(summary.longestRun()), String.valueOf(summary.hours())));
            var areas = report.pivot().get(summary.regionId());
            for (String rasterId : report.rasterIds()) {
                cells.add(number(areas.getOrDefault(rasterId, 0.0)));
            }
            lines.add(String.join(",", cells));
        }
        return lines;
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }

    private static String csv(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
