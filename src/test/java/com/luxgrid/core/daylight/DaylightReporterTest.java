package com.luxgrid.core.daylight;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.luxgrid.core.aggregate.AggregationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DaylightReporterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DaylightReporter reporter;

    @BeforeEach
    void setUp() throws IOException {
        reporter = new DaylightReporter(objectMapper, List.of(2.0, 0.5, 1.0));
        DaylightFile.write(tempDir, "A101_Living", List.of(
                new DaylightFile.Sample(0, 0, 50.0, 0.5),
                new DaylightFile.Sample(1, 0, 100.0, 1.0),
                new DaylightFile.Sample(0, 1, 150.0, 1.5),
                new DaylightFile.Sample(1, 1, 300.0, 3.0)));
    }

    @Test
    @DisplayName("per-region statistics and compliance at or above each threshold")
    void summarize() {
        var report = reporter.summarize(tempDir, 0.25);

        assertEquals(List.of(0.5, 1.0, 2.0), report.thresholds());
        var stats = report.regions().get(0);
        assertEquals("A101_Living", stats.regionId());
        assertEquals(4, stats.totalPixels());
        assertEquals(1.0, stats.area(), 1e-9);
        assertEquals(150.0, stats.meanIlluminance(), 1e-9);
        assertEquals(50.0, stats.minIlluminance(), 1e-9);
        assertEquals(300.0, stats.maxIlluminance(), 1e-9);
        assertEquals(1.5, stats.meanDf(), 1e-9);
        assertEquals(1.25, stats.medianDf(), 1e-9);

        assertEquals(List.of(4, 3, 1), stats.compliance().stream().map(DaylightReport.Compliance::pixels).toList());
        assertEquals(75.0, stats.compliance().get(1).percentOfRegion(), 1e-9);
        assertEquals(0.25, stats.compliance().get(2).area(), 1e-9);
    }

    @Test
    @DisplayName("regions without pixels and unreadable files are left out")
    void skipsEmpty() throws IOException {
        DaylightFile.write(tempDir, "Z9", List.of());
        Files.writeString(tempDir.resolve("broken.wpd"), "garbage\n");

        var report = reporter.summarize(tempDir, 0.25);

        assertEquals(List.of("A101_Living"),
                report.regions().stream().map(DaylightReport.RegionStats::regionId).toList());
    }

    @Test
    @DisplayName("an empty directory is an aggregation error")
    void nothingToSummarize() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        assertThrows(AggregationException.class, () -> reporter.summarize(empty, 0.25));
        assertThrows(AggregationException.class, () -> reporter.summarize(tempDir.resolve("absent"), 0.25));
    }

    @Test
    @DisplayName("summary CSV labels thresholds without trailing zeros")
    void summaryLines() {
        var report = reporter.summarize(tempDir, 0.25, List.of(1.0, 0.5));

        var lines = DaylightReporter.summaryLines(report);

        assertTrue(lines.get(0).endsWith("pixels_df_gte_0.5pct,pct_area_df_gte_0.5pct,area_df_gte_0.5pct_m2,"
                + "pixels_df_gte_1pct,pct_area_df_gte_1pct,area_df_gte_1pct_m2"));
        assertEquals("A101_Living,4,1.0000,150.00,50.00,300.00,1.5000,0.5000,3.0000,1.2500,"
                + "4,100.00,1.0000,3,75.00,0.7500", lines.get(1));
    }

    @Test
    @DisplayName("writes the CSV and a readable JSON document")
    void writes() throws IOException {
        var report = reporter.summarize(tempDir, 0.25);
        Path out = tempDir.resolve("out");

        var written = reporter.write(report, out);

        assertEquals(List.of(out.resolve(DaylightReporter.SUMMARY_CSV), out.resolve(DaylightReporter.REPORT_JSON)),
                written);
        var json = objectMapper.readTree(out.resolve(DaylightReporter.REPORT_JSON).toFile());
        assertEquals("A101_Living", json.get("regions").get(0).get("regionId").asText());
        assertEquals(3, json.get("thresholds").size());
    }

    @Test
    @DisplayName("median of an even count averages the middle pair")
    void median() {
        assertEquals(2.0, DaylightReporter.median(new double[]{3, 1, 2}));
        assertEquals(2.5, DaylightReporter.median(new double[]{4, 1, 3, 2}));
    }
}
