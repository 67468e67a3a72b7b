package com.luxgrid.core.report;

import com.luxgrid.core.aggregate.AggregationException;
import com.luxgrid.core.aggregate.ResultFile;
import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.model.ResultRecord;
import com.luxgrid.core.raster.ArtifactParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Reads every region result file in a directory and merges them into one
 * {@link ConsolidatedReport}.
 */
@Service
public class ReportMerger {

    private static final Logger log = LoggerFactory.getLogger(ReportMerger.class);

    private static final Pattern TIME_OF_DAY = Pattern.compile("_(\\d{2})(\\d{2})(?=_|$)");

    private final double minPassingArea;
    private final double defaultTimestepHours;

    @Autowired
    public ReportMerger(LuxgridProperties properties) {
        this(properties.getAggregation().getMinPassingArea(),
                properties.getAggregation().getDefaultTimestepHours());
    }

    ReportMerger(double minPassingArea, double defaultTimestepHours) {
        this.minPassingArea = minPassingArea;
        this.defaultTimestepHours = defaultTimestepHours;
    }

    /**
     * @throws AggregationException if the directory holds no readable result files
     */
    public ConsolidatedReport merge(Path resultDir, double areaPerPixel) {
        var records = readAll(resultDir);
        if (records.isEmpty()) {
            throw new AggregationException("No result files found in " + resultDir);
        }
        records.sort(Comparator.comparing(ResultRecord::regionId).thenComparing(ResultRecord::rasterId));

        var rows = new ArrayList<ConsolidatedReport.Row>(records.size());
        var pivot = new TreeMap<String, Map<String, Double>>();
        var totals = new LinkedHashMap<String, Integer>();
        var rasterIds = new TreeSet<String>();
        for (var r : records) {
            double area = r.passing() * areaPerPixel;
            rows.add(new ConsolidatedReport.Row(r.regionId(), r.rasterId(), r.totalInRegion(), r.passing(), area));
            pivot.computeIfAbsent(r.regionId(), k -> new TreeMap<>()).merge(r.rasterId(), area, Double::sum);
            totals.put(r.regionId(), r.totalInRegion());
            rasterIds.add(r.rasterId());
        }

        var columns = List.copyOf(rasterIds);
        double timestep = detectTimestep(columns);
        var summaries = new ArrayList<ConsolidatedReport.RegionSummary>();
        for (var entry : pivot.entrySet()) {
            String regionId = entry.getKey();
            Map<String, Double> areas = entry.getValue();
            int run = longestRun(columns, areas);
            int underscore = regionId.indexOf('_');
            summaries.add(new ConsolidatedReport.RegionSummary(
                    regionId,
                    underscore > 0 ? regionId.substring(0, underscore) : regionId,
                    underscore > 0 ? regionId.substring(underscore + 1) : "",
                    totals.get(regionId),
                    totals.get(regionId) * areaPerPixel,
                    areas.values().stream().mapToDouble(Double::doubleValue).sum(),
                    run,
                    hours(run, timestep)));
        }

        log.info("Merged {} rows for {} regions over {} rasters (timestep {} h)",
                rows.size(), pivot.size(), columns.size(), timestep);
        return new ConsolidatedReport(areaPerPixel, timestep, columns, List.copyOf(rows),
                pivot, List.copyOf(summaries));
    }

    private List<ResultRecord> readAll(Path resultDir) {
        if (!Files.isDirectory(resultDir)) {
            throw new AggregationException("Result directory not found: " + resultDir);
        }
        List<Path> files;
        try (var stream = Files.list(resultDir)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(ResultFile.EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new AggregationException("Cannot list " + resultDir, e);
        }
        var records = new ArrayList<ResultRecord>();
        for (Path file : files) {
            try {
                records.addAll(ResultFile.read(file));
            } catch (ArtifactParseException e) {
                log.warn("Skipping result file {}", e.getMessage());
            }
        }
        return records;
    }

    /**
     * Interval between the first two columns, taken from their {@code _HHMM}
     * time-of-day token.
     */
    double detectTimestep(List<String> rasterIds) {
        if (rasterIds.size() < 2) {
            return defaultTimestepHours;
        }
        Double first = hourOf(rasterIds.get(0));
        Double second = hourOf(rasterIds.get(1));
        if (first == null || second == null || first.equals(second)) {
            return defaultTimestepHours;
        }
        return Math.abs(second - first);
    }

    private static Double hourOf(String rasterId) {
        var m = TIME_OF_DAY.matcher(rasterId);
        Double hour = null;
        while (m.find()) {
            int hh = Integer.parseInt(m.group(1));
            int mm = Integer.parseInt(m.group(2));
            if (hh < 24 && mm < 60) {
                hour = hh + mm / 60.0;
            }
        }
        return hour;
    }

    int longestRun(List<String> columns, Map<String, Double> areas) {
        int best = 0;
        int current = 0;
        for (String column : columns) {
            if (areas.getOrDefault(column, 0.0) >= minPassingArea) {
                current++;
                best = Math.max(best, current);
            } else {
                current = 0;
            }
        }
        return best;
    }

    static double hours(int run, double timestepHours) {
        return Math.floor(run * timestepHours * 10) / 10;
    }
}
