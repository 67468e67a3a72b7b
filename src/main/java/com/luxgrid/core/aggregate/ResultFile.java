package com.luxgrid.core.aggregate;

import com.luxgrid.core.model.ResultRecord;
import com.luxgrid.core.raster.ArtifactParseException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-region result file ({@code <region id>.wpd}):
 * <pre>
 * total_pixels_in_polygon: 412
 * raster_id passing_pixels
 * model_plan_L01_sky_0621_0900_combined 130
 * model_plan_L01_sky_0621_1000_combined 97
 * </pre>
 * Rows are sorted by raster id.
 */
public final class ResultFile {

    public static final String EXTENSION = ".wpd";
    public static final String TOTAL_PREFIX = "total_pixels_in_polygon:";
    static final String COLUMNS = "raster_id passing_pixels";

    private ResultFile() {}

    public static Path pathFor(Path resultDir, String regionId) {
        return resultDir.resolve(regionId + EXTENSION);
    }

    /**
     * Writes the file for one region. The content lands under a temporary name
     * and is moved into place, so a present file is always complete.
     */
    public static Path write(Path resultDir, String regionId, int totalInRegion, List<ResultRecord> records)
            throws IOException {
        var sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(ResultRecord::rasterId));

        var lines = new ArrayList<String>(sorted.size() + 2);
        lines.add(TOTAL_PREFIX + " " + totalInRegion);
        lines.add(COLUMNS);
        for (var record : sorted) {
            lines.add(record.rasterId() + " " + record.passing());
        }

        Path target = pathFor(resultDir, regionId);
        Path temp = resultDir.resolve(regionId + EXTENSION + ".partial");
        Files.write(temp, lines);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    public static List<ResultRecord> read(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file);
        } catch (IOException e) {
            throw new ArtifactParseException(file, "cannot read result file", e);
        }
        if (lines.isEmpty() || !lines.get(0).startsWith(TOTAL_PREFIX)) {
            throw new ArtifactParseException(file, "missing '" + TOTAL_PREFIX + "' line");
        }
        String regionId = RegionReader.regionId(file);
        int total = parseInt(file, lines.get(0).substring(TOTAL_PREFIX.length()).strip());

        var records = new ArrayList<ResultRecord>();
        for (String line : lines.subList(Math.min(2, lines.size()), lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.strip().split("\\s+");
            if (parts.length != 2) {
                throw new ArtifactParseException(file, "bad row: " + line);
            }
            records.add(new ResultRecord(regionId, parts[0], total, parseInt(file, parts[1])));
        }
        return records;
    }

    private static int parseInt(Path file, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ArtifactParseException(file, "bad integer: " + value, e);
        }
    }
}
