package com.luxgrid.core.daylight;

import com.luxgrid.core.aggregate.RegionReader;
import com.luxgrid.core.aggregate.ResultFile;
import com.luxgrid.core.raster.ArtifactParseException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per-region daylight file ({@code <region id>.wpd} in the daylight directory):
 * <pre>
 * total_pixels_in_polygon: 3
 * pixel_x pixel_y illuminance df_percent
 * 12 40 215.0000 2.1500
 * 13 40 198.5000 1.9850
 * 12 41 90.1000 0.9010
 * </pre>
 */
public final class DaylightFile {

    public static final String EXTENSION = ".wpd";
    static final String COLUMNS = "pixel_x pixel_y illuminance df_percent";

    public record Sample(int x, int y, double illuminance, double dfPercent) {}

    public record Contents(String regionId, int totalPixels, List<Sample> samples) {}

    private DaylightFile() {}

    public static Path pathFor(Path dir, String regionId) {
        return dir.resolve(regionId + EXTENSION);
    }

    public static Path write(Path dir, String regionId, List<Sample> samples) throws IOException {
        var lines = new ArrayList<String>(samples.size() + 2);
        lines.add(ResultFile.TOTAL_PREFIX + " " + samples.size());
        lines.add(COLUMNS);
        for (var s : samples) {
            lines.add(String.format(Locale.ROOT, "%d %d %.4f %.4f", s.x(), s.y(), s.illuminance(), s.dfPercent()));
        }

        Path target = pathFor(dir, regionId);
        Path temp = dir.resolve(regionId + EXTENSION + ".partial");
        Files.write(temp, lines);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    public static Contents read(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file);
        } catch (IOException e) {
            throw new ArtifactParseException(file, "cannot read daylight file", e);
        }
        if (lines.isEmpty() || !lines.get(0).startsWith(ResultFile.TOTAL_PREFIX)) {
            throw new ArtifactParseException(file, "missing '" + ResultFile.TOTAL_PREFIX + "' line");
        }
        int total;
        try {
            total = Integer.parseInt(lines.get(0).substring(ResultFile.TOTAL_PREFIX.length()).strip());
        } catch (NumberFormatException e) {
            throw new ArtifactParseException(file, "bad total: " + lines.get(0), e);
        }

        var samples = new ArrayList<Sample>();
        for (String line : lines.subList(Math.min(2, lines.size()), lines.size())) {
            String[] parts = line.strip().split("\\s+");
            if (parts.length != 4) {
                continue;
            }
            try {
                samples.add(new Sample(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]),
                        Double.parseDouble(parts[2]), Double.parseDouble(parts[3])));
            } catch (NumberFormatException e) {
                throw new ArtifactParseException(file, "bad row: " + line, e);
            }
        }
        return new Contents(RegionReader.regionId(file), total, List.copyOf(samples));
    }
}
