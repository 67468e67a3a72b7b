package com.luxgrid.core.aggregate;

import com.luxgrid.core.model.Region;
import com.luxgrid.core.raster.ArtifactParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses region (area of interest) files.
 *
 * <p>Header lines in order: label, associated view, reference elevation, an
 * optional {@code CENTRAL x,y:} line, and the vertex count. Each header line
 * may carry its descriptive prefix ({@code AOI Points File:},
 * {@code ASSOCIATED VIEW FILE:}, {@code FFL z height(m):},
 * {@code NO. PERIMETER POINTS n:}) or just the bare value. Vertex lines hold
 * either {@code px py} or {@code wx wy px py}; only pixel coordinates are kept.
 */
public final class RegionReader {

    private static final Logger log = LoggerFactory.getLogger(RegionReader.class);

    static final String LABEL_PREFIX = "AOI Points File:";
    static final String VIEW_PREFIX = "ASSOCIATED VIEW FILE:";
    static final String CENTRAL_PREFIX = "CENTRAL";
    static final String VIEW_SUFFIX = ".vp";

    private static final Pattern FIRST_INT = Pattern.compile("(\\d+)");

    private RegionReader() {}

    public static Region read(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file).stream()
                    .map(String::strip)
                    .filter(l -> !l.isEmpty())
                    .toList();
        } catch (IOException e) {
            throw new ArtifactParseException(file, "cannot read region file", e);
        }
        if (lines.size() < 4) {
            throw new ArtifactParseException(file, "region header needs 4 lines, found " + lines.size());
        }

        String label = valueAfter(lines.get(0), LABEL_PREFIX);
        String viewId = valueAfter(lines.get(1), VIEW_PREFIX);
        if (viewId.endsWith(VIEW_SUFFIX)) {
            viewId = viewId.substring(0, viewId.length() - VIEW_SUFFIX.length());
        }
        if (viewId.isBlank()) {
            throw new ArtifactParseException(file, "missing associated view");
        }
        double elevation = parseElevation(file, lines.get(2));

        int next = 3;
        if (lines.get(next).toUpperCase().startsWith(CENTRAL_PREFIX)) {
            next++;
        }
        if (next >= lines.size()) {
            throw new ArtifactParseException(file, "missing vertex count line");
        }
        int declared = parseCount(file, lines.get(next));

        var vertices = new ArrayList<Region.Vertex>();
        for (String line : lines.subList(next + 1, lines.size())) {
            vertices.add(parseVertex(file, line));
        }
        if (vertices.size() != declared) {
            throw new ArtifactParseException(file,
                    "declares " + declared + " vertices but lists " + vertices.size());
        }
        if (vertices.size() < 3) {
            throw new ArtifactParseException(file, "polygon needs at least 3 vertices, has " + vertices.size());
        }
        return new Region(regionId(file), label, viewId, elevation, vertices);
    }

    /**
     * Reads every region file, skipping malformed ones with a warning.
     */
    public static List<Region> readAll(List<Path> files) {
        var regions = new ArrayList<Region>();
        for (Path file : files) {
            try {
                regions.add(read(file));
            } catch (ArtifactParseException e) {
                log.warn("Skipping region {}", e.getMessage());
            }
        }
        return regions;
    }

    public static String regionId(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String valueAfter(String line, String prefix) {
        int at = line.toUpperCase().indexOf(prefix.toUpperCase());
        return at >= 0 ? line.substring(at + prefix.length()).strip() : line;
    }

    private static double parseElevation(Path file, String line) {
        String value = line.contains(":") ? line.substring(line.lastIndexOf(':') + 1).strip() : line;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ArtifactParseException(file, "bad elevation: " + line, e);
        }
    }

    private static int parseCount(Path file, String line) {
        var m = FIRST_INT.matcher(line);
        if (!m.find()) {
            throw new ArtifactParseException(file, "bad vertex count line: " + line);
        }
        return Integer.parseInt(m.group(1));
    }

    private static Region.Vertex parseVertex(Path file, String line) {
        String[] parts = line.split("\\s+");
        try {
            return switch (parts.length) {
                case 2 -> new Region.Vertex(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]));
                case 4 -> new Region.Vertex(Double.parseDouble(parts[2]), Double.parseDouble(parts[3]));
                default -> throw new ArtifactParseException(file, "vertex line needs 2 or 4 values: " + line);
            };
        } catch (NumberFormatException e) {
            throw new ArtifactParseException(file, "bad vertex line: " + line, e);
        }
    }
}
