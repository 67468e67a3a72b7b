package com.luxgrid.core.raster;

import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Camera framing taken from a raster's {@code VIEW=} header line.
 *
 * @param type view type letter from {@code -vt?} ({@code v} perspective, {@code l} parallel, ...)
 * @param vh   horizontal view size: degrees, or world units for parallel views
 * @param vv   vertical view size: degrees, or world units for parallel views
 */
public record ViewFraming(char type, double vpX, double vpY, double vpZ, double vh, double vv) {

    private static final String NUM = "([-+]?\\d*\\.?\\d+(?:[eE][-+]?\\d+)?)";
    private static final Pattern TYPE = Pattern.compile("-vt([a-z])");
    private static final Pattern VP = Pattern.compile("-vp\\s+" + NUM + "\\s+" + NUM + "\\s+" + NUM);
    private static final Pattern VH = Pattern.compile("-vh\\s+" + NUM);
    private static final Pattern VV = Pattern.compile("-vv\\s+" + NUM);

    /**
     * Parses the view options. Later occurrences of an option win, as they do
     * for Radiance itself.
     *
     * @throws IllegalArgumentException if {@code -vp}, {@code -vh} or {@code -vv} is missing
     */
    public static ViewFraming parse(String viewOptions) {
        Matcher type = TYPE.matcher(viewOptions);
        char viewType = 'v';
        while (type.find()) {
            viewType = type.group(1).charAt(0);
        }
        MatchResult vp = last(VP, viewOptions, "-vp");
        double x = Double.parseDouble(vp.group(1));
        double y = Double.parseDouble(vp.group(2));
        double z = Double.parseDouble(vp.group(3));
        double vh = Double.parseDouble(last(VH, viewOptions, "-vh").group(1));
        double vv = Double.parseDouble(last(VV, viewOptions, "-vv").group(1));
        return new ViewFraming(viewType, x, y, z, vh, vv);
    }

    /** Width in metres of the area the view covers at floor level. */
    public double worldWidth() {
        return extent(vh);
    }

    public double worldHeight() {
        return extent(vv);
    }

    private double extent(double size) {
        if (type == 'l') {
            return size;
        }
        return 2 * vpZ * Math.tan(Math.toRadians(size) / 2);
    }

    private static MatchResult last(Pattern pattern, String input, String option) {
        Matcher m = pattern.matcher(input);
        MatchResult found = null;
        while (m.find()) {
            found = m.toMatchResult();
        }
        if (found == null) {
            throw new IllegalArgumentException("View has no " + option + " option");
        }
        return found;
    }
}
