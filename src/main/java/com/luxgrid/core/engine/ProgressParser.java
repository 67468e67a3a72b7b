package com.luxgrid.core.engine;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Extracts completion percentages from tool progress lines such as
 * {@code "0.02 hours: 12.50% done after 0.0100 CPU hours"}.
 */
public final class ProgressParser {

    private static final Pattern PERCENT = Pattern.compile("(\\d{1,3}(?:\\.\\d+)?)%");

    private ProgressParser() {}

    public static OptionalDouble parse(String line) {
        if (line == null) {
            return OptionalDouble.empty();
        }
        var matcher = PERCENT.matcher(line);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(matcher.group(1));
        return value <= 100.0 ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
