package com.luxgrid.core.aggregate;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one aggregation pass.
 *
 * @param skippedRegions   regions whose result file already existed
 * @param unmatchedRasters rasters whose file name matched no region's view
 * @param unmatchedViews   views that have regions but no rasters
 */
public record AggregationSummary(List<GroupResult> results, List<String> skippedRegions,
                                 List<Path> unmatchedRasters, List<String> unmatchedViews) {

    public int filesWritten() {
        return results.stream().mapToInt(r -> r.written().size()).sum();
    }

    public int failedGroups() {
        return (int) results.stream().filter(r -> !r.succeeded()).count();
    }

    public int totalDecodes() {
        return results.stream().mapToInt(GroupResult::decodeCount).sum();
    }
}
