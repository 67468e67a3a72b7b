package com.luxgrid.core.model;

import java.util.List;

/**
 * Aggregate outcome of one phase: the results of every job that was launched,
 * in completion order, plus the number of jobs the idempotent filter skipped.
 */
public record PhaseOutcome(Phase phase, List<JobResult> results, int skipped, long elapsedMs) {

    public int succeeded() {
        return (int) results.stream().filter(JobResult::success).count();
    }

    public int failed() {
        return results.size() - succeeded();
    }

    public boolean hasFailures() {
        return failed() > 0;
    }
}
