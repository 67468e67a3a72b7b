package com.luxgrid.core.engine;

import com.luxgrid.core.model.Job;
import com.luxgrid.core.model.Phase;
import com.luxgrid.core.model.PhaseOutcome;

import java.util.List;
import java.util.Map;

/**
 * Result of one pipeline run.
 *
 * @param outcomes per-phase outcomes in execution order
 * @param pending  jobs that were (dry run) or would have been launched, per phase
 * @param dryRun   true when nothing was launched
 */
public record PipelineReport(String runId, List<PhaseOutcome> outcomes, Map<Phase, List<Job>> pending,
                             PhaseTimings timings, boolean dryRun) {

    public int totalSucceeded() {
        return outcomes.stream().mapToInt(PhaseOutcome::succeeded).sum();
    }

    public int totalFailed() {
        return outcomes.stream().mapToInt(PhaseOutcome::failed).sum();
    }

    public int totalSkipped() {
        return outcomes.stream().mapToInt(PhaseOutcome::skipped).sum();
    }

    public boolean hasFailures() {
        return totalFailed() > 0;
    }
}
