package com.luxgrid.core.engine;

import com.luxgrid.core.LuxgridException;
import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.events.EventBus;
import com.luxgrid.core.events.PipelineEvent;
import com.luxgrid.core.logging.MdcContext;
import com.luxgrid.core.metrics.LuxgridMetrics;
import com.luxgrid.core.model.BaseScene;
import com.luxgrid.core.model.Job;
import com.luxgrid.core.model.LightingCondition;
import com.luxgrid.core.model.Phase;
import com.luxgrid.core.model.PhaseOutcome;
import com.luxgrid.core.model.Viewpoint;
import com.luxgrid.core.planner.IdempotentFilter;
import com.luxgrid.core.planner.JobPlanner;
import com.luxgrid.core.planner.PlanningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.ToIntFunction;

/**
 * Runs the render phases strictly in order: scene compile, ambient warm,
 * condition compile, render, composite, convert.
 *
 * <p>Each phase is planned, filtered against existing outputs, then executed
 * with its own worker count. A phase with failures does not stop the run;
 * dependent jobs in later phases fail on their missing inputs and are retried
 * by the next invocation.
 */
@Service
public class RenderPipeline {

    private static final Logger log = LoggerFactory.getLogger(RenderPipeline.class);

    private final JobPlanner planner;
    private final IdempotentFilter filter;
    private final ExecutionEngine engine;
    private final EventBus eventBus;
    private final LuxgridMetrics metrics;
    private final ToIntFunction<Phase> workers;
    private final List<Path> outputDirs;
    private final LuxgridProperties.Render render;

    @Autowired
    public RenderPipeline(JobPlanner planner, IdempotentFilter filter, ExecutionEngine engine,
                          EventBus eventBus, LuxgridMetrics metrics, LuxgridProperties properties) {
        this(planner, filter, engine, eventBus, metrics, properties::workersFor,
                List.of(properties.getSceneDir(), properties.getImageDir()), properties.getRender());
    }

    RenderPipeline(JobPlanner planner, IdempotentFilter filter, ExecutionEngine engine,
                   EventBus eventBus, LuxgridMetrics metrics, ToIntFunction<Phase> workers,
                   List<Path> outputDirs, LuxgridProperties.Render render) {
        this.planner = planner;
        this.filter = filter;
        this.engine = engine;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.workers = workers;
        this.outputDirs = outputDirs;
        this.render = render;
    }

    public PipelineReport run(BaseScene scene, List<LightingCondition> conditions, List<Viewpoint> viewpoints) {
        return run(scene, conditions, viewpoints, false);
    }

    /**
     * @param dryRun plan and filter only; the report lists the pending jobs per phase
     * @throws PlanningException on invalid inputs, before anything is launched
     */
    public PipelineReport run(BaseScene scene, List<LightingCondition> conditions,
                              List<Viewpoint> viewpoints, boolean dryRun) {
        if (render.getImageWidth() <= 0 || render.getImageHeight() <= 0 || render.getOvertureRes() <= 0) {
            throw new PlanningException("Render resolution must be positive, was %dx%d (overture %d)"
                    .formatted(render.getImageWidth(), render.getImageHeight(), render.getOvertureRes()));
        }
        List<Job> plan = planner.plan(scene, conditions, viewpoints);

        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        try {
            if (!dryRun) {
                createOutputDirs();
            }
            eventBus.publish(PipelineEvent.of("run.started", runId, null,
                    Map.of("jobs", plan.size(), "dryRun", dryRun)));

            var outcomes = new ArrayList<PhaseOutcome>();
            var pending = new EnumMap<Phase, List<Job>>(Phase.class);
            var timings = new PhaseTimings();

            for (Phase phase : Phase.values()) {
                List<Job> phaseJobs = plan.stream().filter(job -> job.phase() == phase).toList();
                List<Job> toRun = filter.filter(phaseJobs);
                int skipped = phaseJobs.size() - toRun.size();
                pending.put(phase, toRun);

                if (dryRun) {
                    outcomes.add(new PhaseOutcome(phase, List.of(), skipped, 0));
                    continue;
                }
                outcomes.add(runPhase(runId, phase, toRun, skipped, timings));
            }

            var report = new PipelineReport(runId, List.copyOf(outcomes), pending, timings, dryRun);
            eventBus.publish(PipelineEvent.of("run.completed", runId, null,
                    Map.of("succeeded", report.totalSucceeded(), "failed", report.totalFailed(),
                           "skipped", report.totalSkipped())));
            log.info("Run {} complete: {} succeeded, {} failed, {} skipped in {} ms",
                    runId, report.totalSucceeded(), report.totalFailed(), report.totalSkipped(),
                    timings.totalMs());
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private PhaseOutcome runPhase(String runId, Phase phase, List<Job> jobs, int skipped, PhaseTimings timings) {
        MdcContext.setPhase(runId, phase.label());
        int workerCount = workers.applyAsInt(phase);
        eventBus.publish(PipelineEvent.of("phase.started", runId, null,
                Map.of("phase", phase.label(), "jobs", jobs.size(), "skipped", skipped, "workers", workerCount)));

        PhaseOutcome executed = engine.run(runId, phase, jobs, workerCount);
        var outcome = new PhaseOutcome(phase, executed.results(), skipped, executed.elapsedMs());
        timings.record(phase, outcome.elapsedMs());

        if (metrics != null) {
            metrics.recordPhaseDuration(phase, outcome.elapsedMs());
            metrics.recordSkipped(phase, skipped);
        }
        if (outcome.hasFailures()) {
            log.warn("Phase {} had {} failed jobs; continuing", phase.label(), outcome.failed());
        }
        eventBus.publish(PipelineEvent.of("phase.completed", runId, null,
                Map.of("phase", phase.label(), "succeeded", outcome.succeeded(),
                       "failed", outcome.failed(), "elapsedMs", outcome.elapsedMs())));
        return outcome;
    }

    private void createOutputDirs() {
        for (Path dir : outputDirs) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new LuxgridException("Cannot create output directory " + dir, e);
            }
        }
    }
}
