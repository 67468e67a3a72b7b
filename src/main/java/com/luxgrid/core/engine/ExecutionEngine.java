package com.luxgrid.core.engine;

import com.luxgrid.core.events.EventBus;
import com.luxgrid.core.events.PipelineEvent;
import com.luxgrid.core.logging.MdcContext;
import com.luxgrid.core.metrics.LuxgridMetrics;
import com.luxgrid.core.model.Job;
import com.luxgrid.core.model.JobResult;
import com.luxgrid.core.model.Phase;
import com.luxgrid.core.model.PhaseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs the jobs of one phase on a fixed pool of worker threads, one OS process
 * per job.
 *
 * <p>Each worker blocks on its process, so the pool size is the upper bound on
 * concurrently running processes. A job that exits non-zero or cannot be
 * launched is recorded as failed; its siblings keep running. Results come back
 * in completion order.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final InvocationBuilder invocations;
    private final ProcessLauncher launcher;
    private final EventBus eventBus;
    private final LuxgridMetrics metrics;

    @Autowired
    public ExecutionEngine(InvocationBuilder invocations, ProcessLauncher launcher,
                           EventBus eventBus, LuxgridMetrics metrics) {
        this.invocations = invocations;
        this.launcher = launcher;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    ExecutionEngine(InvocationBuilder invocations, ProcessLauncher launcher) {
        this(invocations, launcher, new EventBus(), null);
    }

    /**
     * Runs every job with at most {@code workerCount} processes alive at once.
     *
     * @param runId run identifier used for events and log context
     */
    public PhaseOutcome run(String runId, Phase phase, List<Job> jobs, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, was " + workerCount);
        }
        long startMs = System.currentTimeMillis();
        if (jobs.isEmpty()) {
            return new PhaseOutcome(phase, List.of(), 0, 0);
        }

        int poolSize = Math.min(workerCount, jobs.size());
        log.info("Running {} {} jobs on {} workers", jobs.size(), phase.label(), poolSize);

        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreads(phase));
        var results = new ArrayList<JobResult>(jobs.size());
        try {
            var completion = new ExecutorCompletionService<JobResult>(pool);
            for (var job : jobs) {
                completion.submit(() -> runOne(runId, phase, job));
            }
            for (int i = 0; i < jobs.size(); i++) {
                results.add(completion.take().get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} jobs; {} of {} collected",
                    phase.label(), results.size(), jobs.size());
            var collected = results.stream().map(JobResult::job).collect(Collectors.toSet());
            long elapsedMs = System.currentTimeMillis() - startMs;
            for (var job : jobs) {
                if (!collected.contains(job)) {
                    results.add(JobResult.launchFailed(job, "Interrupted", elapsedMs));
                }
            }
        } catch (ExecutionException e) {
            // runOne converts every failure into a result, so this is a programming error
            throw new IllegalStateException("Worker failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
        }

        var outcome = new PhaseOutcome(phase, List.copyOf(results), 0, System.currentTimeMillis() - startMs);
        log.info("{} finished: {} succeeded, {} failed", phase.label(), outcome.succeeded(), outcome.failed());
        return outcome;
    }

    private JobResult runOne(String runId, Phase phase, Job job) {
        MdcContext.setJob(runId, phase.label(), job.id());
        long startMs = System.currentTimeMillis();
        eventBus.publish(PipelineEvent.of("job.started", runId, job.id(),
                Map.of("phase", phase.label(), "output", job.output().toString())));
        JobResult result;
        try {
            var invocation = invocations.build(job);
            int exitCode = launcher.launch(invocation, pct -> eventBus.publish(
                    PipelineEvent.of("job.progress", runId, job.id(), Map.of("percent", pct))));
            result = JobResult.completed(job, exitCode, System.currentTimeMillis() - startMs);
            if (!result.success()) {
                log.error("Job {} exited with code {}", job.id(), exitCode);
            }
        } catch (IOException e) {
            var failure = new JobExecutionException("Failed to launch " + job.id() + ": " + e.getMessage(), e);
            log.error(failure.getMessage(), failure);
            result = JobResult.launchFailed(job, failure.getMessage(), System.currentTimeMillis() - startMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = JobResult.launchFailed(job, "Interrupted", System.currentTimeMillis() - startMs);
        } finally {
            MdcContext.clear();
        }

        if (metrics != null) {
            metrics.recordJob(phase, result.success(), result.elapsedMs());
        }
        eventBus.publish(PipelineEvent.of(result.success() ? "job.completed" : "job.failed", runId, job.id(),
                Map.of("phase", phase.label(), "exitCode", result.exitCode(), "elapsedMs", result.elapsedMs())));
        return result;
    }

    private static ThreadFactory workerThreads(Phase phase) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, phase.label() + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
