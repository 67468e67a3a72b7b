package com.luxgrid.core.engine;

import com.luxgrid.core.events.EventBus;
import com.luxgrid.core.events.PipelineEvent;
import com.luxgrid.core.metrics.LuxgridMetrics;
import com.luxgrid.core.model.ConvertJob;
import com.luxgrid.core.model.Job;
import com.luxgrid.core.model.Phase;
import com.luxgrid.core.model.PhaseOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ExecutionEngineTest {

    private InvocationBuilder invocations;

    @BeforeEach
    void setUp() {
        invocations = mock(InvocationBuilder.class);
    }

    private static List<Job> jobs(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> (Job) new ConvertJob(Path.of("in" + i + ".hdr"), Path.of("out" + i + ".tiff")))
                .toList();
    }

    @Test
    @DisplayName("one failing process does not affect its siblings")
    @DisabledOnOs(OS.WINDOWS)
    void failureIsolation() {
        when(invocations.build(any())).thenAnswer(call -> {
            Job job = call.getArgument(0);
            String script = job.output().toString().equals("out2.tiff") ? "exit 3" : "exit 0";
            return new Invocation(List.of("/bin/sh", "-c", script), null, null);
        });
        var engine = new ExecutionEngine(invocations, new LocalProcessLauncher("", true));

        var outcome = engine.run("run-1", Phase.CONVERT, jobs(5), 3);

        assertEquals(5, outcome.results().size());
        assertEquals(4, outcome.succeeded());
        assertEquals(1, outcome.failed());
        var failed = outcome.results().stream().filter(r -> !r.success()).findFirst().orElseThrow();
        assertEquals(3, failed.exitCode());
        assertEquals(Path.of("out2.tiff"), failed.job().output());
    }

    @Test
    @DisplayName("a launch error is recorded as a failed result with exit -1")
    void launchFailure() {
        when(invocations.build(any())).thenReturn(new Invocation(List.of("tool"), null, null));
        ProcessLauncher launcher = (invocation, progress) -> {
            throw new IOException("tool: not found");
        };
        var engine = new ExecutionEngine(invocations, launcher);

        var outcome = engine.run("run-1", Phase.CONVERT, jobs(2), 2);

        assertEquals(2, outcome.failed());
        assertTrue(outcome.results().stream().allMatch(r -> r.exitCode() == -1));
        assertTrue(outcome.results().get(0).message().contains("not found"));
    }

    @Test
    @DisplayName("jobs left uncollected by an interrupt count as failed")
    void interruptedPhaseAccountsForEveryJob() {
        when(invocations.build(any())).thenReturn(new Invocation(List.of("tool"), null, null));
        var release = new CountDownLatch(1);
        ProcessLauncher launcher = (invocation, progress) -> {
            release.await();
            return 0;
        };
        var engine = new ExecutionEngine(invocations, launcher);

        Thread.currentThread().interrupt();
        PhaseOutcome outcome;
        try {
            outcome = engine.run("run-1", Phase.CONVERT, jobs(3), 1);
        } finally {
            Thread.interrupted();
            release.countDown();
        }

        assertEquals(3, outcome.results().size());
        assertEquals(3, outcome.failed());
        assertTrue(outcome.results().stream().allMatch(r -> r.message().equals("Interrupted")));
    }

    @Test
    @DisplayName("never more than workerCount processes run at once")
    void boundedConcurrency() {
        when(invocations.build(any())).thenReturn(new Invocation(List.of("tool"), null, null));
        var active = new AtomicInteger();
        var peak = new AtomicInteger();
        ProcessLauncher launcher = (invocation, progress) -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(30);
            active.decrementAndGet();
            return 0;
        };
        var engine = new ExecutionEngine(invocations, launcher);

        var outcome = engine.run("run-1", Phase.RENDER, jobs(12), 3);

        assertEquals(12, outcome.succeeded());
        assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
    }

    @Test
    @DisplayName("empty job list returns an empty outcome without a pool")
    void emptyJobs() {
        var engine = new ExecutionEngine(invocations, (invocation, progress) -> 0);

        var outcome = engine.run("run-1", Phase.RENDER, List.of(), 4);

        assertTrue(outcome.results().isEmpty());
        assertFalse(outcome.hasFailures());
    }

    @Test
    @DisplayName("worker count below one is rejected")
    void invalidWorkerCount() {
        var engine = new ExecutionEngine(invocations, (invocation, progress) -> 0);
        assertThrows(IllegalArgumentException.class, () -> engine.run("run-1", Phase.RENDER, jobs(1), 0));
    }

    @Test
    @DisplayName("publishes job lifecycle events and records metrics")
    void eventsAndMetrics() {
        when(invocations.build(any())).thenReturn(new Invocation(List.of("tool"), null, null));
        var bus = new EventBus();
        var events = new CopyOnWriteArrayList<PipelineEvent>();
        bus.subscribe("run-7", events::add);
        var registry = new SimpleMeterRegistry();
        ProcessLauncher launcher = (invocation, progress) -> {
            progress.accept(50.0);
            return 0;
        };
        var engine = new ExecutionEngine(invocations, launcher, bus, new LuxgridMetrics(registry));

        engine.run("run-7", Phase.COMPOSITE, jobs(1), 1);

        var types = new ArrayList<String>();
        events.forEach(e -> types.add(e.eventType()));
        assertEquals(List.of("job.started", "job.progress", "job.completed"), types);
        assertEquals(1.0, registry.find("luxgrid.jobs.total")
                .tag("phase", "composite").tag("result", "succeeded").counter().count());
    }
}
