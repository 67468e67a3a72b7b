package com.luxgrid.dispatch.cli;

import com.luxgrid.core.LuxgridException;
import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.engine.PipelineReport;
import com.luxgrid.core.engine.RenderPipeline;
import com.luxgrid.core.events.EventBus;
import com.luxgrid.core.events.PipelineEvent;
import com.luxgrid.core.model.BaseScene;
import com.luxgrid.core.planner.DescriptorScanner;
import com.luxgrid.core.planner.PlanningException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: luxgrid render --scene model_skyless.oct --ambient-sky overcast.sky
 * <p>
 * Plans every job for the lighting conditions and viewpoints found on disk,
 * skips those whose outputs exist, and runs the rest phase by phase.
 */
@Command(name = "render", mixinStandardHelpOptions = true,
        description = "Render every lighting condition from every viewpoint")
@Component
public class RenderCommand implements Callable<Integer> {

    @Option(names = {"--scene", "-s"}, required = true, description = "Skyless scene octree")
    private Path scene;

    @Option(names = {"--ambient-sky", "-a"}, required = true, description = "Overcast sky descriptor")
    private Path ambientSky;

    @Option(names = "--sky-dir", description = "Lighting-condition descriptors (*.sky); defaults to luxgrid.directories.sky-dir")
    private Path skyDir;

    @Option(names = "--view-dir", description = "Viewpoint descriptors (*.vp); defaults to luxgrid.directories.view-dir")
    private Path viewDir;

    private final DescriptorScanner scanner;
    private final RenderPipeline pipeline;
    private final EventBus eventBus;
    private final LuxgridProperties properties;

    public RenderCommand(DescriptorScanner scanner, RenderPipeline pipeline, EventBus eventBus,
                         LuxgridProperties properties) {
        this.scanner = scanner;
        this.pipeline = pipeline;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var subscription = eventBus.subscribeAll(RenderCommand::onEvent);
        try {
            var conditions = scanner.scanConditions(skyDir != null ? skyDir : properties.getSkyDir());
            var viewpoints = scanner.scanViewpoints(viewDir != null ? viewDir : properties.getViewDir());
            ConsoleOutput.info(conditions.size() + " lighting conditions, " + viewpoints.size() + " viewpoints");

            PipelineReport report = pipeline.run(new BaseScene(scene, ambientSky), conditions, viewpoints);
            printSummary(report);
            return report.hasFailures() ? 1 : 0;
        } catch (PlanningException e) {
            ConsoleOutput.error("Planning failed: " + e.getMessage());
            return 2;
        } catch (IOException | LuxgridException e) {
            ConsoleOutput.error("Render failed: " + e.getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
    }

    private static void onEvent(PipelineEvent event) {
        var p = event.payload();
        switch (event.eventType()) {
            case "phase.started" -> ConsoleOutput.phase((String) p.get("phase"),
                    (Integer) p.get("jobs"), (Integer) p.get("skipped"), (Integer) p.get("workers"));
            case "job.failed" -> ConsoleOutput.jobFailed(event.jobId(), p.get("exitCode"));
            default -> { }
        }
    }

    static void printSummary(PipelineReport report) {
        System.out.println("──────────────────────────────────");
        for (var outcome : report.outcomes()) {
            ConsoleOutput.phaseComplete(outcome);
        }
        String totals = report.totalSucceeded() + " succeeded, " + report.totalFailed() + " failed, "
                + report.totalSkipped() + " skipped in " + ConsoleOutput.formatDuration(report.timings().totalMs());
        if (report.hasFailures()) {
            ConsoleOutput.error("Run " + report.runId() + ": " + totals + " (rerun to retry failed jobs)");
        } else {
            ConsoleOutput.success("Run " + report.runId() + ": " + totals);
        }
    }
}
