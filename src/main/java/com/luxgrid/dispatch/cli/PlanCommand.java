package com.luxgrid.dispatch.cli;

import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.engine.RenderPipeline;
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
 * CLI command: luxgrid plan --scene model_skyless.oct --ambient-sky overcast.sky
 * <p>
 * Dry run of {@code render}: shows, per phase, how many jobs would be launched
 * and how many are already done.
 */
@Command(name = "plan", mixinStandardHelpOptions = true,
        description = "Show the jobs a render would launch without running them")
@Component
public class PlanCommand implements Callable<Integer> {

    @Option(names = {"--scene", "-s"}, required = true, description = "Skyless scene octree")
    private Path scene;

    @Option(names = {"--ambient-sky", "-a"}, required = true, description = "Overcast sky descriptor")
    private Path ambientSky;

    @Option(names = "--sky-dir", description = "Lighting-condition descriptors (*.sky)")
    private Path skyDir;

    @Option(names = "--view-dir", description = "Viewpoint descriptors (*.vp)")
    private Path viewDir;

    @Option(names = {"--verbose", "-v"}, description = "List every pending job")
    private boolean verbose;

    private final DescriptorScanner scanner;
    private final RenderPipeline pipeline;
    private final LuxgridProperties properties;

    public PlanCommand(DescriptorScanner scanner, RenderPipeline pipeline, LuxgridProperties properties) {
        this.scanner = scanner;
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var conditions = scanner.scanConditions(skyDir != null ? skyDir : properties.getSkyDir());
            var viewpoints = scanner.scanViewpoints(viewDir != null ? viewDir : properties.getViewDir());
            var report = pipeline.run(new BaseScene(scene, ambientSky), conditions, viewpoints, true);

            for (var outcome : report.outcomes()) {
                var pending = report.pending().get(outcome.phase());
                ConsoleOutput.phase(outcome.phase().label(), pending.size(), outcome.skipped(),
                        properties.workersFor(outcome.phase()));
                if (verbose) {
                    pending.forEach(job -> System.out.println("    " + job.output()));
                }
            }
            return 0;
        } catch (PlanningException e) {
            ConsoleOutput.error("Planning failed: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read descriptors: " + e.getMessage());
            return 1;
        }
    }
}
