package com.luxgrid.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Luxgrid.
 * Routes to subcommands: render, plan, aggregate, report, daylight, health.
 */
@Command(
        name = "luxgrid",
        mixinStandardHelpOptions = true,
        version = "Luxgrid 0.1.0",
        description = "Batch Radiance rendering and per-zone sunlight aggregation",
        subcommands = {
                RenderCommand.class,
                PlanCommand.class,
                AggregateCommand.class,
                ReportCommand.class,
                DaylightCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LuxgridCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
