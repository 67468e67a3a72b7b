package com.luxgrid.dispatch.cli;

import com.luxgrid.core.events.PipelineEvent;
import com.luxgrid.core.model.PhaseOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Luxgrid CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LUXGRID v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LUXGRID]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void phase(String label, int jobs, int skipped, int workers) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [" + label.toUpperCase() + "]|@ " + jobs + " job" + (jobs != 1 ? "s" : "")
                + " on " + workers + " worker" + (workers != 1 ? "s" : "")
                + (skipped > 0 ? ", " + skipped + " already done" : "")));
    }

    public static void phaseComplete(PhaseOutcome outcome) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) [" + outcome.phase().label().toUpperCase() + " COMPLETE]|@ "
                + "@|fg(green) " + outcome.succeeded() + " succeeded|@"
                + (outcome.failed() > 0 ? ", @|fg(red) " + outcome.failed() + " failed|@" : "")
                + " in " + formatDuration(outcome.elapsedMs())));
    }

    public static void jobFailed(String jobId, Object exitCode) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) FAILED|@ " + jobId + " (exit " + exitCode + ")"));
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case "group.completed" -> "@|fg(blue) [GROUP]|@";
            case "group.failed" -> "@|fg(red) [GROUP]|@";
            case "aggregation.started", "aggregation.completed" -> "@|bold,fg(yellow) [AGGREGATE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.jobId() != null ? event.jobId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + event.payload()));
    }

    public static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + (seconds % 3600 / 60) + "m";
    }
}
