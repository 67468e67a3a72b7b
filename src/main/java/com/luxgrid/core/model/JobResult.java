package com.luxgrid.core.model;

/**
 * Outcome of one job.
 *
 * @param exitCode process exit code, or -1 when the process could not be launched
 * @param message  short exit description (launch error text, or "exit N")
 */
public record JobResult(Job job, boolean success, int exitCode, String message, long elapsedMs) {

    public static JobResult completed(Job job, int exitCode, long elapsedMs) {
        return new JobResult(job, exitCode == 0, exitCode, "exit " + exitCode, elapsedMs);
    }

    public static JobResult launchFailed(Job job, String message, long elapsedMs) {
        return new JobResult(job, false, -1, message, elapsedMs);
    }
}
