package com.luxgrid.core.engine;

import java.nio.file.Path;
import java.util.List;

/**
 * A concrete process launch for one job.
 *
 * @param command      argv, executable first; never passed through a shell
 * @param stdoutTarget file receiving the process's standard output, or {@code null} to discard it
 * @param staging      scratch copy to create before launch and remove afterwards, or {@code null}
 */
public record Invocation(List<String> command, Path stdoutTarget, StagingCopy staging) {

    public Invocation {
        command = List.copyOf(command);
    }

    public record StagingCopy(Path source, Path copy) {}
}
