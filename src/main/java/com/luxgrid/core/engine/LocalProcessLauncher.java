package com.luxgrid.core.engine;

import com.luxgrid.core.config.LuxgridProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.DoubleConsumer;

/**
 * Launches invocations as local OS processes.
 *
 * <p>Standard output is redirected straight to the target file. With atomic
 * outputs enabled it goes to {@code <target>.partial} first and is moved onto
 * the target only when the process exits 0, so an interrupted render never
 * leaves a file the idempotent filter would accept. Standard error is read
 * line by line for progress markers.
 */
@Component
public class LocalProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    static final String PARTIAL_SUFFIX = ".partial";

    private final String raypath;
    private final boolean atomicOutputs;

    @Autowired
    public LocalProcessLauncher(LuxgridProperties properties) {
        this(properties.getToolchain().getRaypath(), properties.getToolchain().isAtomicOutputs());
    }

    LocalProcessLauncher(String raypath, boolean atomicOutputs) {
        this.raypath = raypath == null ? "" : raypath;
        this.atomicOutputs = atomicOutputs;
    }

    @Override
    public int launch(Invocation invocation, DoubleConsumer progress) throws IOException, InterruptedException {
        var staging = invocation.staging();
        if (staging != null) {
            Files.copy(staging.source(), staging.copy(), StandardCopyOption.REPLACE_EXISTING);
        }
        try {
            return runProcess(invocation, progress);
        } finally {
            if (staging != null) {
                Files.deleteIfExists(staging.copy());
            }
        }
    }

    private int runProcess(Invocation invocation, DoubleConsumer progress) throws IOException, InterruptedException {
        Path target = invocation.stdoutTarget();
        Path written = target != null && atomicOutputs ? partialPath(target) : target;

        var builder = new ProcessBuilder(invocation.command());
        if (!raypath.isBlank()) {
            builder.environment().put("RAYPATH", raypath);
        }
        if (written != null) {
            builder.redirectOutput(written.toFile());
        } else {
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }

        log.debug("Running: {}", String.join(" ", invocation.command()));
        var process = builder.start();

        try (var reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                ProgressParser.parse(line).ifPresent(progress::accept);
                log.debug("{}: {}", invocation.command().get(0), line);
            }
        }

        int exitCode = process.waitFor();
        if (exitCode == 0 && written != null && !written.equals(target)) {
            moveIntoPlace(written, target);
        }
        return exitCode;
    }

    static Path partialPath(Path target) {
        return target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);
    }

    private static void moveIntoPlace(Path partial, Path target) throws IOException {
        try {
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
