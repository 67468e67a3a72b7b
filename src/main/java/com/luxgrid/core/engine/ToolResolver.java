package com.luxgrid.core.engine;

import com.luxgrid.core.config.LuxgridProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps a tool name to the executable handed to {@link ProcessBuilder}.
 * With a configured bin directory the name is prefixed by it; otherwise the
 * bare name is left for the operating system to resolve on {@code PATH}.
 */
@Component
public class ToolResolver {

    private final String binDir;
    private final String searchPath;

    @Autowired
    public ToolResolver(LuxgridProperties properties) {
        this(properties.getToolchain().getBinDir(), System.getenv("PATH"));
    }

    ToolResolver(String binDir, String searchPath) {
        this.binDir = binDir == null ? "" : binDir;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    public String executable(String tool) {
        return binDir.isBlank() ? tool : Path.of(binDir, tool).toString();
    }

    /**
     * Locates the tool on disk, checking the bin directory or each {@code PATH} entry.
     */
    public Optional<Path> locate(String tool) {
        if (!binDir.isBlank()) {
            Path candidate = Path.of(binDir, tool);
            return Files.isExecutable(candidate) ? Optional.of(candidate) : Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, tool);
            if (Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
