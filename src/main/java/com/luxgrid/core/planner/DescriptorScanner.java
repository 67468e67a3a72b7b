package com.luxgrid.core.planner;

import com.luxgrid.core.model.LightingCondition;
import com.luxgrid.core.model.Viewpoint;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

/**
 * Discovers lighting-condition ({@code *.sky}) and viewpoint ({@code *.vp})
 * descriptors written by the upstream generators. Results are sorted by file
 * name so that planning order is stable across runs.
 */
@Service
public class DescriptorScanner {

    static final String CONDITION_SUFFIX = ".sky";
    static final String VIEWPOINT_SUFFIX = ".vp";

    public List<LightingCondition> scanConditions(Path skyDir) throws IOException {
        return scan(skyDir, CONDITION_SUFFIX, LightingCondition::of);
    }

    public List<Viewpoint> scanViewpoints(Path viewDir) throws IOException {
        return scan(viewDir, VIEWPOINT_SUFFIX, Viewpoint::of);
    }

    private <T> List<T> scan(Path dir, String suffix, Function<Path, T> factory) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new PlanningException("Descriptor directory not found: " + dir);
        }
        try (var stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .map(factory)
                    .toList();
        }
    }
}
