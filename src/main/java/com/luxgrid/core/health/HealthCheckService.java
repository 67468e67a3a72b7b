package com.luxgrid.core.health;

import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.engine.InvocationBuilder;
import com.luxgrid.core.engine.ToolResolver;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks that the external toolchain can be found and that the descriptor
 * directories the planner reads are in place.
 */
@Service
public class HealthCheckService {

    private final ToolResolver toolResolver;
    private final LuxgridProperties properties;

    public HealthCheckService(ToolResolver toolResolver, LuxgridProperties properties) {
        this.toolResolver = toolResolver;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        for (String tool : InvocationBuilder.TOOLS) {
            results.add(checkTool(tool));
        }
        results.add(checkDirectory("sky-dir", properties.getSkyDir()));
        results.add(checkDirectory("view-dir", properties.getViewDir()));
        results.add(checkDirectory("region-dir", properties.getRegionDir()));
        return results;
    }

    private HealthStatus checkTool(String tool) {
        return toolResolver.locate(tool)
                .map(path -> new HealthStatus(tool, HealthStatus.Status.UP,
                        "Found " + path, Map.of("path", path.toString())))
                .orElseGet(() -> new HealthStatus(tool, HealthStatus.Status.DOWN,
                        "Not found on " + (properties.getToolchain().getBinDir().isBlank()
                                ? "PATH" : properties.getToolchain().getBinDir()),
                        Map.of()));
    }

    // A missing input directory only limits what can be planned.
    private HealthStatus checkDirectory(String component, Path dir) {
        if (Files.isDirectory(dir)) {
            return new HealthStatus(component, HealthStatus.Status.UP, dir.toString(), Map.of());
        }
        return new HealthStatus(component, HealthStatus.Status.DEGRADED,
                "Directory missing: " + dir, Map.of());
    }
}
