package com.luxgrid.core.health;

import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.engine.ToolResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private ToolResolver resolver;
    private LuxgridProperties properties;

    @BeforeEach
    void setUp() {
        resolver = mock(ToolResolver.class);
        properties = new LuxgridProperties();
        properties.getDirectories().setSkyDir(tempDir.resolve("sky").toString());
        properties.getDirectories().setViewDir(tempDir.resolve("view").toString());
        properties.getDirectories().setRegionDir(tempDir.resolve("aoi").toString());
    }

    private static HealthStatus find(List<HealthStatus> results, String component) {
        return results.stream().filter(s -> component.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Tools missing -> tools DOWN")
    void toolsMissing() {
        when(resolver.locate(anyString())).thenReturn(Optional.empty());

        var results = new HealthCheckService(resolver, properties).checkAll();

        assertEquals(HealthStatus.Status.DOWN, find(results, "rpict").status());
        assertEquals(HealthStatus.Status.DOWN, find(results, "pvalue").status());
    }

    @Test
    @DisplayName("Tools found -> UP with path metadata")
    void toolsFound() {
        when(resolver.locate(anyString())).thenAnswer(call -> Optional.of(Path.of("/usr/bin", call.<String>getArgument(0))));

        var oconv = find(new HealthCheckService(resolver, properties).checkAll(), "oconv");

        assertEquals(HealthStatus.Status.UP, oconv.status());
        assertEquals(Path.of("/usr/bin", "oconv").toString(), oconv.metadata().get("path"));
    }

    @Test
    @DisplayName("Missing descriptor directory -> DEGRADED, present -> UP")
    void directories() throws IOException {
        when(resolver.locate(anyString())).thenReturn(Optional.empty());
        Files.createDirectories(tempDir.resolve("sky"));

        var results = new HealthCheckService(resolver, properties).checkAll();

        assertEquals(HealthStatus.Status.UP, find(results, "sky-dir").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(results, "view-dir").status());
        assertEquals(HealthStatus.Status.DEGRADED, find(results, "region-dir").status());
    }

    @Test
    @DisplayName("checkAll reports every tool and directory")
    void checkAllComponents() {
        when(resolver.locate(anyString())).thenReturn(Optional.empty());

        var components = new HealthCheckService(resolver, properties).checkAll().stream()
                .map(HealthStatus::component).toList();

        assertEquals(List.of("oconv", "rpict", "pcomb", "ra_tiff", "pvalue", "sky-dir", "view-dir", "region-dir"),
                components);
    }
}
