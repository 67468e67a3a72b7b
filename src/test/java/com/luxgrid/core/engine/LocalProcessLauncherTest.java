package com.luxgrid.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class LocalProcessLauncherTest {

    @TempDir
    Path tempDir;

    private final List<Double> progress = new ArrayList<>();

    private static Invocation shell(String script, Path target) {
        return new Invocation(List.of("/bin/sh", "-c", script), target, null);
    }

    @Test
    @DisplayName("stdout lands on the target only after a clean exit")
    void successfulRunMovesPartialIntoPlace() throws Exception {
        var launcher = new LocalProcessLauncher("", true);
        Path target = tempDir.resolve("out.hdr");

        int exit = launcher.launch(shell("printf hello", target), progress::add);

        assertEquals(0, exit);
        assertEquals("hello", Files.readString(target));
        assertFalse(Files.exists(LocalProcessLauncher.partialPath(target)));
    }

    @Test
    @DisplayName("a failed process leaves no target behind")
    void failedRunLeavesNoTarget() throws Exception {
        var launcher = new LocalProcessLauncher("", true);
        Path target = tempDir.resolve("out.hdr");

        int exit = launcher.launch(shell("printf half; exit 2", target), progress::add);

        assertEquals(2, exit);
        assertFalse(Files.exists(target));
        assertEquals("half", Files.readString(LocalProcessLauncher.partialPath(target)));
    }

    @Test
    @DisplayName("without atomic outputs stdout is written straight to the target")
    void directOutput() throws Exception {
        var launcher = new LocalProcessLauncher("", false);
        Path target = tempDir.resolve("out.hdr");

        launcher.launch(shell("printf direct; exit 1", target), progress::add);

        assertEquals("direct", Files.readString(target));
    }

    @Test
    @DisplayName("progress markers on stderr are reported")
    void reportsProgress() throws Exception {
        var launcher = new LocalProcessLauncher("", true);

        launcher.launch(shell("echo '25.0% done' >&2; echo 'noise' >&2; echo '100.0% done' >&2", null),
                progress::add);

        assertEquals(List.of(25.0, 100.0), progress);
    }

    @Test
    @DisplayName("staging copy exists during the run and is removed afterwards")
    void stagingCopy() throws Exception {
        var launcher = new LocalProcessLauncher("", true);
        Path source = tempDir.resolve("scene.oct");
        Path copy = tempDir.resolve("scene_c1_temp.oct");
        Path target = tempDir.resolve("scene_c1.oct");
        Files.writeString(source, "octree-bytes");

        var inv = new Invocation(List.of("/bin/sh", "-c", "cat '" + copy + "'"), target,
                new Invocation.StagingCopy(source, copy));
        int exit = launcher.launch(inv, progress::add);

        assertEquals(0, exit);
        assertEquals("octree-bytes", Files.readString(target));
        assertFalse(Files.exists(copy));
        assertTrue(Files.exists(source));
    }

    @Test
    @DisplayName("RAYPATH is exported when configured")
    void exportsRaypath() throws Exception {
        var launcher = new LocalProcessLauncher("/usr/local/lib/ray", true);
        Path target = tempDir.resolve("env.txt");

        launcher.launch(shell("printf \"$RAYPATH\"", target), progress::add);

        assertEquals("/usr/local/lib/ray", Files.readString(target));
    }

    @Test
    @DisplayName("a missing executable surfaces as IOException")
    void missingExecutable() {
        var launcher = new LocalProcessLauncher("", true);
        var inv = new Invocation(List.of(tempDir.resolve("no-such-tool").toString()), null, null);

        assertThrows(IOException.class, () -> launcher.launch(inv, progress::add));
    }
}
