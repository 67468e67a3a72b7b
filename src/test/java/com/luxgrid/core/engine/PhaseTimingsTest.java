package com.luxgrid.core.engine;

import com.luxgrid.core.model.Phase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhaseTimingsTest {

    @Test
    @DisplayName("accumulates per phase and in total")
    void accumulates() {
        var timings = new PhaseTimings();
        timings.record(Phase.RENDER, 100);
        timings.record(Phase.RENDER, 50);
        timings.record(Phase.CONVERT, 25);

        assertEquals(150, timings.elapsedMs(Phase.RENDER));
        assertEquals(0, timings.elapsedMs(Phase.COMPOSITE));
        assertEquals(175, timings.totalMs());
        assertThrows(UnsupportedOperationException.class, () -> timings.asMap().clear());
    }
}
