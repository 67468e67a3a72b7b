package com.luxgrid.core.engine;

import com.luxgrid.core.model.Phase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wall-clock time spent per phase during one run.
 */
public class PhaseTimings {

    private final EnumMap<Phase, Long> elapsed = new EnumMap<>(Phase.class);

    public void record(Phase phase, long elapsedMs) {
        elapsed.merge(phase, elapsedMs, Long::sum);
    }

    public long elapsedMs(Phase phase) {
        return elapsed.getOrDefault(phase, 0L);
    }

    public long totalMs() {
        return elapsed.values().stream().mapToLong(Long::longValue).sum();
    }

    public Map<Phase, Long> asMap() {
        return Collections.unmodifiableMap(elapsed);
    }
}
