package com.luxgrid.core.raster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-worker memo of decoded rasters.
 *
 * <p>Each artifact is decoded at most once while it stays resident. Artifacts
 * that failed to decode are remembered and never retried. Not thread-safe:
 * every group task owns its own instance.
 */
public class RasterCache {

    private static final Logger log = LoggerFactory.getLogger(RasterCache.class);

    public static final int DEFAULT_CAPACITY = 4;

    private final RasterDecoder decoder;
    private final Map<Path, Raster> resident;
    private final Set<Path> failed = new HashSet<>();
    private int decodeCount;

    public RasterCache(RasterDecoder decoder) {
        this(decoder, DEFAULT_CAPACITY);
    }

    public RasterCache(RasterDecoder decoder, int capacity) {
        this.decoder = decoder;
        this.resident = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Path, Raster> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * @return the decoded raster, or empty if the artifact cannot be decoded
     */
    public Optional<Raster> get(Path artifact) {
        if (failed.contains(artifact)) {
            return Optional.empty();
        }
        Raster cached = resident.get(artifact);
        if (cached != null) {
            return Optional.of(cached);
        }
        decodeCount++;
        try {
            Raster raster = decoder.decode(artifact);
            resident.put(artifact, raster);
            return Optional.of(raster);
        } catch (ArtifactParseException e) {
            log.warn("Skipping raster {}", e.getMessage());
            failed.add(artifact);
            return Optional.empty();
        }
    }

    public int decodeCount() {
        return decodeCount;
    }

    public Set<Path> failures() {
        return Set.copyOf(failed);
    }
}
