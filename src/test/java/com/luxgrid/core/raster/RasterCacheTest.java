package com.luxgrid.core.raster;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RasterCacheTest {

    private RasterDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = mock(RasterDecoder.class);
    }

    private Path stub(String name) {
        Path path = Path.of(name + ".hdr");
        when(decoder.decode(path)).thenReturn(new Raster(name, path, 1, 1, new float[]{1f}));
        return path;
    }

    @Test
    @DisplayName("repeated lookups decode once")
    void decodesOnce() {
        Path a = stub("a");
        var cache = new RasterCache(decoder);

        var first = cache.get(a).orElseThrow();
        var second = cache.get(a).orElseThrow();

        assertSame(first, second);
        assertEquals(1, cache.decodeCount());
        verify(decoder, times(1)).decode(a);
    }

    @Test
    @DisplayName("failed artifacts are remembered and not retried")
    void remembersFailures() {
        Path bad = Path.of("bad.hdr");
        when(decoder.decode(bad)).thenThrow(new ArtifactParseException(bad, "truncated"));
        var cache = new RasterCache(decoder);

        assertTrue(cache.get(bad).isEmpty());
        assertTrue(cache.get(bad).isEmpty());

        verify(decoder, times(1)).decode(bad);
        assertEquals(Set.of(bad), cache.failures());
    }

    @Test
    @DisplayName("least recently used raster is evicted past capacity")
    void evictsLeastRecentlyUsed() {
        Path a = stub("a");
        Path b = stub("b");
        Path c = stub("c");
        var cache = new RasterCache(decoder, 2);

        cache.get(a);
        cache.get(b);
        cache.get(a);
        cache.get(c);
        cache.get(a);
        cache.get(b);

        verify(decoder, times(1)).decode(a);
        verify(decoder, times(2)).decode(b);
        assertEquals(4, cache.decodeCount());
    }
}
