package com.luxgrid.core.aggregate;

import com.luxgrid.core.model.Region;
import com.luxgrid.core.raster.ArtifactParseException;
import com.luxgrid.core.raster.Raster;
import com.luxgrid.core.raster.RasterCache;
import com.luxgrid.core.raster.RasterDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ViewGroupProcessorTest {

    @TempDir
    Path tempDir;

    private RasterDecoder decoder;
    private final Path morning = Path.of("m_v1_c_0900_combined.hdr");
    private final Path noon = Path.of("m_v1_c_1200_combined.hdr");

    private final List<Region> regions = List.of(
            square("A101", 0, 0, 1),
            square("A102", 2, 0, 1),
            square("A103", 0, 2, 1));

    @BeforeEach
    void setUp() {
        decoder = mock(RasterDecoder.class);
        // morning: only the top-left quadrant is lit; noon: everything is lit
        float[] quadrant = new float[16];
        quadrant[0] = quadrant[1] = quadrant[4] = quadrant[5] = 1f;
        float[] full = new float[16];
        Arrays.fill(full, 1f);
        when(decoder.decode(morning)).thenReturn(new Raster("m_v1_c_0900_combined", morning, 4, 4, quadrant));
        when(decoder.decode(noon)).thenReturn(new Raster("m_v1_c_1200_combined", noon, 4, 4, full));
    }

    private static Region square(String id, double x, double y, double size) {
        return new Region(id, id, "v1", 0.0, List.of(
                new Region.Vertex(x, y), new Region.Vertex(x + size, y),
                new Region.Vertex(x + size, y + size), new Region.Vertex(x, y + size)));
    }

    private GroupTask task(List<Path> rasters) {
        return new GroupTask("v1", "v1", rasters, regions, 0.5, tempDir);
    }

    @Test
    @DisplayName("each raster is decoded once for all regions")
    void decodesOncePerRaster() throws IOException {
        var cache = new RasterCache(decoder);

        var result = new ViewGroupProcessor(cache).process(task(List.of(noon, morning)));

        verify(decoder, times(1)).decode(morning);
        verify(decoder, times(1)).decode(noon);
        assertEquals(2, result.decodeCount());
        assertEquals(6, result.records().size());
        assertTrue(result.succeeded());
    }

    @Test
    @DisplayName("writes one result file per region with counts per raster")
    void writesResultFiles() throws IOException {
        var result = new ViewGroupProcessor(new RasterCache(decoder)).process(task(List.of(noon, morning)));

        assertEquals(3, result.written().size());
        assertEquals(List.of(
                "total_pixels_in_polygon: 4",
                "raster_id passing_pixels",
                "m_v1_c_0900_combined 4",
                "m_v1_c_1200_combined 4"), Files.readAllLines(tempDir.resolve("A101.wpd")));
        assertEquals(List.of(
                "total_pixels_in_polygon: 4",
                "raster_id passing_pixels",
                "m_v1_c_0900_combined 0",
                "m_v1_c_1200_combined 4"), Files.readAllLines(tempDir.resolve("A102.wpd")));
    }

    @Test
    @DisplayName("undecodable rasters are skipped and reported")
    void skipsBadRaster() throws IOException {
        Path broken = Path.of("m_v1_c_1500_combined.hdr");
        when(decoder.decode(broken)).thenThrow(new ArtifactParseException(broken, "truncated"));

        var result = new ViewGroupProcessor(new RasterCache(decoder)).process(task(List.of(morning, broken)));

        assertEquals(List.of(broken), result.failedRasters());
        assertEquals(3, result.records().size());
        assertEquals(3, Files.readAllLines(tempDir.resolve("A103.wpd")).size());
    }

    @Test
    @DisplayName("no decodable raster means no result files")
    void nothingDecodable() throws IOException {
        Path broken = Path.of("broken.hdr");
        when(decoder.decode(broken)).thenThrow(new ArtifactParseException(broken, "bad magic"));

        var result = new ViewGroupProcessor(new RasterCache(decoder)).process(task(List.of(broken)));

        assertTrue(result.written().isEmpty());
        assertFalse(Files.exists(tempDir.resolve("A101.wpd")));
    }

    @Test
    @DisplayName("a smaller raster in the group keeps the first raster's region total")
    void mixedSizes() throws IOException {
        Path small = Path.of("m_v1_c_1500_combined.hdr");
        when(decoder.decode(small)).thenReturn(new Raster("m_v1_c_1500_combined", small, 2, 2, new float[4]));

        new ViewGroupProcessor(new RasterCache(decoder)).process(task(List.of(small, morning)));

        assertEquals(List.of(
                "total_pixels_in_polygon: 4",
                "raster_id passing_pixels",
                "m_v1_c_0900_combined 0",
                "m_v1_c_1500_combined 0"), Files.readAllLines(tempDir.resolve("A102.wpd")));
    }
}
