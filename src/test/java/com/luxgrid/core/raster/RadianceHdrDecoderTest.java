package com.luxgrid.core.raster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class RadianceHdrDecoderTest {

    @TempDir
    Path tempDir;

    private final RadianceHdrDecoder decoder = new RadianceHdrDecoder();

    private static boolean[][] checkerboard(int width, int height) {
        var lit = new boolean[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                lit[y][x] = (x + y) % 2 == 0;
            }
        }
        return lit;
    }

    private static void assertMatches(boolean[][] lit, Raster raster) {
        float on = HdrFixtures.litBrightness();
        for (int y = 0; y < lit.length; y++) {
            for (int x = 0; x < lit[0].length; x++) {
                assertEquals(lit[y][x] ? on : 0f, raster.value(x, y), 1e-6, "pixel " + x + "," + y);
            }
        }
    }

    @Test
    @DisplayName("brightness uses photopic weights on the shared exponent")
    void brightness() {
        byte[] rgbe = {(byte) 128, 0, 0, (byte) 129};
        double expected = 0.265 * 128.5 / 128 + 0.670 * 0.5 / 128 + 0.065 * 0.5 / 128;
        assertEquals(expected, RadianceHdrDecoder.brightness(rgbe, 0), 1e-6);
        assertEquals(0f, RadianceHdrDecoder.brightness(HdrFixtures.DARK, 0));
    }

    @Test
    @DisplayName("decodes flat scanlines")
    void flat() throws IOException {
        var lit = checkerboard(4, 4);
        Path pic = HdrFixtures.write(tempDir.resolve("model_v1_c1_combined.hdr"), lit, false);

        var raster = decoder.decode(pic);

        assertEquals("model_v1_c1_combined", raster.id());
        assertEquals(4, raster.width());
        assertMatches(lit, raster);
    }

    @Test
    @DisplayName("decodes run-length encoded scanlines with runs and literals")
    void runLength() throws IOException {
        var lit = new boolean[3][20];
        Arrays.fill(lit[0], true);
        lit[1] = checkerboard(20, 1)[0];
        Arrays.fill(lit[2], 0, 10, true);
        Path pic = HdrFixtures.write(tempDir.resolve("rle.hdr"), lit, true);

        assertMatches(lit, decoder.decode(pic));
    }

    @Test
    @DisplayName("truncated picture data is a parse error")
    void truncated() throws IOException {
        Path pic = HdrFixtures.write(tempDir.resolve("t.hdr"), HdrFixtures.uniform(4, 4, true), false);
        byte[] bytes = Files.readAllBytes(pic);
        Files.write(pic, Arrays.copyOf(bytes, bytes.length - 10));

        assertThrows(ArtifactParseException.class, () -> decoder.decode(pic));
    }

    @Test
    @DisplayName("old-style run markers are rejected")
    void oldStyleRle() throws IOException {
        Path pic = tempDir.resolve("old.hdr");
        var out = new ByteArrayOutputStream();
        out.writeBytes(HdrFixtures.header(2, 1, null).getBytes(StandardCharsets.ISO_8859_1));
        out.writeBytes(HdrFixtures.LIT);
        out.writeBytes(new byte[]{1, 1, 1, 1});
        Files.write(pic, out.toByteArray());

        assertThrows(ArtifactParseException.class, () -> decoder.decode(pic));
    }

    @Test
    @DisplayName("pictures above the pixel limit are rejected before decoding")
    void pixelLimit() throws IOException {
        Path pic = HdrFixtures.write(tempDir.resolve("big.hdr"), HdrFixtures.uniform(4, 4, true), false);

        var ex = assertThrows(ArtifactParseException.class, () -> new RadianceHdrDecoder(15).decode(pic));
        assertTrue(ex.getMessage().contains("decode limit"));
        assertEquals(4, new RadianceHdrDecoder(16).decode(pic).width());
    }

    @Test
    @DisplayName("a header claiming far more pixels than the file holds is a parse error")
    void headerLargerThanData() throws IOException {
        Path pic = Files.write(tempDir.resolve("huge.hdr"),
                HdrFixtures.header(1_000_000_000, 2, null).getBytes(StandardCharsets.ISO_8859_1));

        var ex = assertThrows(ArtifactParseException.class,
                () -> new RadianceHdrDecoder(Long.MAX_VALUE).decode(pic));
        assertTrue(ex.getMessage().contains("truncated"));
    }

    @Test
    @DisplayName("minimum data size follows the scanline encoding")
    void minimumDataBytes() {
        assertEquals(4 * 4 * 3, RadianceHdrDecoder.minimumDataBytes(4, 3));
        assertEquals(2 * (4 + 8 * 2), RadianceHdrDecoder.minimumDataBytes(200, 2));
    }
}
