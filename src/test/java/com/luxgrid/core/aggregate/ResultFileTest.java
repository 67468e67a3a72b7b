package com.luxgrid.core.aggregate;

import com.luxgrid.core.model.ResultRecord;
import com.luxgrid.core.raster.ArtifactParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultFileTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("writes the total line, column line and rows sorted by raster id")
    void writesSorted() throws IOException {
        var records = List.of(
                new ResultRecord("A101", "m_v1_c_1000_combined", 412, 97),
                new ResultRecord("A101", "m_v1_c_0900_combined", 412, 130));

        Path file = ResultFile.write(tempDir, "A101", 412, records);

        assertEquals(tempDir.resolve("A101.wpd"), file);
        assertEquals(List.of(
                "total_pixels_in_polygon: 412",
                "raster_id passing_pixels",
                "m_v1_c_0900_combined 130",
                "m_v1_c_1000_combined 97"), Files.readAllLines(file));
        assertFalse(Files.exists(tempDir.resolve("A101.wpd.partial")));
    }

    @Test
    @DisplayName("reads rows back with the region id and total")
    void readsRows() throws IOException {
        Path file = Files.writeString(tempDir.resolve("B2.wpd"),
                "total_pixels_in_polygon: 20\nraster_id passing_pixels\nr1 5\n\nr2 0\n");

        var records = ResultFile.read(file);

        assertEquals(List.of(new ResultRecord("B2", "r1", 20, 5), new ResultRecord("B2", "r2", 20, 0)), records);
    }

    @Test
    @DisplayName("malformed files are parse errors")
    void malformed() throws IOException {
        Path noTotal = Files.writeString(tempDir.resolve("x.wpd"), "raster_id passing_pixels\nr1 5\n");
        Path badRow = Files.writeString(tempDir.resolve("y.wpd"),
                "total_pixels_in_polygon: 20\nraster_id passing_pixels\nr1 5 7\n");

        assertThrows(ArtifactParseException.class, () -> ResultFile.read(noTotal));
        assertThrows(ArtifactParseException.class, () -> ResultFile.read(badRow));
    }
}
