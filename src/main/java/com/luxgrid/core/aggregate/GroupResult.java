package com.luxgrid.core.aggregate;

import com.luxgrid.core.model.ResultRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Reply message from one worker.
 *
 * @param records        one record per (region, decoded raster)
 * @param written        result files written
 * @param failedRasters  rasters that could not be decoded
 * @param decodeCount    decodes performed by the task's cache
 * @param error          failure message if the task aborted, otherwise {@code null}
 */
public record GroupResult(String name, List<ResultRecord> records, List<Path> written,
                          List<Path> failedRasters, int decodeCount, long elapsedMs, String error) {

    public static GroupResult failed(String name, String error, long elapsedMs) {
        return new GroupResult(name, List.of(), List.of(), List.of(), 0, elapsedMs, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
