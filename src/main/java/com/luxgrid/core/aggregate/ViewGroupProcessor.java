package com.luxgrid.core.aggregate;

import com.luxgrid.core.model.Region;
import com.luxgrid.core.model.ResultRecord;
import com.luxgrid.core.raster.Raster;
import com.luxgrid.core.raster.RasterCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates one group task: every raster of a view against every region of
 * that view.
 *
 * <p>The loop is raster-major so that each raster is decoded once and then
 * tested against all regions while resident. Region masks depend only on the
 * raster dimensions and are built once per (region, width, height). The
 * result file's total comes from the first raster; rasters of a different
 * size within one group are logged.
 */
public class ViewGroupProcessor {

    private static final Logger log = LoggerFactory.getLogger(ViewGroupProcessor.class);

    private final RasterCache cache;
    private final Map<MaskKey, PolygonMask> masks = new HashMap<>();

    public ViewGroupProcessor(RasterCache cache) {
        this.cache = cache;
    }

    public GroupResult process(GroupTask task) throws IOException {
        long startMs = System.currentTimeMillis();
        var rasters = new ArrayList<>(task.rasters());
        rasters.sort(Comparator.comparing(Raster::idOf));

        var perRegion = new LinkedHashMap<Region, List<ResultRecord>>();
        var totals = new HashMap<Region, Integer>();
        for (var region : task.regions()) {
            perRegion.put(region, new ArrayList<>());
        }

        for (Path path : rasters) {
            var decoded = cache.get(path);
            if (decoded.isEmpty()) {
                continue;
            }
            Raster raster = decoded.get();
            for (var region : task.regions()) {
                PolygonMask mask = maskFor(region, raster.width(), raster.height());
                int passing = mask.countAbove(raster, task.threshold());
                Integer previous = totals.putIfAbsent(region, mask.pixelCount());
                if (previous != null && previous != mask.pixelCount()) {
                    log.warn("Region {} covers {} pixels in {} but {} in earlier rasters; keeping {}",
                            region.id(), mask.pixelCount(), raster.id(), previous, previous);
                }
                perRegion.get(region).add(
                        new ResultRecord(region.id(), raster.id(), mask.pixelCount(), passing));
            }
        }

        var written = new ArrayList<Path>();
        var records = new ArrayList<ResultRecord>();
        for (var entry : perRegion.entrySet()) {
            if (entry.getValue().isEmpty()) {
                log.warn("No decodable rasters for region {}; no result file written", entry.getKey().id());
                continue;
            }
            Region region = entry.getKey();
            written.add(ResultFile.write(task.outputDir(), region.id(), totals.get(region), entry.getValue()));
            records.addAll(entry.getValue());
        }

        long elapsedMs = System.currentTimeMillis() - startMs;
        log.info("Group {}: {} regions x {} rasters, {} decodes in {} ms",
                task.name(), task.regions().size(), rasters.size(), cache.decodeCount(), elapsedMs);
        return new GroupResult(task.name(), List.copyOf(records), List.copyOf(written),
                List.copyOf(cache.failures()), cache.decodeCount(), elapsedMs, null);
    }

    private PolygonMask maskFor(Region region, int width, int height) {
        return masks.computeIfAbsent(new MaskKey(region.id(), width, height),
                key -> PolygonMask.build(region.vertices(), width, height));
    }

    private record MaskKey(String regionId, int width, int height) {}
}
