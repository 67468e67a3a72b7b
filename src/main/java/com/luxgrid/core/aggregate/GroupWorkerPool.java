package com.luxgrid.core.aggregate;

import com.luxgrid.core.logging.MdcContext;
import com.luxgrid.core.raster.RasterCache;
import com.luxgrid.core.raster.RasterDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Fixed pool of aggregation workers. Tasks and replies are plain messages;
 * workers share nothing but the stateless decoder, and each task gets a fresh
 * {@link RasterCache}.
 */
public class GroupWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(GroupWorkerPool.class);

    private final RasterDecoder decoder;
    private final int workers;

    public GroupWorkerPool(RasterDecoder decoder, int workers) {
        this.decoder = decoder;
        this.workers = Math.max(1, workers);
    }

    /**
     * Runs every task and returns replies in completion order. A task that
     * throws is reported as a failed {@link GroupResult}; the others carry on.
     */
    public List<GroupResult> runAll(String runId, List<GroupTask> tasks, Consumer<GroupResult> onResult) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        var pool = Executors.newFixedThreadPool(Math.min(workers, tasks.size()), workerThreads());
        var results = new ArrayList<GroupResult>(tasks.size());
        try {
            var completion = new ExecutorCompletionService<GroupResult>(pool);
            for (var task : tasks) {
                completion.submit(() -> runTask(runId, task));
            }
            for (int i = 0; i < tasks.size(); i++) {
                GroupResult result = completion.take().get();
                results.add(result);
                onResult.accept(result);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted with {} of {} group tasks collected", results.size(), tasks.size());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Group worker failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    private GroupResult runTask(String runId, GroupTask task) {
        MdcContext.setViewGroup(runId, task.name());
        long startMs = System.currentTimeMillis();
        try {
            return new ViewGroupProcessor(new RasterCache(decoder)).process(task);
        } catch (Exception e) {
            log.error("Group {} failed: {}", task.name(), e.getMessage(), e);
            return GroupResult.failed(task.name(), e.getMessage(), System.currentTimeMillis() - startMs);
        } finally {
            MdcContext.clear();
        }
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "aggregate-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
