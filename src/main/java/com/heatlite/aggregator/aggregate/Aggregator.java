package com.heatlite.aggregator.aggregate;

import com.heatlite.aggregator.error.HeatmapException;
import com.heatlite.aggregator.model.CellAggregate;
import com.heatlite.aggregator.model.EventRecord;
import com.heatlite.aggregator.model.Resolution;
import com.heatlite.aggregator.model.TimeWindow;
import com.heatlite.aggregator.spatial.SpatialIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Groups each window's records by cell and emits one {@link CellAggregate} per
 * non-empty (window, cell) pair.
 *
 * Windows are independent, so each one is aggregated as its own task on a fixed
 * pool and the results are concatenated in window order. Within a window the
 * aggregates are ordered by cell id, which makes the output byte-for-byte
 * reproducible for a given input.
 */
public class Aggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    static final int COORDINATE_SCALE = 6;

    private final ExecutorService pool;

    public Aggregator(int threads) {
        var counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "aggregator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public List<CellAggregate> aggregate(WindowBuckets buckets, SpatialIndexer indexer, Resolution resolution) {
        List<TimeWindow> windows = buckets.windows();
        var futures = new ArrayList<Future<List<CellAggregate>>>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            TimeWindow window = windows.get(i);
            List<EventRecord> records = buckets.recordsIn(i);
            if (records.isEmpty()) {
                continue;
            }
            futures.add(pool.submit(() -> aggregateWindow(window, records, indexer, resolution)));
        }

        var out = new ArrayList<CellAggregate>();
        for (Future<List<CellAggregate>> future : futures) {
            out.addAll(await(future));
        }
        log.debug("Aggregated {} records into {} cells at {}", buckets.totalRecords(), out.size(), resolution);
        return out;
    }

    /**
     * Aggregates a single window. Pure function of its arguments.
     */
    public static List<CellAggregate> aggregateWindow(TimeWindow window, List<EventRecord> records,
                                                      SpatialIndexer indexer, Resolution resolution) {
        Map<String, CellAccumulator> cells = new TreeMap<>();
        for (EventRecord r : records) {
            String cellId = indexer.cellFor(r.latitude(), r.longitude(), resolution);
            cells.computeIfAbsent(cellId, k -> new CellAccumulator()).add(r.latitude(), r.longitude());
        }

        var out = new ArrayList<CellAggregate>(cells.size());
        for (Map.Entry<String, CellAccumulator> e : cells.entrySet()) {
            CellAccumulator acc = e.getValue();
            out.add(new CellAggregate(window, e.getKey(),
                round(acc.sumLat / acc.count), round(acc.sumLon / acc.count), acc.count));
        }
        return out;
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(COORDINATE_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static List<CellAggregate> await(Future<List<CellAggregate>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HeatmapException("Interrupted while aggregating", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new HeatmapException("Aggregation task failed", cause);
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class CellAccumulator {
        int count;
        double sumLat;
        double sumLon;

        void add(double lat, double lon) {
            count++;
            sumLat += lat;
            sumLon += lon;
        }
    }
}
