package com.heatlite.aggregator.pipeline;

import com.heatlite.aggregator.metrics.RunStats;
import com.heatlite.aggregator.model.EventRecord;

import java.util.List;

/**
 * Inclusive latitude/longitude rectangle.
 */
public record BoundingBox(double minLat, double maxLat, double minLon, double maxLon) {

    /** Continental United States. */
    public static final BoundingBox CONUS = new BoundingBox(24.0, 50.0, -125.0, -66.0);

    public BoundingBox {
        if (minLat > maxLat || minLon > maxLon) {
            throw new IllegalArgumentException("Empty bounding box: " + minLat + ".." + maxLat + ", " + minLon + ".." + maxLon);
        }
    }

    public boolean contains(double lat, double lon) {
        return lat >= minLat && lat <= maxLat && lon >= minLon && lon <= maxLon;
    }

    public List<EventRecord> filter(List<EventRecord> records, RunStats stats) {
        var kept = records.stream()
            .filter(r -> contains(r.latitude(), r.longitude()))
            .toList();
        stats.recordOutsideBounds(records.size() - kept.size());
        return kept;
    }
}
