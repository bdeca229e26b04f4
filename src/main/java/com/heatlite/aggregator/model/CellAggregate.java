package com.heatlite.aggregator.model;

/**
 * Count and centroid of the events of one window that share one cell.
 * The centroid is the mean of the member coordinates, not the cell's geometric center.
 */
public record CellAggregate(TimeWindow window, String cellId, double lat, double lon, int count) {

    public CellAggregate {
        if (count < 1) {
            throw new IllegalArgumentException("Aggregate count must be >= 1, got " + count);
        }
    }
}
