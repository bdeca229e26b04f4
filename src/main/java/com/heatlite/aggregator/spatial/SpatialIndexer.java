package com.heatlite.aggregator.spatial;

import com.heatlite.aggregator.model.GridType;
import com.heatlite.aggregator.model.Resolution;

/**
 * Maps a coordinate to a discrete cell identifier at a given resolution.
 *
 * Implementations are pure and stateless with respect to their inputs and safe to
 * call from several aggregation threads at once. Coarsening the resolution must
 * never split a cell: any two points that share a cell keep sharing one.
 */
public interface SpatialIndexer {

    GridType gridType();

    String cellFor(double lat, double lon, Resolution resolution);
}
