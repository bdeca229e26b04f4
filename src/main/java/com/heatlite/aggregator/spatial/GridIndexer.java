package com.heatlite.aggregator.spatial;

import com.heatlite.aggregator.model.GridType;
import com.heatlite.aggregator.model.Resolution;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Uniform decimal-degree grid. A point falls in bin
 * {@code floor(lat / size) * size _ floor(lon / size) * size}, written with one decimal
 * or with as many decimals as the bin size carries, whichever is more.
 *
 * Division is done in decimal so that a coordinate lying exactly on a bin edge
 * (e.g. 0.3 with size 0.1) lands in the bin that starts at that edge.
 */
public final class GridIndexer implements SpatialIndexer {

    private static final int MIN_LABEL_SCALE = 1;

    @Override
    public GridType gridType() {
        return GridType.BIN;
    }

    @Override
    public String cellFor(double lat, double lon, Resolution resolution) {
        if (!(resolution instanceof Resolution.BinSize bin)) {
            throw new IllegalArgumentException("Grid binning needs a bin size, got " + resolution);
        }
        var size = BigDecimal.valueOf(bin.degrees());
        return binEdge(lat, size) + "_" + binEdge(lon, size);
    }

    static String binEdge(double coordinate, BigDecimal size) {
        BigDecimal steps = BigDecimal.valueOf(coordinate).divide(size, 0, RoundingMode.FLOOR);
        int scale = Math.max(MIN_LABEL_SCALE, size.stripTrailingZeros().scale());
        return steps.multiply(size).setScale(scale, RoundingMode.FLOOR).toPlainString();
    }
}
