package com.heatlite.aggregator.spatial;

import com.heatlite.aggregator.model.GridType;
import com.heatlite.aggregator.model.Resolution;
import com.uber.h3core.H3Core;

import java.io.IOException;

/**
 * H3 hexagonal cells. Cell ids are the 15-character hex address, e.g. {@code 862a1072fffffff}.
 *
 * A point's cell at level r is the level-r ancestor of its finest (level 15) cell.
 * H3 children overhang their parent's boundary slightly, so indexing each level
 * directly could put two points that share a fine cell into different coarse
 * cells. Walking up from one fixed leaf keeps every level strictly nested.
 *
 * H3Core is thread-safe, one instance serves every aggregation worker.
 */
public final class HexIndexer implements SpatialIndexer {

    static final int LEAF_LEVEL = 15;

    private final H3Core h3;

    HexIndexer(H3Core h3) {
        this.h3 = h3;
    }

    /**
     * Loads the H3 native library.
     *
     * @throws IOException if the bundled native library cannot be extracted
     */
    public static HexIndexer create() throws IOException {
        return new HexIndexer(H3Core.newInstance());
    }

    @Override
    public GridType gridType() {
        return GridType.H3;
    }

    @Override
    public String cellFor(double lat, double lon, Resolution resolution) {
        if (!(resolution instanceof Resolution.Level level)) {
            throw new IllegalArgumentException("H3 indexing needs an integer level, got " + resolution);
        }
        long leaf = h3.latLngToCell(lat, lon, LEAF_LEVEL);
        long cell = level.level() == LEAF_LEVEL ? leaf : h3.cellToParent(leaf, level.level());
        return h3.h3ToString(cell);
    }
}
