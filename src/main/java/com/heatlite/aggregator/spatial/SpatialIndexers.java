package com.heatlite.aggregator.spatial;

import com.heatlite.aggregator.model.GridType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Chooses the indexing strategy at startup.
 */
public final class SpatialIndexers {

    private static final Logger log = LoggerFactory.getLogger(SpatialIndexers.class);

    private SpatialIndexers() {}

    public static SpatialIndexer select(GridType requested) {
        return select(requested, HexIndexer::create);
    }

    /**
     * Returns the H3 indexer when requested and loadable, the grid indexer otherwise.
     * A failed native load is logged and downgraded, never fatal.
     */
    public static SpatialIndexer select(GridType requested, Callable<? extends SpatialIndexer> hexFactory) {
        if (requested == GridType.BIN) {
            return new GridIndexer();
        }
        try {
            SpatialIndexer hex = hexFactory.call();
            log.info("H3 native library loaded");
            return hex;
        } catch (Exception | LinkageError e) {
            log.warn("H3 not available ({}), switching to bin grid", e.toString());
            return new GridIndexer();
        }
    }
}
