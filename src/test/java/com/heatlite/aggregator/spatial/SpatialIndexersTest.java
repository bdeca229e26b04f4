package com.heatlite.aggregator.spatial;

import com.heatlite.aggregator.model.GridType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SpatialIndexersTest {

    @Test
    void binRequestNeverTouchesH3() {
        var called = new AtomicBoolean();
        var indexer = SpatialIndexers.select(GridType.BIN, () -> {
            called.set(true);
            return HexIndexer.create();
        });

        assertInstanceOf(GridIndexer.class, indexer);
        assertFalse(called.get());
    }

    @Test
    void h3RequestUsesHexIndexerWhenLoadable() {
        assertEquals(GridType.H3, SpatialIndexers.select(GridType.H3).gridType());
    }

    @Test
    void failedNativeLoadFallsBackToGrid() {
        var indexer = SpatialIndexers.select(GridType.H3, () -> {
            throw new IOException("no native library for this platform");
        });
        assertEquals(GridType.BIN, indexer.gridType());
    }

    @Test
    void linkageErrorFallsBackToGrid() {
        var indexer = SpatialIndexers.select(GridType.H3, () -> {
            throw new UnsatisfiedLinkError("libh3-java.so");
        });
        assertEquals(GridType.BIN, indexer.gridType());
    }
}
