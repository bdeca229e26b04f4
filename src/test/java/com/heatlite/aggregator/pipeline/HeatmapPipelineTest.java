package com.heatlite.aggregator.pipeline;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.heatlite.aggregator.config.AggregationConfig;
import com.heatlite.aggregator.error.InvalidRangeException;
import com.heatlite.aggregator.error.MissingColumnException;
import com.heatlite.aggregator.io.ArtifactCodec;
import com.heatlite.aggregator.model.GridType;
import com.heatlite.aggregator.model.TimeWindow;
import com.heatlite.aggregator.spatial.GridIndexer;
import com.heatlite.aggregator.spatial.SpatialIndexers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class HeatmapPipelineTest {

    @TempDir
    Path tmp;

    private Path sampleCsv() throws IOException {
        Path csv = tmp.resolve("incidents.csv");
        try (InputStream in = getClass().getResourceAsStream("/incidents-sample.csv")) {
            assertNotNull(in, "incidents-sample.csv on test classpath");
            Files.copy(in, csv);
        }
        return csv;
    }

    private AggregationConfig.Builder config(Path csv) {
        return AggregationConfig.builder(csv).output(tmp.resolve("dist/aggregates.json")).threads(2);
    }

    private static JsonNode readOutput(Path out) throws IOException {
        return ArtifactCodec.mapper().readTree(Files.readAllBytes(out));
    }

    @Test
    void binAggregationOfSampleIncidents() throws IOException {
        var cfg = config(sampleCsv()).grid(GridType.BIN).build();

        var result = new HeatmapPipeline().run(cfg);

        assertEquals(List.of(new TimeWindow(1995, 1997), new TimeWindow(1998, 2000), new TimeWindow(2001, 2002)),
            result.windows());
        assertEquals(GridType.BIN, result.grid());
        assertTrue(result.budget().budgetMet());

        JsonNode root = readOutput(cfg.output());
        assertEquals("bin", root.path("meta").path("grid").asText());
        assertEquals(0.1, root.path("meta").path("resolution").asDouble());
        assertEquals(3, root.path("meta").path("windows").size());

        Set<String> windowsWithFeatures = new HashSet<>();
        int total = 0;
        boolean sawPair = false;
        for (JsonNode f : root.path("features")) {
            assertTrue(f.has("bin_id"));
            assertFalse(f.has("c"));
            assertTrue(f.path("n").asInt() >= 1);
            windowsWithFeatures.add(f.path("w").get(0).asInt() + "-" + f.path("w").get(1).asInt());
            total += f.path("n").asInt();
            sawPair |= f.path("n").asInt() == 2;
        }
        assertEquals(Set.of("1995-1997", "1998-2000", "2001-2002"), windowsWithFeatures);
        assertEquals(10, total);
        assertTrue(sawPair);
    }

    @Test
    void h3AggregationWritesCellIds() throws IOException {
        var cfg = config(sampleCsv()).grid(GridType.H3).h3Resolution(6).build();

        var result = new HeatmapPipeline().run(cfg);

        JsonNode root = readOutput(cfg.output());
        assertEquals(GridType.H3, result.grid());
        assertEquals("h3", root.path("meta").path("grid").asText());
        assertEquals(6, root.path("meta").path("resolution").asInt());
        for (JsonNode f : root.path("features")) {
            assertEquals(15, f.path("c").asText().length());
            assertFalse(f.has("bin_id"));
        }
    }

    @Test
    void featureWindowsAlwaysMatchMetaWindows() throws IOException {
        var cfg = config(sampleCsv()).grid(GridType.BIN).yearsPerWindow(2).build();

        new HeatmapPipeline().run(cfg);

        JsonNode root = readOutput(cfg.output());
        Set<String> metaWindows = new HashSet<>();
        for (JsonNode w : root.path("meta").path("windows")) {
            metaWindows.add(w.path("start").asInt() + "-" + w.path("end").asInt());
        }
        for (JsonNode f : root.path("features")) {
            assertTrue(metaWindows.contains(f.path("w").get(0).asInt() + "-" + f.path("w").get(1).asInt()));
        }
    }

    @Test
    void missingH3FallsBackToBinGrid() throws IOException {
        var cfg = config(sampleCsv()).grid(GridType.H3).build();

        var result = new HeatmapPipeline(requested -> new GridIndexer()).run(cfg);

        assertEquals(GridType.BIN, result.grid());
        JsonNode root = readOutput(cfg.output());
        assertEquals("bin", root.path("meta").path("grid").asText());
        assertEquals(0.1, root.path("meta").path("resolution").asDouble());
    }

    @Test
    void conusFilterNeverAddsFeatures() throws IOException {
        Path csv = sampleCsv();
        Files.writeString(csv, Files.readString(csv)
            + "1995,21.3099,-157.8581,HI\n1995,61.2181,-149.9003,AK\n");

        var all = new HeatmapPipeline().run(config(csv).grid(GridType.BIN).yearsPerWindow(1).build());
        var conus = new HeatmapPipeline().run(config(csv).grid(GridType.BIN).yearsPerWindow(1).conusOnly(true)
            .output(tmp.resolve("conus.json")).build());

        int allFeatures = all.budget().artifact().features().size();
        int conusFeatures = conus.budget().artifact().features().size();
        assertTrue(conusFeatures < allFeatures);
        assertEquals(2, conus.stats().getOutsideBounds());
        assertEquals(all.windows(), conus.windows());
    }

    @Test
    void missingColumnAbortsBeforeWriting() throws IOException {
        Path csv = tmp.resolve("bad.csv");
        Files.writeString(csv, "when,lat,lon\n1995,40.0,-75.0\n");
        var cfg = config(csv).build();

        assertThrows(MissingColumnException.class, () -> new HeatmapPipeline().run(cfg));
        assertFalse(Files.exists(cfg.output()));
    }

    @Test
    void noValidRowsAbortsBeforeWriting() throws IOException {
        Path csv = tmp.resolve("empty.csv");
        Files.writeString(csv, "year,lat,lon\nunknown,40.0,-75.0\n1995,,\n");
        var cfg = config(csv).grid(GridType.BIN).build();

        var e = assertThrows(InvalidRangeException.class, () -> new HeatmapPipeline().run(cfg));
        assertTrue(e.getMessage().startsWith("No valid rows after filtering"), e.getMessage());
        assertFalse(e.getMessage().contains(String.valueOf(Integer.MAX_VALUE)));
        assertFalse(Files.exists(cfg.output()));
    }

    @Test
    void unmetBudgetStillWritesOutput() throws IOException {
        var cfg = config(sampleCsv()).grid(GridType.BIN).maxSizeMb(0.0001).build();

        var result = new HeatmapPipeline().run(cfg);

        assertFalse(result.budget().budgetMet());
        assertEquals(0.2, result.budget().artifact().meta().resolution());
        assertTrue(Files.exists(cfg.output()));
        assertArrayEquals(result.budget().bytes(), Files.readAllBytes(cfg.output()));
    }

    @Test
    void fallbackAndUnmetBudgetAreEachWarnedOnce() throws IOException {
        var cfg = config(sampleCsv()).maxSizeMb(0.0001).build();
        var appLogger = (Logger) LoggerFactory.getLogger("com.heatlite.aggregator");
        var appender = new ListAppender<ILoggingEvent>();
        appender.start();
        appLogger.addAppender(appender);
        try {
            var result = new HeatmapPipeline(requested -> SpatialIndexers.select(requested, () -> {
                throw new UnsatisfiedLinkError("no h3 in java.library.path");
            })).run(cfg);

            assertEquals(GridType.BIN, result.grid());
            assertFalse(result.budget().budgetMet());
        } finally {
            appLogger.detachAppender(appender);
        }

        List<String> warnings = appender.list.stream()
            .filter(e -> e.getLevel() == Level.WARN)
            .map(ILoggingEvent::getFormattedMessage)
            .collect(Collectors.toList());
        assertEquals(2, warnings.size(), warnings.toString());
        assertEquals(1, warnings.stream().filter(m -> m.contains("H3 not available")).count());
        assertEquals(1, warnings.stream().filter(m -> m.contains("still exceeds limit")).count());
    }
}
