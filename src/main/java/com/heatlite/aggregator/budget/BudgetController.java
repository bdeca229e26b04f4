package com.heatlite.aggregator.budget;

import com.heatlite.aggregator.aggregate.Aggregator;
import com.heatlite.aggregator.aggregate.WindowBuckets;
import com.heatlite.aggregator.config.AggregationConfig;
import com.heatlite.aggregator.io.ArtifactCodec;
import com.heatlite.aggregator.metrics.RunStats;
import com.heatlite.aggregator.model.CellAggregate;
import com.heatlite.aggregator.model.HeatmapArtifact;
import com.heatlite.aggregator.model.Resolution;
import com.heatlite.aggregator.spatial.SpatialIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Aggregates, measures the encoded size, and coarsens the resolution one step at a
 * time until the artifact fits the byte budget.
 *
 * Termination: each coarsening step moves the resolution strictly toward a fixed
 * floor (H3 level) or cap (bin size), and the number of passes is also bounded by
 * {@code maxAttempts}. When neither allows another step the last, oversized
 * result is accepted with a warning.
 */
public class BudgetController {

    private static final Logger log = LoggerFactory.getLogger(BudgetController.class);

    private final Aggregator aggregator;
    private final SpatialIndexer indexer;
    private final long maxBytes;
    private final int minLevel;
    private final double maxBinSize;
    private final int maxAttempts;
    private final RunStats stats;

    public BudgetController(Aggregator aggregator, SpatialIndexer indexer, long maxBytes,
                            int minLevel, double maxBinSize, int maxAttempts, RunStats stats) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.aggregator = aggregator;
        this.indexer = indexer;
        this.maxBytes = maxBytes;
        this.minLevel = minLevel;
        this.maxBinSize = maxBinSize;
        this.maxAttempts = maxAttempts;
        this.stats = stats;
    }

    public static BudgetController fromConfig(Aggregator aggregator, SpatialIndexer indexer,
                                              AggregationConfig config, RunStats stats) {
        return new BudgetController(aggregator, indexer, config.maxSizeBytes(),
            config.h3MinResolution(), config.maxBinSize(), config.maxAttempts(), stats);
    }

    public BudgetResult run(WindowBuckets buckets, Resolution initial) {
        if (initial.gridType() != indexer.gridType()) {
            throw new IllegalArgumentException(
                "Resolution " + initial + " does not match " + indexer.gridType() + " indexer");
        }

        BudgetState state = BudgetState.AGGREGATING;
        Resolution resolution = initial;
        List<CellAggregate> aggregates = List.of();
        HeatmapArtifact artifact = null;
        byte[] bytes = null;
        boolean budgetMet = true;
        var attempts = new ArrayList<BudgetResult.Attempt>();

        while (state != BudgetState.DONE) {
            switch (state) {
                case AGGREGATING -> {
                    aggregates = aggregator.aggregate(buckets, indexer, resolution);
                    stats.recordAggregationPass();
                    state = BudgetState.MEASURING;
                }
                case MEASURING -> {
                    artifact = HeatmapArtifact.of(resolution, buckets.windows(), aggregates);
                    bytes = ArtifactCodec.toBytes(artifact);
                    attempts.add(new BudgetResult.Attempt(resolution, aggregates.size(), bytes.length));
                    log.info("Attempt {}: {} features, {} at {}",
                        attempts.size(), aggregates.size(), formatMb(bytes.length), resolution);
                    state = bytes.length <= maxBytes ? BudgetState.ACCEPTED : BudgetState.COARSENING;
                }
                case COARSENING -> {
                    Optional<Resolution> next = coarsen(resolution);
                    if (next.isEmpty() || attempts.size() >= maxAttempts) {
                        log.warn("Output size {} still exceeds limit {} at {}; no coarser resolution allowed, keeping it",
                            formatMb(bytes.length), formatMb(maxBytes), resolution);
                        budgetMet = false;
                        state = BudgetState.ACCEPTED;
                    } else {
                        log.info("Output size {} exceeds limit {}, coarsening {} -> {}",
                            formatMb(bytes.length), formatMb(maxBytes), resolution, next.get());
                        resolution = next.get();
                        state = BudgetState.AGGREGATING;
                    }
                }
                case ACCEPTED -> state = BudgetState.DONE;
                default -> throw new IllegalStateException("Unexpected state " + state);
            }
        }
        return new BudgetResult(artifact, bytes, resolution, attempts, budgetMet);
    }

    /**
     * One step coarser, or empty at the floor/cap.
     */
    Optional<Resolution> coarsen(Resolution current) {
        if (current instanceof Resolution.Level level) {
            return level.level() > minLevel
                ? Optional.of(Resolution.level(level.level() - 1))
                : Optional.empty();
        }
        var bin = (Resolution.BinSize) current;
        return bin.degrees() < maxBinSize
            ? Optional.of(Resolution.binSize(Math.min(bin.degrees() * 2, maxBinSize)))
            : Optional.empty();
    }

    private static String formatMb(long bytes) {
        return String.format(Locale.ROOT, "%.1fMB", bytes / (1024.0 * 1024.0));
    }
}
