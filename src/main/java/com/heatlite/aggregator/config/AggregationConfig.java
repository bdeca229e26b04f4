package com.heatlite.aggregator.config;

import com.heatlite.aggregator.model.GridType;
import com.heatlite.aggregator.model.Resolution;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable settings for one aggregation run.
 *
 * @param input           CSV table to aggregate
 * @param output          artifact path
 * @param grid            requested grid; H3 is downgraded to BIN when the native library is missing
 * @param h3Resolution    starting H3 level
 * @param h3MinResolution coarsest H3 level the budget loop may fall back to
 * @param binSize         starting grid bin size in degrees
 * @param maxBinSize      largest bin size the budget loop may grow to
 * @param yearsPerWindow  length of each time window
 * @param conusOnly       keep only points inside the continental US box
 * @param maxSizeMb       artifact size budget in MiB
 * @param maxAttempts     upper bound on aggregation passes
 * @param threads         aggregation worker threads
 */
public record AggregationConfig(
    Path input,
    Path output,
    GridType grid,
    int h3Resolution,
    int h3MinResolution,
    double binSize,
    double maxBinSize,
    int yearsPerWindow,
    boolean conusOnly,
    double maxSizeMb,
    int maxAttempts,
    int threads
) {
    public static final Path DEFAULT_OUTPUT = Path.of("dist", "aggregates.json");
    public static final int DEFAULT_H3_RESOLUTION = 6;
    public static final int DEFAULT_H3_MIN_RESOLUTION = 5;
    public static final double DEFAULT_BIN_SIZE = 0.1;
    public static final double DEFAULT_MAX_BIN_SIZE = 0.2;
    public static final int DEFAULT_YEARS_PER_WINDOW = 3;
    public static final double DEFAULT_MAX_SIZE_MB = 50.0;
    public static final int DEFAULT_MAX_ATTEMPTS = 8;

    private static final long BYTES_PER_MB = 1024L * 1024L;

    public AggregationConfig {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(grid, "grid");
        requireLevel("h3Resolution", h3Resolution);
        requireLevel("h3MinResolution", h3MinResolution);
        requirePositive("binSize", binSize);
        requirePositive("maxBinSize", maxBinSize);
        requirePositive("maxSizeMb", maxSizeMb);
        if (yearsPerWindow < 1) {
            throw new IllegalArgumentException("yearsPerWindow must be >= 1, got " + yearsPerWindow);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
    }

    public static Builder builder(Path input) {
        return new Builder(input);
    }

    public long maxSizeBytes() {
        return (long) (maxSizeMb * BYTES_PER_MB);
    }

    /** Starting resolution for the grid that is actually in use. */
    public Resolution initialResolution(GridType activeGrid) {
        return activeGrid == GridType.H3
            ? Resolution.level(h3Resolution)
            : Resolution.binSize(binSize);
    }

    public Builder toBuilder() {
        return new Builder(input)
            .output(output)
            .grid(grid)
            .h3Resolution(h3Resolution)
            .h3MinResolution(h3MinResolution)
            .binSize(binSize)
            .maxBinSize(maxBinSize)
            .yearsPerWindow(yearsPerWindow)
            .conusOnly(conusOnly)
            .maxSizeMb(maxSizeMb)
            .maxAttempts(maxAttempts)
            .threads(threads);
    }

    static int defaultThreads() {
        String fromEnv = System.getenv().getOrDefault("HEATMAP_THREADS", "");
        if (!fromEnv.isBlank()) {
            try {
                return Math.max(1, Integer.parseInt(fromEnv.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("HEATMAP_THREADS is not an integer: " + fromEnv, e);
            }
        }
        return Runtime.getRuntime().availableProcessors();
    }

    private static void requireLevel(String name, int level) {
        if (level < 0 || level > 15) {
            throw new IllegalArgumentException(name + " must be in [0, 15], got " + level);
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive number, got " + value);
        }
    }

    public static final class Builder {
        private final Path input;
        private Path output = DEFAULT_OUTPUT;
        private GridType grid = GridType.H3;
        private int h3Resolution = DEFAULT_H3_RESOLUTION;
        private int h3MinResolution = DEFAULT_H3_MIN_RESOLUTION;
        private double binSize = DEFAULT_BIN_SIZE;
        private double maxBinSize = DEFAULT_MAX_BIN_SIZE;
        private int yearsPerWindow = DEFAULT_YEARS_PER_WINDOW;
        private boolean conusOnly;
        private double maxSizeMb = DEFAULT_MAX_SIZE_MB;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Integer threads;

        private Builder(Path input) {
            this.input = input;
        }

        public Builder output(Path output) { this.output = output; return this; }
        public Builder grid(GridType grid) { this.grid = grid; return this; }
        public Builder h3Resolution(int level) { this.h3Resolution = level; return this; }
        public Builder h3MinResolution(int level) { this.h3MinResolution = level; return this; }
        public Builder binSize(double degrees) { this.binSize = degrees; return this; }
        public Builder maxBinSize(double degrees) { this.maxBinSize = degrees; return this; }
        public Builder yearsPerWindow(int years) { this.yearsPerWindow = years; return this; }
        public Builder conusOnly(boolean conusOnly) { this.conusOnly = conusOnly; return this; }
        public Builder maxSizeMb(double mb) { this.maxSizeMb = mb; return this; }
        public Builder maxAttempts(int attempts) { this.maxAttempts = attempts; return this; }
        public Builder threads(int threads) { this.threads = threads; return this; }

        public AggregationConfig build() {
            return new AggregationConfig(
                input, output, grid,
                h3Resolution, h3MinResolution,
                binSize, maxBinSize,
                yearsPerWindow, conusOnly,
                maxSizeMb, maxAttempts,
                threads != null ? threads : defaultThreads());
        }
    }
}
