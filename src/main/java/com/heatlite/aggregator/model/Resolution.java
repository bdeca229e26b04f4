package com.heatlite.aggregator.model;

/**
 * Spatial resolution of a grid strategy.
 *
 * H3 uses an integer level (higher = finer), the rectangular grid uses a bin size
 * in decimal degrees (larger = coarser).
 */
public sealed interface Resolution permits Resolution.Level, Resolution.BinSize {

    GridType gridType();

    /** Value written to the artifact's {@code meta.resolution}. */
    Number value();

    static Level level(int level) {
        return new Level(level);
    }

    static BinSize binSize(double degrees) {
        return new BinSize(degrees);
    }

    record Level(int level) implements Resolution {
        public Level {
            // H3 defines levels 0..15
            if (level < 0 || level > 15) {
                throw new IllegalArgumentException("H3 resolution must be in [0, 15], got " + level);
            }
        }

        @Override
        public GridType gridType() {
            return GridType.H3;
        }

        @Override
        public Number value() {
            return level;
        }

        @Override
        public String toString() {
            return "res " + level;
        }
    }

    record BinSize(double degrees) implements Resolution {
        public BinSize {
            if (!(degrees > 0.0) || Double.isInfinite(degrees)) {
                throw new IllegalArgumentException("Bin size must be a positive number of degrees, got " + degrees);
            }
        }

        @Override
        public GridType gridType() {
            return GridType.BIN;
        }

        @Override
        public Number value() {
            return degrees;
        }

        @Override
        public String toString() {
            return "bin " + degrees + "°";
        }
    }
}
