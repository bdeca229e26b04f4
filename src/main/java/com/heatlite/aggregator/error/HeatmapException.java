package com.heatlite.aggregator.error;

/**
 * Base class for failures that abort a run before any artifact is written.
 */
public class HeatmapException extends RuntimeException {

    public HeatmapException(String message) {
        super(message);
    }

    public HeatmapException(String message, Throwable cause) {
        super(message, cause);
    }
}
