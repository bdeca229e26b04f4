package com.heatlite.aggregator.error;

/**
 * The year range to partition is empty, usually because no row survived validation.
 */
public class InvalidRangeException extends HeatmapException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
