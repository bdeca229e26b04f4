package com.heatlite.aggregator.error;

/**
 * The input table could not be read as CSV (missing file, no header, malformed quoting).
 */
public class InputFormatException extends HeatmapException {

    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
