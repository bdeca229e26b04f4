package com.heatlite.aggregator.config;

/**
 * Bad command line: unknown flag, missing value or unparseable number.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
