package com.heatlite.aggregator.error;

import java.util.List;

/**
 * None of the known aliases for a required logical field is present in the input header.
 */
public class MissingColumnException extends HeatmapException {

    private final String field;
    private final List<String> aliasesTried;

    public MissingColumnException(String field, List<String> aliasesTried) {
        super("Could not find " + field + " column. Expected one of: " + String.join(", ", aliasesTried));
        this.field = field;
        this.aliasesTried = List.copyOf(aliasesTried);
    }

    public String field() {
        return field;
    }

    public List<String> aliasesTried() {
        return aliasesTried;
    }
}
