package com.heatlite.aggregator.columns;

import java.util.List;

/**
 * The three logical fields the pipeline needs, each with its aliases in priority order.
 * Matching is case-sensitive.
 */
public enum LogicalField {
    LATITUDE("latitude", List.of("lat", "latitude", "Latitude", "LAT", "y")),
    LONGITUDE("longitude", List.of("lon", "lng", "longitude", "Longitude", "LON", "x")),
    DATE("date", List.of("date", "incident_date", "Date", "DATE", "year"));

    /** Alias that marks a date column holding bare years rather than full dates. */
    public static final String YEAR_ALIAS = "year";

    private final String label;
    private final List<String> aliases;

    LogicalField(String label, List<String> aliases) {
        this.label = label;
        this.aliases = aliases;
    }

    public String label() {
        return label;
    }

    public List<String> aliases() {
        return aliases;
    }
}
