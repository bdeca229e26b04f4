package com.heatlite.aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Run metadata emitted once per artifact, describing the accepted resolution.
 */
@JsonPropertyOrder({"grid", "resolution", "windows"})
public record AggregateMeta(
    @JsonProperty("grid") GridType grid,
    @JsonProperty("resolution") Number resolution,
    @JsonProperty("windows") List<TimeWindow> windows
) {
    public static AggregateMeta of(Resolution resolution, List<TimeWindow> windows) {
        return new AggregateMeta(resolution.gridType(), resolution.value(), List.copyOf(windows));
    }
}
