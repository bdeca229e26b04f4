package com.heatlite.aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The complete output document: {@code {"meta": ..., "features": [...]}}.
 */
@JsonPropertyOrder({"meta", "features"})
public record HeatmapArtifact(
    @JsonProperty("meta") AggregateMeta meta,
    @JsonProperty("features") List<Feature> features
) {
    public static HeatmapArtifact of(Resolution resolution, List<TimeWindow> windows, List<CellAggregate> aggregates) {
        var grid = resolution.gridType();
        var features = aggregates.stream().map(a -> Feature.from(a, grid)).toList();
        return new HeatmapArtifact(AggregateMeta.of(resolution, windows), features);
    }
}
