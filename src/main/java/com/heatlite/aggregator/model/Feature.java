package com.heatlite.aggregator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Wire form of a {@link CellAggregate}. Exactly one of {@code c} (H3 cell) or
 * {@code bin_id} (grid bin) is present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"w", "lat", "lon", "n", "c", "bin_id"})
public record Feature(
    @JsonProperty("w") List<Integer> w,
    @JsonProperty("lat") double lat,
    @JsonProperty("lon") double lon,
    @JsonProperty("n") int n,
    @JsonProperty("c") String c,
    @JsonProperty("bin_id") String binId
) {
    public static Feature from(CellAggregate agg, GridType grid) {
        var w = List.of(agg.window().start(), agg.window().end());
        return grid == GridType.H3
            ? new Feature(w, agg.lat(), agg.lon(), agg.count(), agg.cellId(), null)
            : new Feature(w, agg.lat(), agg.lon(), agg.count(), null, agg.cellId());
    }
}
