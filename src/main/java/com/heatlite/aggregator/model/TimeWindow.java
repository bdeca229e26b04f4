package com.heatlite.aggregator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Inclusive range of calendar years. Serialized as {@code {"start":1995,"end":1997}}.
 */
@JsonPropertyOrder({"start", "end"})
public record TimeWindow(
    @JsonProperty("start") int start,
    @JsonProperty("end") int end
) {
    public TimeWindow {
        if (end < start) {
            throw new IllegalArgumentException("Window end " + end + " precedes start " + start);
        }
    }

    public boolean contains(int year) {
        return year >= start && year <= end;
    }

    public int lengthYears() {
        return end - start + 1;
    }

    @Override
    public String toString() {
        return "[" + start + "-" + end + "]";
    }
}
