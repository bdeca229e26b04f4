package com.heatlite.aggregator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum GridType {
    H3("h3"),
    BIN("bin");

    private final String wireName;

    GridType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static GridType fromWireName(String name) {
        return Arrays.stream(values())
            .filter(g -> g.wireName.equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown grid type '" + name + "', expected one of h3, bin"));
    }
}
