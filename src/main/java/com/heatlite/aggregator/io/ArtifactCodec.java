package com.heatlite.aggregator.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heatlite.aggregator.error.HeatmapException;
import com.heatlite.aggregator.model.HeatmapArtifact;

import java.io.IOException;

/**
 * Canonical compact JSON encoding of the artifact. The byte length of this
 * encoding is what the size budget is measured against.
 */
public final class ArtifactCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ArtifactCodec() {}

    public static byte[] toBytes(HeatmapArtifact artifact) {
        try {
            return MAPPER.writeValueAsBytes(artifact);
        } catch (JsonProcessingException e) {
            throw new HeatmapException("Failed to serialize artifact", e);
        }
    }

    public static HeatmapArtifact fromBytes(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, HeatmapArtifact.class);
        } catch (IOException e) {
            throw new HeatmapException("Failed to parse artifact", e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
