package com.dualedit.expression.visual;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON exchanged with the visual editor. Unknown properties are ignored; empty maps and nulls are omitted.
 */
public final class VisualNodeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_EMPTY)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private VisualNodeJson() {
    }

    /**
     * @return the root block, or null for JSON {@code null}
     * @throws UncheckedIOException on malformed JSON
     */
    public static VisualNode fromJson(String json) {
        try {
            return MAPPER.readValue(json, VisualNode.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** @throws UncheckedIOException on serialization failure */
    public static String toJson(VisualNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
