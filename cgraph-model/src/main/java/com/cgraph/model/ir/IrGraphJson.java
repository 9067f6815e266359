package com.cgraph.model.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON interchange for IR graphs. Atomic nodes serialize as
 * {@code {"type":"ATOMIC","name":..,"deps":[..],"terminal":true}} (empty deps and a false terminal
 * flag are omitted), containers as {@code {"type":"SEQUENCE"|"PARALLEL","children":[..]}}.
 */
public final class IrGraphJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private IrGraphJson() {
    }

    /**
     * Parses an IR graph from JSON.
     *
     * @throws UncheckedIOException on malformed JSON, unknown node types or invalid nodes
     */
    public static IrGraph fromJson(String json) {
        try {
            return MAPPER.readValue(json, IrGraph.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(IrGraph graph) {
        try {
            return MAPPER.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(IrGraph graph) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
