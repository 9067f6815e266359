package com.cgraph.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Renderer hand-off as JSON: {@code {"nodes":[..],"edges":[{"source":..,"target":..,"kind":""|"dep"}]}}.
 */
public final class ExecutionGraphJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExecutionGraphJson() {
    }

    public static String toJson(ExecutionGraph graph) {
        try {
            return MAPPER.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(ExecutionGraph graph) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
