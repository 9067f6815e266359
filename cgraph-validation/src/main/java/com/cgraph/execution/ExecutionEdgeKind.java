package com.cgraph.execution;

import com.fasterxml.jackson.annotation.JsonValue;

/** Edge label handed to renderers: empty for control-flow order, {@code dep} for declared dependencies. */
public enum ExecutionEdgeKind {
    STRUCTURAL(""),
    DEPENDENCY("dep");

    private final String label;

    ExecutionEdgeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
