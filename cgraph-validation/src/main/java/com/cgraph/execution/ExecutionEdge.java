package com.cgraph.execution;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Edge between two task names. */
@JsonPropertyOrder({"source", "target", "kind"})
public record ExecutionEdge(String source, String target, ExecutionEdgeKind kind) {

    public static ExecutionEdge structural(String source, String target) {
        return new ExecutionEdge(source, target, ExecutionEdgeKind.STRUCTURAL);
    }

    public static ExecutionEdge dependency(String dependency, String task) {
        return new ExecutionEdge(dependency, task, ExecutionEdgeKind.DEPENDENCY);
    }

    @Override
    public String toString() {
        return kind == ExecutionEdgeKind.STRUCTURAL
                ? source + "->" + target
                : source + "-" + kind.getLabel() + "->" + target;
    }
}
