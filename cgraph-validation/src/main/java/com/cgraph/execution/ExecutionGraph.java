package com.cgraph.execution;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Flat graph for rendering: task names in first-encounter order and distinct edges.
 * Built only from validated graphs by {@link ExecutionGraphBuilder}. Immutable.
 */
@JsonPropertyOrder({"nodes", "edges"})
public final class ExecutionGraph {

    private final List<String> nodes;
    private final List<ExecutionEdge> edges;

    ExecutionGraph(List<String> nodes, List<ExecutionEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public List<String> getNodes() {
        return nodes;
    }

    public List<ExecutionEdge> getEdges() {
        return edges;
    }

    public boolean hasEdge(String source, String target, ExecutionEdgeKind kind) {
        return edges.contains(new ExecutionEdge(source, target, kind));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionGraph that = (ExecutionGraph) o;
        return nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return "ExecutionGraph{nodes=" + nodes + ", edges=" + edges + "}";
    }
}
