package com.cgraph.execution;

/** Graphviz DOT text for an execution graph; dependency edges are dashed and labelled {@code dep}. */
public final class ExecutionGraphDot {

    private ExecutionGraphDot() {
    }

    public static String write(ExecutionGraph graph) {
        StringBuilder sb = new StringBuilder("digraph G {\n");
        for (String node : graph.getNodes()) {
            sb.append("  ").append(quote(node)).append(";\n");
        }
        for (ExecutionEdge edge : graph.getEdges()) {
            sb.append("  ").append(quote(edge.source())).append(" -> ").append(quote(edge.target()));
            if (edge.kind() == ExecutionEdgeKind.DEPENDENCY) {
                sb.append(" [style=dashed, label=").append(quote(edge.kind().getLabel())).append(']');
            }
            sb.append(";\n");
        }
        return sb.append("}\n").toString();
    }

    private static String quote(String id) {
        return '"' + id.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
