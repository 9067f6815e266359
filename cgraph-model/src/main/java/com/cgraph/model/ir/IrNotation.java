package com.cgraph.model.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Canonical text form of the IR notation: comma-separated nodes, {@code {...}} for parallel,
 * {@code [...]} for sequence, {@code name#{a,b}} for dependencies, trailing {@code !} for terminal,
 * whole graph wrapped in {@code $...$}.
 */
public final class IrNotation {

    private IrNotation() {
    }

    public static String write(IrGraph graph) {
        return "$" + writeNodes(graph.getNodes()) + "$";
    }

    public static String writeNode(IrNode node) {
        return switch (node.getType()) {
            case ATOMIC -> writeAtomic(node);
            case SEQUENCE -> "[" + writeNodes(node.getChildren()) + "]";
            case PARALLEL -> "{" + writeNodes(node.getChildren()) + "}";
        };
    }

    private static String writeNodes(List<IrNode> nodes) {
        return nodes.stream().map(IrNotation::writeNode).collect(Collectors.joining(","));
    }

    private static String writeAtomic(IrNode node) {
        StringBuilder sb = new StringBuilder(node.getName());
        if (!node.getDeps().isEmpty()) {
            sb.append("#{").append(String.join(",", node.getDeps())).append('}');
        }
        if (node.isTerminal()) {
            sb.append('!');
        }
        return sb.toString();
    }
}
