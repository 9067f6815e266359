package com.cgraph.execution;

import com.cgraph.model.ir.IrNode;
import com.cgraph.validation.ValidatedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the execution graph of a validated IR graph.
 * <p>
 * Structural edges follow a set of current predecessors through the tree: a task gets an edge from
 * each predecessor and becomes the only predecessor, or clears the set when terminal. A sequence
 * passes the set through its children in order. Every parallel branch starts from the same set and
 * the branches' resulting sets are united. A second pass adds a {@code dep} edge from each
 * declared dependency to its task.
 */
public final class ExecutionGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGraphBuilder.class);

    private final Set<String> nodes = new LinkedHashSet<>();
    private final Set<ExecutionEdge> edges = new LinkedHashSet<>();

    private ExecutionGraphBuilder() {
    }

    public static ExecutionGraph build(ValidatedGraph validated) {
        Objects.requireNonNull(validated, "validated");
        ExecutionGraphBuilder builder = new ExecutionGraphBuilder();
        Set<String> predecessors = new LinkedHashSet<>();
        for (IrNode node : validated.getGraph().getNodes()) {
            predecessors = builder.thread(node, predecessors);
        }
        for (IrNode node : validated.getGraph().getNodes()) {
            builder.addDependencyEdges(node);
        }
        ExecutionGraph graph = new ExecutionGraph(new ArrayList<>(builder.nodes), new ArrayList<>(builder.edges));
        log.debug("Execution graph nodes={} edges={}", graph.getNodes().size(), graph.getEdges().size());
        return graph;
    }

    /** Returns the predecessors left after {@code node}. */
    private Set<String> thread(IrNode node, Set<String> predecessors) {
        return switch (node.getType()) {
            case ATOMIC -> {
                nodes.add(node.getName());
                for (String p : predecessors) {
                    edges.add(ExecutionEdge.structural(p, node.getName()));
                }
                Set<String> out = new LinkedHashSet<>();
                if (!node.isTerminal()) {
                    out.add(node.getName());
                }
                yield out;
            }
            case SEQUENCE -> {
                Set<String> current = predecessors;
                for (IrNode child : node.getChildren()) {
                    current = thread(child, current);
                }
                yield current;
            }
            case PARALLEL -> {
                if (node.getChildren().isEmpty()) {
                    yield predecessors;
                }
                Set<String> out = new LinkedHashSet<>();
                for (IrNode branch : node.getChildren()) {
                    out.addAll(thread(branch, predecessors));
                }
                yield out;
            }
        };
    }

    private void addDependencyEdges(IrNode node) {
        if (node.isAtomic()) {
            for (String dep : node.getDeps()) {
                edges.add(ExecutionEdge.dependency(dep, node.getName()));
            }
            return;
        }
        for (IrNode child : node.getChildren()) {
            addDependencyEdges(child);
        }
    }
}
