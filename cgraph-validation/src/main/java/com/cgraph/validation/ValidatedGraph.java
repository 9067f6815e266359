package com.cgraph.validation;

import com.cgraph.model.ir.IrGraph;

import java.util.Objects;

/**
 * An IR graph whose dependencies all resolve and form no cycle. Only {@link DependencyValidator}
 * creates instances, so holding one proves validation passed.
 */
public final class ValidatedGraph {

    private final IrGraph graph;
    private final DependencyMap dependencies;

    ValidatedGraph(IrGraph graph, DependencyMap dependencies) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.dependencies = Objects.requireNonNull(dependencies, "dependencies");
    }

    public IrGraph getGraph() {
        return graph;
    }

    public DependencyMap getDependencies() {
        return dependencies;
    }

    @Override
    public String toString() {
        return graph.toString();
    }
}
