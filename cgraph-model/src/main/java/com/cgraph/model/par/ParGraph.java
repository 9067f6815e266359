package com.cgraph.model.par;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** A graph in Par notation: the nodes of the outermost {@code begin ... end} block. Immutable. */
public final class ParGraph {

    private final List<ParNode> nodes;

    public ParGraph(List<ParNode> nodes) {
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
    }

    public static ParGraph of(ParNode... nodes) {
        return new ParGraph(Arrays.asList(nodes));
    }

    public List<ParNode> getNodes() {
        return nodes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return nodes.equals(((ParGraph) o).nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes);
    }

    @Override
    public String toString() {
        return ParNotation.write(this);
    }
}
