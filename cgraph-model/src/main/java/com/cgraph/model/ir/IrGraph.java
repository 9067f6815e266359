package com.cgraph.model.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A graph in IR notation: the top-level nodes, run in order as an implicit sequence.
 * This is the pivot every conversion goes through. Immutable.
 */
public final class IrGraph {

    private final List<IrNode> nodes;

    @JsonCreator
    public IrGraph(@JsonProperty("nodes") List<IrNode> nodes) {
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
    }

    public static IrGraph of(IrNode... nodes) {
        return new IrGraph(Arrays.asList(nodes));
    }

    public List<IrNode> getNodes() {
        return nodes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return nodes.equals(((IrGraph) o).nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes);
    }

    /** Canonical IR notation, e.g. {@code $a,{b,c},d#{a}!$}. */
    @Override
    public String toString() {
        return IrNotation.write(this);
    }
}
