package com.cgraph.model.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Node of the structured IR notation. Either an ATOMIC task (name, dependency names, terminal flag)
 * or a container: SEQUENCE (children in order) or PARALLEL (children are branches).
 * <p>
 * A terminal atomic has no structural successor even when later siblings exist. Dependency names are
 * not checked on construction; the dependency validator resolves them against the whole graph.
 * Instances are immutable.
 */
@JsonPropertyOrder({"type", "name", "deps", "terminal", "children"})
public final class IrNode {

    private final IrNodeType type;
    private final String name;
    private final List<String> deps;
    private final boolean terminal;
    private final List<IrNode> children;

    @JsonCreator
    public IrNode(
            @JsonProperty("type") IrNodeType type,
            @JsonProperty("name") String name,
            @JsonProperty("deps") List<String> deps,
            @JsonProperty("terminal") boolean terminal,
            @JsonProperty("children") List<IrNode> children) {
        this.type = Objects.requireNonNull(type, "type");
        this.deps = deps != null ? List.copyOf(deps) : List.of();
        this.children = children != null ? List.copyOf(children) : List.of();
        if (type == IrNodeType.ATOMIC) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Atomic IR node requires a name");
            }
            if (!this.children.isEmpty()) {
                throw new IllegalArgumentException("Atomic IR node '" + name + "' cannot have children");
            }
            this.name = name;
            this.terminal = terminal;
        } else {
            if (!this.deps.isEmpty() || terminal) {
                throw new IllegalArgumentException(type + " IR node cannot carry dependencies or a terminal marker");
            }
            this.name = null;
            this.terminal = false;
        }
    }

    public static IrNode atomic(String name) {
        return new IrNode(IrNodeType.ATOMIC, name, List.of(), false, List.of());
    }

    public static IrNode atomic(String name, List<String> deps, boolean terminal) {
        return new IrNode(IrNodeType.ATOMIC, name, deps, terminal, List.of());
    }

    /** Atomic task with dependency names, not terminal. */
    public static IrNode dependent(String name, String... deps) {
        return atomic(name, Arrays.asList(deps), false);
    }

    /** Atomic task without dependencies marked terminal ({@code name!}). */
    public static IrNode terminal(String name) {
        return atomic(name, List.of(), true);
    }

    public static IrNode sequence(List<IrNode> children) {
        return new IrNode(IrNodeType.SEQUENCE, null, List.of(), false, children);
    }

    public static IrNode sequence(IrNode... children) {
        return sequence(Arrays.asList(children));
    }

    public static IrNode parallel(List<IrNode> branches) {
        return new IrNode(IrNodeType.PARALLEL, null, List.of(), false, branches);
    }

    public static IrNode parallel(IrNode... branches) {
        return parallel(Arrays.asList(branches));
    }

    /** Structural type. Never null. */
    public IrNodeType getType() {
        return type;
    }

    /** Task name for ATOMIC; null for containers. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getName() {
        return name;
    }

    /** Names of the tasks this atomic depends on, in declaration order. Unmodifiable. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getDeps() {
        return deps;
    }

    @JsonProperty("terminal")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isTerminal() {
        return terminal;
    }

    /** Children of a SEQUENCE or branches of a PARALLEL; empty for ATOMIC. Unmodifiable. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<IrNode> getChildren() {
        return children;
    }

    @JsonIgnore
    public boolean isAtomic() {
        return type == IrNodeType.ATOMIC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IrNode that = (IrNode) o;
        return type == that.type && terminal == that.terminal
                && Objects.equals(name, that.name)
                && Objects.equals(deps, that.deps)
                && Objects.equals(children, that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, deps, terminal, children);
    }

    @Override
    public String toString() {
        return IrNotation.writeNode(this);
    }
}
