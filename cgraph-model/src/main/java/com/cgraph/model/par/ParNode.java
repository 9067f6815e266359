package com.cgraph.model.par;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Node of the Par notation. Unlike the IR node it carries no dependencies and no terminal marker.
 * Immutable.
 */
public final class ParNode {

    private final ParNodeType type;
    private final String name;
    private final List<ParNode> children;

    private ParNode(ParNodeType type, String name, List<ParNode> children) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    public static ParNode atomic(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Atomic Par node requires a name");
        }
        return new ParNode(ParNodeType.ATOMIC, name, List.of());
    }

    public static ParNode sequence(List<ParNode> children) {
        return new ParNode(ParNodeType.SEQUENCE, null, children);
    }

    public static ParNode sequence(ParNode... children) {
        return sequence(Arrays.asList(children));
    }

    public static ParNode parallel(List<ParNode> branches) {
        return new ParNode(ParNodeType.PARALLEL, null, branches);
    }

    public static ParNode parallel(ParNode... branches) {
        return parallel(Arrays.asList(branches));
    }

    public ParNodeType getType() {
        return type;
    }

    /** Task name for ATOMIC; null otherwise. */
    public String getName() {
        return name;
    }

    public List<ParNode> getChildren() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParNode that = (ParNode) o;
        return type == that.type && Objects.equals(name, that.name) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, children);
    }

    private String joined() {
        return children.stream().map(ParNode::toString).collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return switch (type) {
            case ATOMIC -> name;
            case SEQUENCE -> "begin " + joined() + " end";
            case PARALLEL -> "parbegin " + joined() + " parend";
        };
    }
}
