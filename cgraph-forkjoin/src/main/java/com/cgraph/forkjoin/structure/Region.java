package com.cgraph.forkjoin.structure;

import com.cgraph.model.ir.IrGraph;
import com.cgraph.model.ir.IrNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Nested shape recovered from a Fork-Join program. {@link #sequence(List)} reduces: nested sequences
 * are spliced in, one part collapses to that part and no parts to {@link #EMPTY}. Immutable.
 */
public final class Region {

    /** The empty path. The only SEQUENCE with fewer than two children. */
    public static final Region EMPTY = new Region(RegionType.SEQUENCE, null, List.of());

    private final RegionType type;
    private final String name;
    private final List<Region> children;

    private Region(RegionType type, String name, List<Region> children) {
        this.type = type;
        this.name = name;
        this.children = children;
    }

    public static Region atomic(String name) {
        return new Region(RegionType.ATOMIC, Objects.requireNonNull(name, "name"), List.of());
    }

    public static Region sequence(List<Region> parts) {
        List<Region> flat = new ArrayList<>();
        for (Region part : parts) {
            if (part.type == RegionType.SEQUENCE) {
                flat.addAll(part.children);
            } else {
                flat.add(part);
            }
        }
        if (flat.isEmpty()) return EMPTY;
        if (flat.size() == 1) return flat.get(0);
        return new Region(RegionType.SEQUENCE, null, List.copyOf(flat));
    }

    public static Region sequence(Region... parts) {
        return sequence(Arrays.asList(parts));
    }

    public static Region parallel(List<Region> branches) {
        return new Region(RegionType.PARALLEL, null, List.copyOf(branches));
    }

    public static Region parallel(Region... branches) {
        return parallel(Arrays.asList(branches));
    }

    public RegionType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public List<Region> getChildren() {
        return children;
    }

    public boolean isEmpty() {
        return type == RegionType.SEQUENCE && children.isEmpty();
    }

    public IrNode toIrNode() {
        return switch (type) {
            case ATOMIC -> IrNode.atomic(name);
            case SEQUENCE -> IrNode.sequence(mapChildren());
            case PARALLEL -> IrNode.parallel(mapChildren());
        };
    }

    /** IR graph for this region; a top-level sequence becomes the graph's node list. */
    public IrGraph toIrGraph() {
        if (type == RegionType.SEQUENCE) {
            return new IrGraph(mapChildren());
        }
        return IrGraph.of(toIrNode());
    }

    private List<IrNode> mapChildren() {
        List<IrNode> out = new ArrayList<>(children.size());
        for (Region child : children) {
            out.add(child.toIrNode());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Region that = (Region) o;
        return type == that.type && Objects.equals(name, that.name) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, children);
    }

    @Override
    public String toString() {
        return switch (type) {
            case ATOMIC -> name;
            case SEQUENCE -> children.stream().map(Region::toString).collect(Collectors.joining(",", "[", "]"));
            case PARALLEL -> children.stream().map(Region::toString).collect(Collectors.joining(",", "{", "}"));
        };
    }
}
