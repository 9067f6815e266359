package com.cgraph.validation;

import com.cgraph.model.ir.IrGraph;
import com.cgraph.model.ir.IrNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flat view of every atomic task in an IR graph: name to dependency names and terminal flag,
 * in first-seen order. A later task with the same name replaces the earlier entry but keeps its
 * position; such names are listed by {@link #getDuplicates()}.
 */
public final class DependencyMap {

    private static final Logger log = LoggerFactory.getLogger(DependencyMap.class);

    /** Dependencies and terminal flag of one task. */
    public record Entry(List<String> deps, boolean terminal) {
    }

    private final Map<String, Entry> entries;
    private final Set<String> duplicates;

    private DependencyMap(Map<String, Entry> entries, Set<String> duplicates) {
        this.entries = Collections.unmodifiableMap(entries);
        this.duplicates = Collections.unmodifiableSet(duplicates);
    }

    public static DependencyMap flatten(IrGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Map<String, Entry> entries = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (IrNode node : graph.getNodes()) {
            collect(node, entries, duplicates);
        }
        return new DependencyMap(entries, duplicates);
    }

    private static void collect(IrNode node, Map<String, Entry> entries, Set<String> duplicates) {
        switch (node.getType()) {
            case ATOMIC -> {
                Entry previous = entries.put(node.getName(), new Entry(node.getDeps(), node.isTerminal()));
                if (previous != null) {
                    duplicates.add(node.getName());
                    log.warn("Duplicate task name={}; later definition replaces deps={} with deps={}",
                            node.getName(), previous.deps(), node.getDeps());
                }
            }
            case SEQUENCE, PARALLEL -> {
                for (IrNode child : node.getChildren()) {
                    collect(child, entries, duplicates);
                }
            }
        }
    }

    /** Task names in first-seen order. */
    public Set<String> names() {
        return entries.keySet();
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /** Dependencies of {@code name}; empty for unknown names. */
    public List<String> depsOf(String name) {
        Entry entry = entries.get(name);
        return entry != null ? entry.deps() : List.of();
    }

    public boolean isTerminal(String name) {
        Entry entry = entries.get(name);
        return entry != null && entry.terminal();
    }

    public Map<String, Entry> asMap() {
        return entries;
    }

    public Set<String> getDuplicates() {
        return duplicates;
    }

    public int size() {
        return entries.size();
    }
}
