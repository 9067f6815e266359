package com.cgraph.validation;

import com.cgraph.model.ir.IrGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks that every dependency names a task of the graph and that dependencies form no cycle.
 * All checks run; errors are collected, not thrown one at a time.
 * <p>
 * Cycle search walks task to dependency in first-seen order and reports at most one cycle per
 * unvisited start task.
 */
public final class DependencyValidator {

    private static final Logger log = LoggerFactory.getLogger(DependencyValidator.class);

    private final ValidationOptions options;

    public DependencyValidator() {
        this(ValidationOptions.DEFAULT);
    }

    public DependencyValidator(ValidationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public ValidationResult validate(IrGraph graph) {
        DependencyMap map = DependencyMap.flatten(graph);
        List<ValidationError> errors = new ArrayList<>();
        checkMissing(map, errors);
        checkCycles(map, errors);
        if (options.isStrictDuplicates()) {
            for (String name : map.getDuplicates()) {
                errors.add(ValidationError.duplicateTask(name));
            }
        }
        if (!errors.isEmpty()) {
            log.debug("Validation of {} tasks failed with {} errors", map.size(), errors.size());
            return ValidationResult.failure(errors);
        }
        log.debug("Validated {} tasks", map.size());
        return ValidationResult.success(new ValidatedGraph(graph, map));
    }

    /**
     * Validates and returns the graph.
     *
     * @throws InvalidGraphException carrying all errors when validation fails
     */
    public ValidatedGraph validateOrThrow(IrGraph graph) {
        ValidationResult result = validate(graph);
        if (!result.isValid()) {
            throw new InvalidGraphException(result);
        }
        return result.getGraph();
    }

    private static void checkMissing(DependencyMap map, List<ValidationError> errors) {
        for (String name : map.names()) {
            for (String dep : map.depsOf(name)) {
                if (!map.contains(dep)) {
                    errors.add(ValidationError.missingDependency(name, dep));
                }
            }
        }
    }

    private static void checkCycles(DependencyMap map, List<ValidationError> errors) {
        Set<String> visited = new HashSet<>();
        for (String root : map.names()) {
            if (visited.contains(root)) continue;
            List<String> cycle = findCycle(root, map, visited);
            if (cycle != null) {
                errors.add(ValidationError.circularDependency(cycle));
            }
        }
    }

    /**
     * Depth-first from {@code root}; returns the first cycle closed against the current path, or null.
     * Driven by an explicit frame stack so long dependency chains do not grow the call stack.
     */
    private static List<String> findCycle(String root, DependencyMap map, Set<String> visited) {
        List<String> path = new ArrayList<>();
        Map<String, Integer> onPath = new HashMap<>();
        Deque<Frame> frames = new ArrayDeque<>();
        visited.add(root);
        onPath.put(root, 0);
        path.add(root);
        frames.push(new Frame(map.depsOf(root)));
        while (!frames.isEmpty()) {
            Frame top = frames.peek();
            if (top.next >= top.deps.size()) {
                frames.pop();
                onPath.remove(path.remove(path.size() - 1));
                continue;
            }
            String dep = top.deps.get(top.next++);
            Integer start = onPath.get(dep);
            if (start != null) {
                List<String> cycle = new ArrayList<>(path.subList(start, path.size()));
                cycle.add(dep);
                return cycle;
            }
            if (map.contains(dep) && visited.add(dep)) {
                onPath.put(dep, path.size());
                path.add(dep);
                frames.push(new Frame(map.depsOf(dep)));
            }
        }
        return null;
    }

    /** Dependencies of a task on the search path and the index of the next one to follow. */
    private static final class Frame {

        private final List<String> deps;
        private int next;

        Frame(List<String> deps) {
            this.deps = deps;
        }
    }
}
