package com.cgraph.validation;

import java.util.List;
import java.util.Objects;

/**
 * One dependency problem found by {@link DependencyValidator}. {@link #getTasks()} lists the names
 * involved: task and missing dependency, the cycle path (start name repeated at the end), or the
 * duplicated name.
 */
public final class ValidationError {

    private final ValidationErrorKind kind;
    private final List<String> tasks;
    private final String message;

    private ValidationError(ValidationErrorKind kind, List<String> tasks, String message) {
        this.kind = kind;
        this.tasks = List.copyOf(tasks);
        this.message = message;
    }

    public static ValidationError missingDependency(String task, String dependency) {
        return new ValidationError(ValidationErrorKind.MISSING_DEPENDENCY, List.of(task, dependency),
                "Node '" + task + "' depends on '" + dependency + "' which doesn't exist");
    }

    public static ValidationError circularDependency(List<String> path) {
        return new ValidationError(ValidationErrorKind.CIRCULAR_DEPENDENCY, path,
                "Circular dependency: " + String.join(" -> ", path));
    }

    public static ValidationError duplicateTask(String task) {
        return new ValidationError(ValidationErrorKind.DUPLICATE_TASK, List.of(task),
                "Duplicate task name: '" + task + "'");
    }

    public ValidationErrorKind getKind() {
        return kind;
    }

    public List<String> getTasks() {
        return tasks;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationError that = (ValidationError) o;
        return kind == that.kind && tasks.equals(that.tasks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, tasks);
    }

    @Override
    public String toString() {
        return message;
    }
}
