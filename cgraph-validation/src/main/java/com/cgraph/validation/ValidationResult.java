package com.cgraph.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of dependency validation: either the validated graph, or every error found
 * (missing dependencies first, then cycles, then duplicates).
 */
public final class ValidationResult {

    private final ValidatedGraph graph;
    private final List<ValidationError> errors;

    private ValidationResult(ValidatedGraph graph, List<ValidationError> errors) {
        this.graph = graph;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static ValidationResult success(ValidatedGraph graph) {
        return new ValidationResult(Objects.requireNonNull(graph, "graph"), List.of());
    }

    public static ValidationResult failure(List<ValidationError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("failure requires at least one error");
        }
        return new ValidationResult(null, errors);
    }

    public boolean isValid() {
        return graph != null;
    }

    /** The validated graph; null when {@link #isValid()} is false. */
    public ValidatedGraph getGraph() {
        return graph;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public List<String> getErrorMessages() {
        return errors.stream().map(ValidationError::getMessage).collect(Collectors.toList());
    }

    public List<ValidationError> getErrors(ValidationErrorKind kind) {
        return errors.stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
    }
}
