package com.cgraph.validation;

/**
 * Thrown when a graph fails dependency validation where a valid graph is required.
 * The message joins all error messages.
 */
public final class InvalidGraphException extends RuntimeException {

    private final ValidationResult validationResult;

    public InvalidGraphException(ValidationResult validationResult) {
        super(validationResult != null ? String.join("; ", validationResult.getErrorMessages()) : "Graph validation failed");
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
