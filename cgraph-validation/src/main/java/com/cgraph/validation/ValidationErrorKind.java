package com.cgraph.validation;

public enum ValidationErrorKind {
    /** A task names a dependency that is not a task of the graph. */
    MISSING_DEPENDENCY,
    /** Dependencies form a cycle. */
    CIRCULAR_DEPENDENCY,
    /** Two atomics share a name (reported in strict mode only). */
    DUPLICATE_TASK
}
