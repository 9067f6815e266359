package com.cgraph.validation;

/** Switches for {@link DependencyValidator}. */
public final class ValidationOptions {

    /** Duplicate task names overwrite earlier ones with a warning. */
    public static final ValidationOptions DEFAULT = new ValidationOptions(false);

    /** Duplicate task names are errors. */
    public static final ValidationOptions STRICT = new ValidationOptions(true);

    private final boolean strictDuplicates;

    public ValidationOptions(boolean strictDuplicates) {
        this.strictDuplicates = strictDuplicates;
    }

    public boolean isStrictDuplicates() {
        return strictDuplicates;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return strictDuplicates == ((ValidationOptions) o).strictDuplicates;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(strictDuplicates);
    }

    @Override
    public String toString() {
        return "ValidationOptions{strictDuplicates=" + strictDuplicates + "}";
    }
}
