package com.cgraph.forkjoin.structure;

import java.util.Objects;

/**
 * Termination bounds for structuring malformed or adversarial Fork-Join programs.
 * Exceeding either bound yields a partial result and a warning, never an exception.
 * All values must be positive.
 */
public final class StructuringLimits {

    /** Default: fork nesting depth 64, 10 000 statements per path. */
    public static final StructuringLimits DEFAULT = new StructuringLimits(64, 10_000);

    private final int maxNestingDepth;
    private final int maxBranchSteps;

    public StructuringLimits(int maxNestingDepth, int maxBranchSteps) {
        this.maxNestingDepth = requirePositive(maxNestingDepth, "maxNestingDepth");
        this.maxBranchSteps = requirePositive(maxBranchSteps, "maxBranchSteps");
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    /** Max nesting of parallel regions (top-level fork has depth 1). */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    /** Max statements followed on one path before it is cut off. */
    public int getMaxBranchSteps() {
        return maxBranchSteps;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructuringLimits that = (StructuringLimits) o;
        return maxNestingDepth == that.maxNestingDepth && maxBranchSteps == that.maxBranchSteps;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxNestingDepth, maxBranchSteps);
    }

    @Override
    public String toString() {
        return "StructuringLimits{maxNestingDepth=" + maxNestingDepth + ", maxBranchSteps=" + maxBranchSteps + "}";
    }
}
