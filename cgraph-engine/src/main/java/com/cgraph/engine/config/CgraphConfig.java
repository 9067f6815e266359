package com.cgraph.engine.config;

import com.cgraph.forkjoin.structure.StructuringLimits;
import com.cgraph.validation.ValidationOptions;

import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables.
 * <p>
 * Structuring bounds: CGRAPH_MAX_NESTING_DEPTH, CGRAPH_MAX_BRANCH_STEPS.
 * Validation: CGRAPH_STRICT_DUPLICATES ({@code true} or {@code 1} makes duplicate task names an error).
 * Unset, blank or unparsable values fall back to the defaults.
 */
public final class CgraphConfig {

    private static final String ENV_MAX_NESTING_DEPTH = "CGRAPH_MAX_NESTING_DEPTH";
    private static final String ENV_MAX_BRANCH_STEPS = "CGRAPH_MAX_BRANCH_STEPS";
    private static final String ENV_STRICT_DUPLICATES = "CGRAPH_STRICT_DUPLICATES";

    private static final int DEFAULT_MAX_NESTING_DEPTH = StructuringLimits.DEFAULT.getMaxNestingDepth();
    private static final int DEFAULT_MAX_BRANCH_STEPS = StructuringLimits.DEFAULT.getMaxBranchSteps();
    private static final boolean DEFAULT_STRICT_DUPLICATES = false;

    private final StructuringLimits structuringLimits;
    private final boolean strictDuplicates;

    private CgraphConfig(Builder b) {
        this.structuringLimits = new StructuringLimits(b.maxNestingDepth, b.maxBranchSteps);
        this.strictDuplicates = b.strictDuplicates;
    }

    public static CgraphConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} over the given variables. */
    public static CgraphConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .maxNestingDepth(parsePositiveInt(env.get(ENV_MAX_NESTING_DEPTH), DEFAULT_MAX_NESTING_DEPTH))
                .maxBranchSteps(parsePositiveInt(env.get(ENV_MAX_BRANCH_STEPS), DEFAULT_MAX_BRANCH_STEPS))
                .strictDuplicates(parseBoolean(env.get(ENV_STRICT_DUPLICATES), DEFAULT_STRICT_DUPLICATES))
                .build();
    }

    public static CgraphConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxNestingDepth() {
        return structuringLimits.getMaxNestingDepth();
    }

    public int getMaxBranchSteps() {
        return structuringLimits.getMaxBranchSteps();
    }

    public boolean isStrictDuplicates() {
        return strictDuplicates;
    }

    public StructuringLimits toStructuringLimits() {
        return structuringLimits;
    }

    public ValidationOptions toValidationOptions() {
        return strictDuplicates ? ValidationOptions.STRICT : ValidationOptions.DEFAULT;
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "CgraphConfig{maxNestingDepth=" + getMaxNestingDepth()
                + ", maxBranchSteps=" + getMaxBranchSteps()
                + ", strictDuplicates=" + strictDuplicates + "}";
    }

    public static final class Builder {
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private int maxBranchSteps = DEFAULT_MAX_BRANCH_STEPS;
        private boolean strictDuplicates = DEFAULT_STRICT_DUPLICATES;

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder maxBranchSteps(int maxBranchSteps) {
            this.maxBranchSteps = maxBranchSteps;
            return this;
        }

        public Builder strictDuplicates(boolean strictDuplicates) {
            this.strictDuplicates = strictDuplicates;
            return this;
        }

        /** @throws IllegalArgumentException when a limit is not positive */
        public CgraphConfig build() {
            return new CgraphConfig(this);
        }
    }
}
