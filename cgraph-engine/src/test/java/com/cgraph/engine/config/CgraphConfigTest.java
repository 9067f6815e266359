package com.cgraph.engine.config;

import com.cgraph.forkjoin.structure.StructuringLimits;
import com.cgraph.validation.ValidationOptions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CgraphConfigTest {

    @Test
    void defaultsWhenUnset() {
        CgraphConfig config = CgraphConfig.fromEnvironment(Map.of());

        assertEquals(StructuringLimits.DEFAULT, config.toStructuringLimits());
        assertFalse(config.isStrictDuplicates());
        assertEquals(ValidationOptions.DEFAULT, config.toValidationOptions());
    }

    @Test
    void readsVariables() {
        CgraphConfig config = CgraphConfig.fromEnvironment(Map.of(
                "CGRAPH_MAX_NESTING_DEPTH", " 8 ",
                "CGRAPH_MAX_BRANCH_STEPS", "500",
                "CGRAPH_STRICT_DUPLICATES", "TRUE"));

        assertEquals(new StructuringLimits(8, 500), config.toStructuringLimits());
        assertTrue(config.isStrictDuplicates());
        assertEquals(ValidationOptions.STRICT, config.toValidationOptions());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        CgraphConfig config = CgraphConfig.fromEnvironment(Map.of(
                "CGRAPH_MAX_NESTING_DEPTH", "deep",
                "CGRAPH_MAX_BRANCH_STEPS", "-3",
                "CGRAPH_STRICT_DUPLICATES", "yes"));

        assertEquals(StructuringLimits.DEFAULT.getMaxNestingDepth(), config.getMaxNestingDepth());
        assertEquals(StructuringLimits.DEFAULT.getMaxBranchSteps(), config.getMaxBranchSteps());
        assertFalse(config.isStrictDuplicates());
    }

    @Test
    void builderRejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> CgraphConfig.builder().maxNestingDepth(0).build());
        assertEquals(3, CgraphConfig.builder().maxBranchSteps(3).build().getMaxBranchSteps());
    }
}
