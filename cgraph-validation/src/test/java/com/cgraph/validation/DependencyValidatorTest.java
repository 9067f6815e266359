package com.cgraph.validation;

import com.cgraph.model.ir.IrGraph;
import com.cgraph.model.ir.IrNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.cgraph.model.ir.IrNode.atomic;
import static com.cgraph.model.ir.IrNode.dependent;
import static com.cgraph.model.ir.IrNode.parallel;
import static com.cgraph.model.ir.IrNode.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyValidatorTest {

    private final DependencyValidator validator = new DependencyValidator();

    @Test
    void resolvedDependencyValidates() {
        IrGraph graph = IrGraph.of(atomic("s0"), dependent("s1", "s0"));
        ValidationResult result = validator.validate(graph);

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertSame(graph, result.getGraph().getGraph());
    }

    @Test
    void missingDependencyNamesTaskAndDependency() {
        ValidationResult result = validator.validate(IrGraph.of(dependent("a", "b")));

        assertFalse(result.isValid());
        assertNull(result.getGraph());
        assertEquals(1, result.getErrors().size());
        ValidationError error = result.getErrors().get(0);
        assertEquals(ValidationErrorKind.MISSING_DEPENDENCY, error.getKind());
        assertEquals(List.of("a", "b"), error.getTasks());
        assertEquals("Node 'a' depends on 'b' which doesn't exist", error.getMessage());
    }

    @Test
    void threeTaskCycleReportedOnce() {
        IrGraph graph = IrGraph.of(dependent("s0", "s1"), dependent("s1", "s2"), dependent("s2", "s0"));
        ValidationResult result = validator.validate(graph);

        assertEquals(1, result.getErrors().size());
        ValidationError error = result.getErrors().get(0);
        assertEquals(ValidationErrorKind.CIRCULAR_DEPENDENCY, error.getKind());
        assertEquals(List.of("s0", "s1", "s2", "s0"), error.getTasks());
        assertEquals("Circular dependency: s0 -> s1 -> s2 -> s0", error.getMessage());
    }

    @Test
    void cyclePathStartsAtRepeatedName() {
        IrGraph graph = IrGraph.of(dependent("a", "b"), dependent("b", "c"), dependent("c", "b"));
        ValidationError error = validator.validate(graph).getErrors().get(0);
        assertEquals(List.of("b", "c", "b"), error.getTasks());
    }

    @Test
    void selfDependencyIsACycle() {
        ValidationResult result = validator.validate(IrGraph.of(dependent("a", "a")));
        assertEquals(List.of("a", "a"), result.getErrors().get(0).getTasks());
    }

    @Test
    void allErrorsCollectedMissingBeforeCircular() {
        IrGraph graph = IrGraph.of(
                parallel(dependent("x", "y"), dependent("y", "x")),
                sequence(dependent("m", "ghost"), dependent("n", "ghost2")));
        ValidationResult result = validator.validate(graph);

        assertEquals(List.of(
                "Node 'm' depends on 'ghost' which doesn't exist",
                "Node 'n' depends on 'ghost2' which doesn't exist",
                "Circular dependency: x -> y -> x"), result.getErrorMessages());
    }

    @Test
    void independentCyclesReportedPerRoot() {
        IrGraph graph = IrGraph.of(dependent("a", "b"), dependent("b", "a"), dependent("c", "d"), dependent("d", "c"));
        assertEquals(2, validator.validate(graph).getErrors(ValidationErrorKind.CIRCULAR_DEPENDENCY).size());
    }

    @Test
    void sharedDependencyIsNotACycle() {
        IrGraph graph = IrGraph.of(atomic("base"), dependent("l", "base"), dependent("r", "base"), dependent("top", "l", "r"));
        assertTrue(validator.validate(graph).isValid());
    }

    @Test
    void duplicatesLenientByDefaultStrictOnRequest() {
        IrGraph graph = IrGraph.of(atomic("a"), parallel(atomic("b"), atomic("a")));

        assertTrue(validator.validate(graph).isValid());

        ValidationResult strict = new DependencyValidator(ValidationOptions.STRICT).validate(graph);
        assertFalse(strict.isValid());
        assertEquals(List.of(ValidationError.duplicateTask("a")), strict.getErrors());
    }

    @Test
    void validateOrThrowCarriesErrors() {
        InvalidGraphException e = assertThrows(InvalidGraphException.class,
                () -> validator.validateOrThrow(IrGraph.of(dependent("a", "b"), dependent("c", "d"))));

        assertEquals(2, e.getValidationResult().getErrors().size());
        assertTrue(e.getMessage().contains("'b'"));
        assertTrue(e.getMessage().contains("'d'"));
        assertNotNull(validator.validateOrThrow(IrGraph.of(IrNode.terminal("z"))));
    }

    @Test
    void longDependencyChainValidates() {
        List<IrNode> nodes = new ArrayList<>();
        for (int i = 19_999; i > 0; i--) {
            nodes.add(dependent("s" + i, "s" + (i - 1)));
        }
        nodes.add(atomic("s0"));

        assertTrue(validator.validate(new IrGraph(nodes)).isValid());
    }

    @Test
    void cycleAtTheEndOfALongChainKeepsItsPath() {
        List<IrNode> nodes = new ArrayList<>();
        for (int i = 0; i < 5_000; i++) {
            nodes.add(dependent("s" + i, "s" + (i + 1)));
        }
        nodes.add(dependent("s5000", "s4999"));

        ValidationResult result = validator.validate(new IrGraph(nodes));
        assertEquals(1, result.getErrors().size());
        assertEquals(List.of("s4999", "s5000", "s4999"), result.getErrors().get(0).getTasks());
    }
}
