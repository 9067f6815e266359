package com.cgraph.execution;

import com.cgraph.model.ir.IrGraph;
import com.cgraph.validation.DependencyValidator;
import org.junit.jupiter.api.Test;

import static com.cgraph.model.ir.IrNode.atomic;
import static com.cgraph.model.ir.IrNode.dependent;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ExecutionGraphWritersTest {

    private static final ExecutionGraph GRAPH = ExecutionGraphBuilder.build(
            new DependencyValidator().validateOrThrow(IrGraph.of(atomic("a"), dependent("b", "a"))));

    @Test
    void jsonUsesEmptyAndDepKinds() {
        assertEquals("{\"nodes\":[\"a\",\"b\"],\"edges\":["
                        + "{\"source\":\"a\",\"target\":\"b\",\"kind\":\"\"},"
                        + "{\"source\":\"a\",\"target\":\"b\",\"kind\":\"dep\"}]}",
                ExecutionGraphJson.toJson(GRAPH));
    }

    @Test
    void dotMarksDependencyEdges() {
        String expected = """
                digraph G {
                  "a";
                  "b";
                  "a" -> "b";
                  "a" -> "b" [style=dashed, label="dep"];
                }
                """;
        assertEquals(expected, ExecutionGraphDot.write(GRAPH));
    }
}
