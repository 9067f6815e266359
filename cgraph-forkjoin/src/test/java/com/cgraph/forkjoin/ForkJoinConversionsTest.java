package com.cgraph.forkjoin;

import com.cgraph.model.ir.IrGraph;
import com.cgraph.model.ir.IrNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cgraph.model.ir.IrNode.atomic;
import static com.cgraph.model.ir.IrNode.parallel;
import static com.cgraph.model.ir.IrNode.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ForkJoinConversionsTest {

    private static void assertRoundTrip(IrGraph graph) {
        assertEquals(graph, ForkJoinConversions.toIr(ForkJoinConversions.fromIr(graph)), graph.toString());
    }

    @Test
    void structuredGraphsSurviveRoundTrip() {
        List<IrGraph> graphs = List.of(
                IrGraph.of(atomic("a"), atomic("b")),
                IrGraph.of(atomic("a"), parallel(atomic("b"), sequence(atomic("c"), atomic("d"))), atomic("e")),
                IrGraph.of(parallel(atomic("a"), parallel(atomic("b"), atomic("c")), atomic("d"))),
                IrGraph.of(parallel(parallel(atomic("a"), atomic("b")), atomic("c"))),
                IrGraph.of(atomic("s0"),
                        parallel(sequence(atomic("s1"), parallel(atomic("s2"), atomic("s3"))), atomic("s4")),
                        atomic("s5")),
                IrGraph.of(parallel(atomic("a"), atomic("b")), parallel(atomic("c"), atomic("d"), atomic("e"))));
        graphs.forEach(ForkJoinConversionsTest::assertRoundTrip);
    }

    @Test
    void redundantNestingIsNormalized() {
        IrGraph nested = IrGraph.of(sequence(atomic("a"), sequence(atomic("b"))), parallel(atomic("c")));
        assertEquals("$a,b,c$", ForkJoinConversions.toIr(ForkJoinConversions.fromIr(nested)).toString());
    }

    @Test
    void terminalCutsStructuralSuccessors() {
        IrGraph graph = IrGraph.of(IrNode.terminal("x"), atomic("y"));
        assertEquals("$x$", ForkJoinConversions.toIr(ForkJoinConversions.fromIr(graph)).toString());
    }
}
