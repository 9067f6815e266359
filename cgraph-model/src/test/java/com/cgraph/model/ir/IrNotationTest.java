package com.cgraph.model.ir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IrNotationTest {

    @Test
    void writesNestedGraphWithDepsAndTerminal() {
        IrGraph graph = IrGraph.of(
                IrNode.atomic("a"),
                IrNode.parallel(IrNode.atomic("b"), IrNode.sequence(IrNode.atomic("c"), IrNode.atomic("e"))),
                IrNode.atomic("d", List.of("a", "b"), true));

        assertEquals("$a,{b,[c,e]},d#{a,b}!$", IrNotation.write(graph));
        assertEquals("$a,{b,[c,e]},d#{a,b}!$", graph.toString());
    }

    @Test
    void writesEmptyGraphAndEmptyContainers() {
        assertEquals("$$", IrNotation.write(IrGraph.of()));
        assertEquals("$[],{}$", IrNotation.write(IrGraph.of(IrNode.sequence(), IrNode.parallel())));
    }

    @Test
    void atomicRequiresName() {
        assertThrows(IllegalArgumentException.class, () -> IrNode.atomic(" "));
        assertThrows(IllegalArgumentException.class, () -> IrNode.atomic(null));
    }

    @Test
    void containersCarryNoTaskData() {
        IrNode seq = IrNode.sequence(IrNode.atomic("a"));
        assertNull(seq.getName());
        assertTrue(seq.getDeps().isEmpty());
        assertFalse(seq.isTerminal());
        assertFalse(seq.isAtomic());
        assertThrows(IllegalArgumentException.class,
                () -> new IrNode(IrNodeType.PARALLEL, null, List.of("x"), false, List.of()));
    }

    @Test
    void equalityIsStructural() {
        assertEquals(IrNode.dependent("b", "a"), IrNode.atomic("b", List.of("a"), false));
        assertEquals(IrGraph.of(IrNode.terminal("x")), IrGraph.of(IrNode.atomic("x", List.of(), true)));
    }
}
