package com.cgraph.forkjoin.cfg;

import com.cgraph.model.forkjoin.ForkJoinGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cgraph.model.forkjoin.ForkJoinInstruction.atomic;
import static com.cgraph.model.forkjoin.ForkJoinInstruction.fork;
import static com.cgraph.model.forkjoin.ForkJoinInstruction.goTo;
import static com.cgraph.model.forkjoin.ForkJoinInstruction.gotoEnd;
import static com.cgraph.model.forkjoin.ForkJoinInstruction.join;
import static com.cgraph.model.forkjoin.ForkJoinStatement.labeled;
import static com.cgraph.model.forkjoin.ForkJoinStatement.of;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ControlFlowGraphTest {

    private static final ForkJoinGraph PROGRAM = ForkJoinGraph.of(
            of(atomic("a")),          // 0
            of(fork("LB")),           // 1
            of(atomic("c")),          // 2
            labeled("LD", join()),    // 3
            of(atomic("d")),          // 4
            of(gotoEnd()),            // 5
            labeled("LB", atomic("b")), // 6
            of(goTo("LD")));          // 7

    @Test
    void buildsEdgesPerInstructionKind() {
        ControlFlowGraph cfg = ControlFlowGraph.from(PROGRAM);

        assertEquals(List.of(
                new CfgEdge(0, 1, CfgEdgeKind.FALL_THROUGH),
                new CfgEdge(1, 2, CfgEdgeKind.FALL_THROUGH),
                new CfgEdge(1, 6, CfgEdgeKind.FORK),
                new CfgEdge(2, 3, CfgEdgeKind.FALL_THROUGH),
                new CfgEdge(3, 4, CfgEdgeKind.FALL_THROUGH),
                new CfgEdge(4, 5, CfgEdgeKind.FALL_THROUGH),
                new CfgEdge(6, 7, CfgEdgeKind.FALL_THROUGH),
                new CfgEdge(7, 3, CfgEdgeKind.GOTO)), cfg.edges());
        assertEquals(List.of(2, 6), cfg.successors(1));
        assertTrue(cfg.successors(5).isEmpty());
        assertTrue(cfg.getUnresolvedTargets().isEmpty());
    }

    @Test
    void resolvesLabelsAndTargets() {
        ControlFlowGraph cfg = ControlFlowGraph.from(PROGRAM);

        assertEquals(6, cfg.indexOf("LB"));
        assertEquals(ControlFlowGraph.NONE, cfg.indexOf("nope"));
        assertEquals(6, cfg.forkTarget(1));
        assertEquals(3, cfg.jumpTarget(7));
        assertEquals(ControlFlowGraph.NONE, cfg.jumpTarget(5));
        assertEquals(ControlFlowGraph.NONE, cfg.forkTarget(0));
        assertEquals(ControlFlowGraph.NONE, cfg.fallThrough(7));
    }

    @Test
    void unresolvedTargetsAreRecordedNotFatal() {
        ControlFlowGraph cfg = ControlFlowGraph.from(ForkJoinGraph.of(
                of(fork("Lx")),
                of(atomic("a")),
                of(goTo("Ly"))));

        assertEquals(List.of("Lx", "Ly"), cfg.getUnresolvedTargets());
        assertEquals(List.of(1), cfg.successors(0));
        assertTrue(cfg.successors(2).isEmpty());
    }

    @Test
    void lastStatementHasNoFallThrough() {
        ControlFlowGraph cfg = ControlFlowGraph.from(ForkJoinGraph.of(of(atomic("a")), of(fork("L")), labeled("L", atomic("b"))));
        assertTrue(cfg.successors(2).isEmpty());
        assertEquals(3, cfg.edges().size());
        assertEquals(0, ControlFlowGraph.from(ForkJoinGraph.of()).size());
    }
}
