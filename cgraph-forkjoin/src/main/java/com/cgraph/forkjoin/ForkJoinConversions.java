package com.cgraph.forkjoin;

import com.cgraph.forkjoin.cfg.ControlFlowGraph;
import com.cgraph.forkjoin.lowering.ForkJoinLowering;
import com.cgraph.forkjoin.structure.RegionStructurer;
import com.cgraph.forkjoin.structure.StructuringLimits;
import com.cgraph.model.forkjoin.ForkJoinGraph;
import com.cgraph.model.ir.IrGraph;

/**
 * Fork-Join to IR (CFG, then structuring) and IR to Fork-Join (lowering).
 * Neither direction throws on malformed Fork-Join input.
 */
public final class ForkJoinConversions {

    private ForkJoinConversions() {
    }

    public static IrGraph toIr(ForkJoinGraph graph) {
        return toIr(graph, StructuringLimits.DEFAULT);
    }

    public static IrGraph toIr(ForkJoinGraph graph, StructuringLimits limits) {
        return new RegionStructurer(ControlFlowGraph.from(graph), limits).structureToIr();
    }

    /** Dependencies are dropped; terminal tasks become {@code goto end}. */
    public static ForkJoinGraph fromIr(IrGraph graph) {
        return ForkJoinLowering.lower(graph);
    }
}
