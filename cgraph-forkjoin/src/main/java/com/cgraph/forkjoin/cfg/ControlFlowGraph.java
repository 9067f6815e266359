package com.cgraph.forkjoin.cfg;

import com.cgraph.model.forkjoin.ForkJoinGraph;
import com.cgraph.model.forkjoin.ForkJoinInstruction;
import com.cgraph.model.forkjoin.ForkJoinInstructionType;
import com.cgraph.model.forkjoin.ForkJoinStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Control-flow graph over the statements of a Fork-Join program. Statements are addressed by their
 * index in the program; edges reference indices only, so cyclic programs need no object links.
 * <p>
 * Goto to {@code end} or to an unknown label has no successor. Unknown fork and goto targets are
 * kept in {@link #getUnresolvedTargets()} rather than rejected.
 */
public final class ControlFlowGraph {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowGraph.class);

    /** Sentinel index for "no such statement". */
    public static final int NONE = -1;

    private final List<ForkJoinStatement> statements;
    private final Map<String, Integer> labelIndex;
    private final List<List<Integer>> successors;
    private final List<CfgEdge> edges;
    private final List<String> unresolvedTargets;

    private ControlFlowGraph(List<ForkJoinStatement> statements,
                             Map<String, Integer> labelIndex,
                             List<List<Integer>> successors,
                             List<CfgEdge> edges,
                             List<String> unresolvedTargets) {
        this.statements = statements;
        this.labelIndex = Collections.unmodifiableMap(labelIndex);
        this.successors = successors;
        this.edges = List.copyOf(edges);
        this.unresolvedTargets = List.copyOf(unresolvedTargets);
    }

    public static ControlFlowGraph from(ForkJoinGraph graph) {
        Objects.requireNonNull(graph, "graph");
        List<ForkJoinStatement> statements = graph.getStatements();
        int n = statements.size();

        Map<String, Integer> labelIndex = new HashMap<>();
        for (int i = 0; i < n; i++) {
            ForkJoinStatement st = statements.get(i);
            if (st.hasLabel()) {
                labelIndex.put(st.getLabel(), i);
            }
        }

        List<List<Integer>> successors = new ArrayList<>(n);
        List<CfgEdge> edges = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            ForkJoinInstruction instr = statements.get(i).getInstruction();
            List<Integer> succ = new ArrayList<>(2);
            switch (instr.getType()) {
                case ATOMIC, JOIN -> {
                    if (i + 1 < n) {
                        succ.add(i + 1);
                        edges.add(new CfgEdge(i, i + 1, CfgEdgeKind.FALL_THROUGH));
                    }
                }
                case FORK -> {
                    if (i + 1 < n) {
                        succ.add(i + 1);
                        edges.add(new CfgEdge(i, i + 1, CfgEdgeKind.FALL_THROUGH));
                    }
                    Integer target = labelIndex.get(instr.getTarget());
                    if (target != null) {
                        succ.add(target);
                        edges.add(new CfgEdge(i, target, CfgEdgeKind.FORK));
                    } else {
                        unresolved.add(instr.getTarget());
                        log.debug("Unresolved fork target={} at statement={}", instr.getTarget(), i);
                    }
                }
                case GOTO -> {
                    if (!instr.isGotoEnd()) {
                        Integer target = labelIndex.get(instr.getTarget());
                        if (target != null) {
                            succ.add(target);
                            edges.add(new CfgEdge(i, target, CfgEdgeKind.GOTO));
                        } else {
                            unresolved.add(instr.getTarget());
                            log.debug("Unresolved goto target={} at statement={}", instr.getTarget(), i);
                        }
                    }
                }
            }
            successors.add(List.copyOf(succ));
        }
        return new ControlFlowGraph(statements, labelIndex, List.copyOf(successors), edges, unresolved);
    }

    public int size() {
        return statements.size();
    }

    public boolean contains(int index) {
        return index >= 0 && index < statements.size();
    }

    public ForkJoinStatement statement(int index) {
        return statements.get(index);
    }

    /** Index of the statement carrying {@code label}, or {@link #NONE}. */
    public int indexOf(String label) {
        Integer idx = labelIndex.get(label);
        return idx != null ? idx : NONE;
    }

    /** Successor indices; for a fork the continuation comes first, then the target. */
    public List<Integer> successors(int index) {
        return successors.get(index);
    }

    /** Next statement in program order, or {@link #NONE} past the last statement. */
    public int fallThrough(int index) {
        return contains(index + 1) ? index + 1 : NONE;
    }

    /** Resolved target of a goto, or {@link #NONE} for {@code goto end}, unknown labels and non-gotos. */
    public int jumpTarget(int index) {
        ForkJoinInstruction instr = statements.get(index).getInstruction();
        if (instr.getType() != ForkJoinInstructionType.GOTO || instr.isGotoEnd()) {
            return NONE;
        }
        return indexOf(instr.getTarget());
    }

    /** Resolved target of a fork, or {@link #NONE}. */
    public int forkTarget(int index) {
        ForkJoinInstruction instr = statements.get(index).getInstruction();
        if (instr.getType() != ForkJoinInstructionType.FORK) {
            return NONE;
        }
        return indexOf(instr.getTarget());
    }

    public List<CfgEdge> edges() {
        return edges;
    }

    /** Fork and goto targets naming no label, in program order. {@code end} is never listed. */
    public List<String> getUnresolvedTargets() {
        return unresolvedTargets;
    }
}
