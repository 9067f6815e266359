package com.cgraph.forkjoin.lowering;

import com.cgraph.model.forkjoin.ForkJoinGraph;
import com.cgraph.model.forkjoin.ForkJoinInstruction;
import com.cgraph.model.forkjoin.ForkJoinStatement;
import com.cgraph.model.ir.IrGraph;
import com.cgraph.model.ir.IrNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Emits linear Fork-Join code for an IR graph.
 * <p>
 * A parallel with k &ge; 2 non-empty branches gets join label {@code L<n>} from a counter shared
 * by the whole tree. Every branch but the first is forked to {@code L<firstTask>_<n>} and emitted
 * later as a labelled block ending in {@code goto L<n>}; the first branch is inlined, followed by
 * {@code L<n>: join c<n+1>}. Blocks are appended after the main stream, which is closed with
 * {@code goto end} so it never falls into them.
 * <p>
 * Dependencies are dropped. A terminal task is followed by {@code goto end}.
 * One instance per conversion; not thread-safe.
 */
public final class ForkJoinLowering {

    private static final Logger log = LoggerFactory.getLogger(ForkJoinLowering.class);

    private final List<ForkJoinStatement> main = new ArrayList<>();
    private final List<DeferredBlock> deferred = new ArrayList<>();
    private final Set<String> labels = new HashSet<>();
    private int counter;

    private ForkJoinLowering() {
    }

    public static ForkJoinGraph lower(IrGraph graph) {
        Objects.requireNonNull(graph, "graph");
        return new ForkJoinLowering().run(graph);
    }

    private ForkJoinGraph run(IrGraph graph) {
        for (IrNode node : graph.getNodes()) {
            emit(node, main);
        }
        List<ForkJoinStatement> out = new ArrayList<>(main);
        if (!deferred.isEmpty() && !endsWithGotoEnd(out)) {
            out.add(ForkJoinStatement.of(ForkJoinInstruction.gotoEnd()));
        }
        for (DeferredBlock block : deferred) {
            // bodies start with an unlabelled task or fork
            ForkJoinStatement first = block.body.get(0);
            out.add(ForkJoinStatement.labeled(block.label, first.getInstruction()));
            out.addAll(block.body.subList(1, block.body.size()));
        }
        log.debug("Lowered {} top-level nodes to {} statements ({} parallel regions, {} deferred blocks)",
                graph.getNodes().size(), out.size(), counter, deferred.size());
        return new ForkJoinGraph(out);
    }

    private void emit(IrNode node, List<ForkJoinStatement> out) {
        switch (node.getType()) {
            case ATOMIC -> {
                out.add(ForkJoinStatement.of(ForkJoinInstruction.atomic(node.getName())));
                if (node.isTerminal()) {
                    out.add(ForkJoinStatement.of(ForkJoinInstruction.gotoEnd()));
                }
            }
            case SEQUENCE -> {
                for (IrNode child : node.getChildren()) {
                    emit(child, out);
                }
            }
            case PARALLEL -> emitParallel(node.getChildren(), out);
        }
    }

    private void emitParallel(List<IrNode> allBranches, List<ForkJoinStatement> out) {
        List<IrNode> branches = new ArrayList<>();
        for (IrNode branch : allBranches) {
            if (firstTask(branch) != null) {
                branches.add(branch);
            }
        }
        if (branches.isEmpty()) return;
        if (branches.size() == 1) {
            emit(branches.get(0), out);
            return;
        }

        int n = counter++;
        String joinLabel = reserve("L" + n);
        List<String> forkLabels = new ArrayList<>();
        for (IrNode branch : branches.subList(1, branches.size())) {
            String label = reserve("L" + firstTask(branch) + "_" + n);
            forkLabels.add(label);
            out.add(ForkJoinStatement.of(ForkJoinInstruction.fork(label)));
        }

        emit(branches.get(0), out);
        out.add(ForkJoinStatement.labeled(joinLabel, ForkJoinInstruction.join("c" + (n + 1))));

        for (int i = 1; i < branches.size(); i++) {
            DeferredBlock block = new DeferredBlock(forkLabels.get(i - 1));
            deferred.add(block);
            emit(branches.get(i), block.body);
            block.body.add(ForkJoinStatement.of(ForkJoinInstruction.goTo(joinLabel)));
        }
    }

    /** Label unique within this program; duplicate sibling task names get a numeric suffix. */
    private String reserve(String base) {
        String label = base;
        int suffix = 1;
        while (!labels.add(label)) {
            label = base + "_" + suffix++;
        }
        return label;
    }

    /** Name of the first task in program order, or null when the subtree has none. */
    private static String firstTask(IrNode node) {
        if (node.isAtomic()) return node.getName();
        for (IrNode child : node.getChildren()) {
            String name = firstTask(child);
            if (name != null) return name;
        }
        return null;
    }

    private static boolean endsWithGotoEnd(List<ForkJoinStatement> statements) {
        return !statements.isEmpty() && statements.get(statements.size() - 1).getInstruction().isGotoEnd();
    }

    private static final class DeferredBlock {
        private final String label;
        private final List<ForkJoinStatement> body = new ArrayList<>();

        DeferredBlock(String label) {
            this.label = label;
        }
    }
}
