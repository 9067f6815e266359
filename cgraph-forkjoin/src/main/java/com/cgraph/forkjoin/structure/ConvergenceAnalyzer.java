package com.cgraph.forkjoin.structure;

import com.cgraph.forkjoin.cfg.ControlFlowGraph;
import com.cgraph.model.forkjoin.ForkJoinInstructionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.cgraph.forkjoin.cfg.ControlFlowGraph.NONE;

/**
 * Finds where the branches of a fork meet again. Read-only over the CFG; results are memoized
 * per fork index.
 * <p>
 * The convergence of a fork is the first statement on the continuation's spine that the target's
 * spine also reaches. A spine follows fall-through and resolved gotos and skips over nested fork
 * groups by jumping to their convergence. Nested groups are followed at most {@code maxDepth}
 * levels deep; a group beyond that has no convergence and is not memoized.
 */
final class ConvergenceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceAnalyzer.class);

    /** Forks that start concurrently and meet at the same point. */
    record ForkGroup(List<Integer> forks, List<Integer> entries, int convergence) {

        boolean hasConvergence() {
            return convergence != NONE;
        }
    }

    private final ControlFlowGraph cfg;
    private final int maxDepth;
    private final int maxSteps;
    private final Map<Integer, ForkGroup> groups = new HashMap<>();
    private final Map<Integer, Integer> convergences = new HashMap<>();
    private final Set<Integer> inProgress = new HashSet<>();

    ConvergenceAnalyzer(ControlFlowGraph cfg, int maxDepth, int maxSteps) {
        this.cfg = cfg;
        this.maxDepth = maxDepth;
        this.maxSteps = maxSteps;
    }

    /**
     * The group opened by the fork at {@code fork}: the following unlabelled forks that share its
     * convergence, the branch entry points (continuation first, then resolved targets in order)
     * and the shared convergence.
     */
    ForkGroup forkGroup(int fork) {
        return forkGroup(fork, 0);
    }

    private ForkGroup forkGroup(int fork, int depth) {
        ForkGroup cached = groups.get(fork);
        if (cached != null) return cached;
        if (depth > maxDepth) {
            log.warn("Convergence of fork at statement={} exceeds maxNestingDepth={}; treated as open", fork, maxDepth);
            return new ForkGroup(List.of(fork), List.of(), NONE);
        }
        if (!inProgress.add(fork)) {
            // fork reachable from its own branches
            return new ForkGroup(List.of(fork), List.of(), NONE);
        }
        try {
            int convergence = convergence(fork, depth);
            List<Integer> forks = new ArrayList<>();
            forks.add(fork);
            int next = fork + 1;
            while (cfg.contains(next)
                    && cfg.statement(next).getType() == ForkJoinInstructionType.FORK
                    && !cfg.statement(next).hasLabel()
                    && convergence(next, depth) == convergence) {
                forks.add(next);
                next++;
            }
            List<Integer> entries = new ArrayList<>();
            if (cfg.contains(next)) {
                entries.add(next);
            }
            for (int f : forks) {
                int target = cfg.forkTarget(f);
                if (target != NONE) {
                    entries.add(target);
                }
            }
            ForkGroup group = new ForkGroup(List.copyOf(forks), List.copyOf(entries), convergence);
            groups.put(fork, group);
            return group;
        } finally {
            inProgress.remove(fork);
        }
    }

    /** Convergence of a single fork, ignoring any forks that follow it. */
    private int convergence(int fork, int depth) {
        Integer cached = convergences.get(fork);
        if (cached != null) return cached;
        int result = NONE;
        int target = cfg.forkTarget(fork);
        if (target != NONE) {
            Set<Integer> reached = new HashSet<>(spine(target, depth + 1));
            for (int i : spine(fork + 1, depth + 1)) {
                if (reached.contains(i)) {
                    result = i;
                    break;
                }
            }
        }
        convergences.put(fork, result);
        return result;
    }

    /** Statements on the single-threaded path from {@code start}, in order. */
    private List<Integer> spine(int start, int depth) {
        Set<Integer> seen = new LinkedHashSet<>();
        int i = start;
        while (cfg.contains(i) && seen.size() < maxSteps && seen.add(i)) {
            i = switch (cfg.statement(i).getType()) {
                case ATOMIC, JOIN -> cfg.fallThrough(i);
                case GOTO -> cfg.jumpTarget(i);
                case FORK -> forkGroup(i, depth).convergence();
            };
        }
        return new ArrayList<>(seen);
    }
}
