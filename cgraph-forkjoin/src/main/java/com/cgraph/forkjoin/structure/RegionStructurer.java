package com.cgraph.forkjoin.structure;

import com.cgraph.forkjoin.cfg.ControlFlowGraph;
import com.cgraph.model.ir.IrGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.cgraph.forkjoin.cfg.ControlFlowGraph.NONE;

/**
 * Recovers nested sequential/parallel structure from a Fork-Join CFG, starting at statement 0.
 * <p>
 * Joins and gotos are transparent; a fork opens a parallel region whose branches are the
 * continuation and every resolved fork target of its group. Each branch is built with its own
 * visited set, stops at the group's convergence point, and is merged into the enclosing set once
 * complete. Structuring then resumes at the convergence point.
 * <p>
 * Never throws on malformed programs: unreachable code is ignored, loops stop at visited statements
 * and exceeding {@link StructuringLimits} cuts the affected path short with a warning.
 * One instance per conversion; not thread-safe.
 */
public final class RegionStructurer {

    private static final Logger log = LoggerFactory.getLogger(RegionStructurer.class);

    private final ControlFlowGraph cfg;
    private final StructuringLimits limits;
    private final ConvergenceAnalyzer analyzer;

    public RegionStructurer(ControlFlowGraph cfg, StructuringLimits limits) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.analyzer = new ConvergenceAnalyzer(cfg, limits.getMaxNestingDepth(), limits.getMaxBranchSteps());
    }

    public Region structure() {
        Region region = buildPath(0, Set.of(), new Visited(null), 0);
        log.debug("Structured {} statements into region={}", cfg.size(), region);
        return region;
    }

    public IrGraph structureToIr() {
        return structure().toIrGraph();
    }

    private Region buildPath(int start, Set<Integer> stops, Visited visited, int depth) {
        List<Region> parts = new ArrayList<>();
        int i = start;
        int steps = 0;
        while (cfg.contains(i) && !stops.contains(i) && !visited.contains(i)) {
            if (++steps > limits.getMaxBranchSteps()) {
                log.warn("Path from statement={} exceeds maxBranchSteps={}; result truncated", start, limits.getMaxBranchSteps());
                break;
            }
            visited.add(i);
            switch (cfg.statement(i).getType()) {
                case ATOMIC -> {
                    parts.add(Region.atomic(cfg.statement(i).getInstruction().getName()));
                    i = cfg.fallThrough(i);
                }
                case JOIN -> i = cfg.fallThrough(i);
                case GOTO -> i = cfg.jumpTarget(i);
                case FORK -> {
                    ForkResult fork = structureFork(i, stops, visited, depth + 1);
                    if (!fork.region().isEmpty()) {
                        parts.add(fork.region());
                    }
                    i = fork.convergence();
                }
            }
        }
        return Region.sequence(parts);
    }

    private ForkResult structureFork(int fork, Set<Integer> stops, Visited visited, int depth) {
        if (depth > limits.getMaxNestingDepth()) {
            log.warn("Fork at statement={} exceeds maxNestingDepth={}; branches dropped", fork, limits.getMaxNestingDepth());
            return new ForkResult(Region.EMPTY, NONE);
        }
        ConvergenceAnalyzer.ForkGroup group = analyzer.forkGroup(fork);
        group.forks().forEach(visited::add);

        Set<Integer> branchStops = new HashSet<>(stops);
        if (group.hasConvergence()) {
            branchStops.add(group.convergence());
        }
        List<Region> branches = new ArrayList<>();
        for (int entry : group.entries()) {
            Visited local = visited.child();
            Region branch = buildPath(entry, branchStops, local, depth);
            local.mergeIntoParent();
            if (!branch.isEmpty()) {
                branches.add(branch);
            }
        }
        log.debug("Fork group={} entries={} convergence={} branches={}",
                group.forks(), group.entries(), group.convergence(), branches.size());
        Region region = branches.isEmpty() ? Region.EMPTY : Region.parallel(branches);
        return new ForkResult(region, group.convergence());
    }

    private record ForkResult(Region region, int convergence) {
    }

    /** Visited statements of one path; sees everything its enclosing paths have visited. */
    private static final class Visited {

        private final Visited parent;
        private final Set<Integer> local = new HashSet<>();

        Visited(Visited parent) {
            this.parent = parent;
        }

        boolean contains(int index) {
            return local.contains(index) || (parent != null && parent.contains(index));
        }

        void add(int index) {
            local.add(index);
        }

        Visited child() {
            return new Visited(this);
        }

        void mergeIntoParent() {
            if (parent != null) {
                parent.local.addAll(local);
            }
        }
    }
}
