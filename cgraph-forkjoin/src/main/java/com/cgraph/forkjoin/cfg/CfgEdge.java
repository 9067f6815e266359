package com.cgraph.forkjoin.cfg;

/** Directed edge between two statement indices. */
public record CfgEdge(int source, int target, CfgEdgeKind kind) {
}
