package com.cgraph.forkjoin.cfg;

/** Why control can pass from one statement to another. */
public enum CfgEdgeKind {
    /** Next statement in program order (after ATOMIC, JOIN, and the continuation of FORK). */
    FALL_THROUGH,
    /** Resolved {@code goto} target. */
    GOTO,
    /** Resolved {@code fork} target. */
    FORK
}
