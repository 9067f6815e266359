package com.cgraph.model.forkjoin;

/** Instruction kinds of the Fork-Join notation. */
public enum ForkJoinInstructionType {
    /** Named task. */
    ATOMIC,
    /** Start a concurrent branch at the target label; execution also continues with the next statement. */
    FORK,
    /** Join point, optionally carrying an id. Structuring treats it as a plain pass-through. */
    JOIN,
    /** Unconditional jump to the target label; {@code goto end} terminates the path. */
    GOTO
}
