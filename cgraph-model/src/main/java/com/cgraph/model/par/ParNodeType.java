package com.cgraph.model.par;

/**
 * Structural type of a Par node: a named task, a {@code begin ... end} block or a
 * {@code parbegin ... parend} block.
 */
public enum ParNodeType {
    ATOMIC,
    SEQUENCE,
    PARALLEL
}
