package com.cgraph.model.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural type of an IR node. The set is closed: every consumer switches over all three values.
 * JSON uses the enum name as string; unknown values are rejected.
 *
 * @see IrNode#getType()
 */
public enum IrNodeType {
    /** Named task, optionally with dependency names and a terminal marker. */
    ATOMIC,
    /** Children run one after another. */
    SEQUENCE,
    /** Children are independent branches running concurrently. */
    PARALLEL;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static IrNodeType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("IR node type is missing");
        }
        String normalized = value.trim().toUpperCase();
        for (IrNodeType t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown IR node type: " + value);
    }
}
