package com.cgraph.model.forkjoin;

import java.util.Objects;

/** A Fork-Join instruction with an optional label. Immutable. */
public final class ForkJoinStatement {

    private final String label;
    private final ForkJoinInstruction instruction;

    public ForkJoinStatement(String label, ForkJoinInstruction instruction) {
        if (label != null && label.isBlank()) {
            throw new IllegalArgumentException("Fork-Join label must not be blank");
        }
        this.label = label;
        this.instruction = Objects.requireNonNull(instruction, "instruction");
    }

    public static ForkJoinStatement of(ForkJoinInstruction instruction) {
        return new ForkJoinStatement(null, instruction);
    }

    public static ForkJoinStatement labeled(String label, ForkJoinInstruction instruction) {
        return new ForkJoinStatement(Objects.requireNonNull(label, "label"), instruction);
    }

    /** Label of this statement, or null. */
    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return label != null;
    }

    public ForkJoinInstruction getInstruction() {
        return instruction;
    }

    public ForkJoinInstructionType getType() {
        return instruction.getType();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ForkJoinStatement that = (ForkJoinStatement) o;
        return Objects.equals(label, that.label) && instruction.equals(that.instruction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, instruction);
    }

    @Override
    public String toString() {
        return label == null ? instruction.toString() : label + ": " + instruction;
    }
}
