package com.cgraph.model.forkjoin;

import java.util.Objects;

/**
 * One Fork-Join instruction. The single operand is the task name (ATOMIC), the target label
 * (FORK, GOTO) or the optional join id (JOIN, may be null). Immutable.
 */
public final class ForkJoinInstruction {

    /** Reserved goto target marking termination. It never resolves to a statement. */
    public static final String END = "end";

    private final ForkJoinInstructionType type;
    private final String operand;

    private ForkJoinInstruction(ForkJoinInstructionType type, String operand) {
        this.type = type;
        this.operand = operand;
    }

    public static ForkJoinInstruction atomic(String name) {
        return new ForkJoinInstruction(ForkJoinInstructionType.ATOMIC, requireText(name, "task name"));
    }

    public static ForkJoinInstruction fork(String target) {
        return new ForkJoinInstruction(ForkJoinInstructionType.FORK, requireText(target, "fork target"));
    }

    public static ForkJoinInstruction join() {
        return new ForkJoinInstruction(ForkJoinInstructionType.JOIN, null);
    }

    public static ForkJoinInstruction join(String id) {
        return new ForkJoinInstruction(ForkJoinInstructionType.JOIN, id);
    }

    public static ForkJoinInstruction goTo(String target) {
        return new ForkJoinInstruction(ForkJoinInstructionType.GOTO, requireText(target, "goto target"));
    }

    public static ForkJoinInstruction gotoEnd() {
        return goTo(END);
    }

    private static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Fork-Join " + what + " must not be blank");
        }
        return value;
    }

    public ForkJoinInstructionType getType() {
        return type;
    }

    /** Task name of an ATOMIC instruction, or null. */
    public String getName() {
        return type == ForkJoinInstructionType.ATOMIC ? operand : null;
    }

    /** Target label of a FORK or GOTO instruction, or null. */
    public String getTarget() {
        return type == ForkJoinInstructionType.FORK || type == ForkJoinInstructionType.GOTO ? operand : null;
    }

    /** Id of a JOIN instruction; null when the join has none or this is not a JOIN. */
    public String getJoinId() {
        return type == ForkJoinInstructionType.JOIN ? operand : null;
    }

    public boolean isGotoEnd() {
        return type == ForkJoinInstructionType.GOTO && END.equals(operand);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ForkJoinInstruction that = (ForkJoinInstruction) o;
        return type == that.type && Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, operand);
    }

    /** Surface text: {@code name}, {@code fork t}, {@code join}, {@code join id}, {@code goto t}. */
    @Override
    public String toString() {
        return switch (type) {
            case ATOMIC -> operand;
            case FORK -> "fork " + operand;
            case JOIN -> operand == null ? "join" : "join " + operand;
            case GOTO -> "goto " + operand;
        };
    }
}
