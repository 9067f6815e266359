package com.cgraph.model.forkjoin;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A Fork-Join program: the ordered statements of one {@code begin ... end} block.
 * Labels are unique and never equal the reserved {@link ForkJoinInstruction#END} target. Immutable.
 */
public final class ForkJoinGraph {

    private final List<ForkJoinStatement> statements;

    public ForkJoinGraph(List<ForkJoinStatement> statements) {
        this.statements = statements != null ? List.copyOf(statements) : List.of();
        Set<String> labels = new HashSet<>();
        for (ForkJoinStatement st : this.statements) {
            String label = st.getLabel();
            if (label == null) continue;
            if (ForkJoinInstruction.END.equals(label)) {
                throw new IllegalArgumentException("Label '" + label + "' is reserved");
            }
            if (!labels.add(label)) {
                throw new IllegalArgumentException("Duplicate label: " + label);
            }
        }
    }

    public static ForkJoinGraph of(ForkJoinStatement... statements) {
        return new ForkJoinGraph(Arrays.asList(statements));
    }

    public List<ForkJoinStatement> getStatements() {
        return statements;
    }

    public int size() {
        return statements.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return statements.equals(((ForkJoinGraph) o).statements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statements);
    }

    @Override
    public String toString() {
        return ForkJoinNotation.write(this);
    }
}
