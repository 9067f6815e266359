package com.cgraph.model.forkjoin;

/**
 * Canonical Fork-Join text. A labelled statement prints as {@code "    label: stmt"} and opens a
 * block; unlabelled statements are indented by four spaces, or eight inside a block. A block
 * closes after its first {@code goto} or {@code join}. The closing {@code end} has no trailing newline.
 */
public final class ForkJoinNotation {

    private static final String INDENT = "    ";

    private ForkJoinNotation() {
    }

    public static String write(ForkJoinGraph graph) {
        StringBuilder sb = new StringBuilder("begin\n");
        boolean inBlock = false;
        for (ForkJoinStatement st : graph.getStatements()) {
            if (st.hasLabel()) {
                sb.append(INDENT).append(st.getLabel()).append(": ").append(st.getInstruction()).append('\n');
                inBlock = !closesBlock(st);
            } else {
                sb.append(inBlock ? INDENT + INDENT : INDENT).append(st.getInstruction()).append('\n');
                if (closesBlock(st)) {
                    inBlock = false;
                }
            }
        }
        return sb.append("end").toString();
    }

    private static boolean closesBlock(ForkJoinStatement st) {
        return switch (st.getType()) {
            case GOTO, JOIN -> true;
            case ATOMIC, FORK -> false;
        };
    }
}
