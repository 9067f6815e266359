package com.cgraph.model.par;

import java.util.List;

/**
 * Canonical Par text: one item per line, two spaces of indentation per nesting level,
 * {@code begin}/{@code end} around sequences and {@code parbegin}/{@code parend} around parallels.
 * The closing {@code end} has no trailing newline.
 */
public final class ParNotation {

    private static final String INDENT = "  ";

    private ParNotation() {
    }

    public static String write(ParGraph graph) {
        StringBuilder sb = new StringBuilder("begin\n");
        writeNodes(sb, graph.getNodes(), 1);
        return sb.append("end").toString();
    }

    private static void writeNodes(StringBuilder sb, List<ParNode> nodes, int level) {
        for (ParNode node : nodes) {
            writeNode(sb, node, level);
        }
    }

    private static void writeNode(StringBuilder sb, ParNode node, int level) {
        String indent = INDENT.repeat(level);
        switch (node.getType()) {
            case ATOMIC -> sb.append(indent).append(node.getName()).append('\n');
            case SEQUENCE -> {
                sb.append(indent).append("begin\n");
                writeNodes(sb, node.getChildren(), level + 1);
                sb.append(indent).append("end\n");
            }
            case PARALLEL -> {
                sb.append(indent).append("parbegin\n");
                writeNodes(sb, node.getChildren(), level + 1);
                sb.append(indent).append("parend\n");
            }
        }
    }
}
