package com.cgraph.model.par;

import com.cgraph.model.ConversionException;
import com.cgraph.model.ir.IrGraph;
import com.cgraph.model.ir.IrNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural mapping between Par and IR. Par to IR is total. IR to Par fails with
 * {@link ConversionException} at the first atomic carrying dependencies or a terminal marker,
 * since Par has no syntax for either.
 */
public final class ParMapping {

    private ParMapping() {
    }

    public static IrGraph toIr(ParGraph graph) {
        return new IrGraph(mapToIr(graph.getNodes()));
    }

    public static ParGraph fromIr(IrGraph graph) {
        return new ParGraph(mapFromIr(graph.getNodes()));
    }

    private static List<IrNode> mapToIr(List<ParNode> nodes) {
        List<IrNode> out = new ArrayList<>(nodes.size());
        for (ParNode node : nodes) {
            out.add(toIr(node));
        }
        return out;
    }

    private static IrNode toIr(ParNode node) {
        return switch (node.getType()) {
            case ATOMIC -> IrNode.atomic(node.getName());
            case SEQUENCE -> IrNode.sequence(mapToIr(node.getChildren()));
            case PARALLEL -> IrNode.parallel(mapToIr(node.getChildren()));
        };
    }

    private static List<ParNode> mapFromIr(List<IrNode> nodes) {
        List<ParNode> out = new ArrayList<>(nodes.size());
        for (IrNode node : nodes) {
            out.add(fromIr(node));
        }
        return out;
    }

    private static ParNode fromIr(IrNode node) {
        return switch (node.getType()) {
            case ATOMIC -> {
                if (!node.getDeps().isEmpty()) {
                    throw new ConversionException("Par cannot represent dependencies of task '"
                            + node.getName() + "': " + node.getDeps());
                }
                if (node.isTerminal()) {
                    throw new ConversionException("Par cannot represent terminal task '" + node.getName() + "'");
                }
                yield ParNode.atomic(node.getName());
            }
            case SEQUENCE -> ParNode.sequence(mapFromIr(node.getChildren()));
            case PARALLEL -> ParNode.parallel(mapFromIr(node.getChildren()));
        };
    }
}
