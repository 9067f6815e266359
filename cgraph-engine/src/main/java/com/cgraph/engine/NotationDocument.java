package com.cgraph.engine;

import com.cgraph.model.forkjoin.ForkJoinGraph;
import com.cgraph.model.ir.IrGraph;
import com.cgraph.model.par.ParGraph;

import java.util.Objects;

/**
 * A parsed graph tagged with its notation, as produced by a front-end. Exactly one of the graph
 * accessors matches {@link #getFormat()}; the others throw {@link IllegalStateException}.
 * <p>
 * Front-ends that fail to parse their input throw
 * {@link com.cgraph.model.NotationParseException} instead of producing a document.
 */
public final class NotationDocument {

    private final NotationFormat format;
    private final Object graph;

    private NotationDocument(NotationFormat format, Object graph) {
        this.format = format;
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public static NotationDocument ir(IrGraph graph) {
        return new NotationDocument(NotationFormat.IR, graph);
    }

    public static NotationDocument par(ParGraph graph) {
        return new NotationDocument(NotationFormat.PAR, graph);
    }

    public static NotationDocument forkJoin(ForkJoinGraph graph) {
        return new NotationDocument(NotationFormat.FORK_JOIN, graph);
    }

    public NotationFormat getFormat() {
        return format;
    }

    public IrGraph getIrGraph() {
        return (IrGraph) expect(NotationFormat.IR);
    }

    public ParGraph getParGraph() {
        return (ParGraph) expect(NotationFormat.PAR);
    }

    public ForkJoinGraph getForkJoinGraph() {
        return (ForkJoinGraph) expect(NotationFormat.FORK_JOIN);
    }

    private Object expect(NotationFormat expected) {
        if (format != expected) {
            throw new IllegalStateException("Document is " + format + ", not " + expected);
        }
        return graph;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NotationDocument that = (NotationDocument) o;
        return format == that.format && graph.equals(that.graph);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, graph);
    }

    @Override
    public String toString() {
        return "NotationDocument{format=" + format + "}";
    }
}
