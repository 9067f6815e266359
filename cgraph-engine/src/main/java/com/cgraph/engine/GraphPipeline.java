package com.cgraph.engine;

import com.cgraph.engine.config.CgraphConfig;
import com.cgraph.execution.ExecutionGraph;
import com.cgraph.execution.ExecutionGraphBuilder;
import com.cgraph.execution.ExecutionGraphDot;
import com.cgraph.execution.ExecutionGraphJson;
import com.cgraph.forkjoin.ForkJoinConversions;
import com.cgraph.model.forkjoin.ForkJoinNotation;
import com.cgraph.model.ir.IrGraph;
import com.cgraph.model.ir.IrNotation;
import com.cgraph.model.par.ParMapping;
import com.cgraph.model.par.ParNotation;
import com.cgraph.validation.DependencyValidator;
import com.cgraph.validation.ValidatedGraph;
import com.cgraph.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Conversion and rendering entry point over parsed documents. Every path goes through the IR:
 * document to IR, then IR to the target notation, or IR to validation and the execution graph.
 * Stateless apart from configuration; safe to share.
 */
public final class GraphPipeline {

    private static final Logger log = LoggerFactory.getLogger(GraphPipeline.class);

    private final CgraphConfig config;

    public GraphPipeline(CgraphConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public GraphPipeline() {
        this(CgraphConfig.defaults());
    }

    public CgraphConfig getConfig() {
        return config;
    }

    public IrGraph toIr(NotationDocument document) {
        return switch (document.getFormat()) {
            case IR -> document.getIrGraph();
            case PAR -> ParMapping.toIr(document.getParGraph());
            case FORK_JOIN -> ForkJoinConversions.toIr(document.getForkJoinGraph(), config.toStructuringLimits());
        };
    }

    /**
     * The document in another notation.
     *
     * @throws com.cgraph.model.ConversionException when the target is PAR and the graph has
     *                                              dependencies or terminal tasks
     */
    public NotationDocument translate(NotationDocument document, NotationFormat target) {
        Objects.requireNonNull(target, "target");
        log.debug("Converting {} to {}", document.getFormat(), target);
        IrGraph ir = toIr(document);
        return switch (target) {
            case IR -> NotationDocument.ir(ir);
            case PAR -> NotationDocument.par(ParMapping.fromIr(ir));
            case FORK_JOIN -> NotationDocument.forkJoin(ForkJoinConversions.fromIr(ir));
        };
    }

    /** Canonical text of the document converted to {@code target}. */
    public String convert(NotationDocument document, NotationFormat target) {
        return render(translate(document, target));
    }

    /** Canonical text of the document in its own notation. */
    public String render(NotationDocument document) {
        return switch (document.getFormat()) {
            case IR -> IrNotation.write(document.getIrGraph());
            case PAR -> ParNotation.write(document.getParGraph());
            case FORK_JOIN -> ForkJoinNotation.write(document.getForkJoinGraph());
        };
    }

    public ValidationResult validate(NotationDocument document) {
        return new DependencyValidator(config.toValidationOptions()).validate(toIr(document));
    }

    /** @throws com.cgraph.validation.InvalidGraphException when validation fails */
    public ExecutionGraph buildExecutionGraph(NotationDocument document) {
        ValidatedGraph validated = new DependencyValidator(config.toValidationOptions()).validateOrThrow(toIr(document));
        return ExecutionGraphBuilder.build(validated);
    }

    public String renderJson(NotationDocument document) {
        return ExecutionGraphJson.toJson(buildExecutionGraph(document));
    }

    public String renderDot(NotationDocument document) {
        return ExecutionGraphDot.write(buildExecutionGraph(document));
    }
}
