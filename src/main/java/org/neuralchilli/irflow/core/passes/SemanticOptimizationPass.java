package org.neuralchilli.irflow.core.passes;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.domain.SemanticAnnotation;
import org.neuralchilli.irflow.monitoring.IrEventType;

import java.util.ListIterator;
import java.util.Map;

/**
 * Rewrites nodes confidently annotated as aggregations into the optimized aggregate operation.
 */
@ApplicationScoped
public class SemanticOptimizationPass implements IrPass {

    public static final String NAME = "semantic-optimization";

    static final String AGGREGATION = "aggregation";
    static final double MIN_CONFIDENCE = 0.8;
    static final double COST_FACTOR = 0.7;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int level() {
        return 2;
    }

    @Override
    public IrEventType eventType() {
        return IrEventType.SEMANTICS_OPTIMIZED;
    }

    @Override
    public int apply(ProgramDraft draft, Map<String, Object> parameters) {
        int optimized = 0;

        ListIterator<IrNode> iterator = draft.nodes().listIterator();
        while (iterator.hasNext()) {
            IrNode node = iterator.next();
            if (isConfidentAggregation(node)) {
                iterator.set(node.toBuilder()
                        .operation("optimized_aggregate")
                        .metadata(node.metadata().withCost(node.metadata().cost() * COST_FACTOR))
                        .build());
                optimized++;
            }
        }

        return optimized;
    }

    // strictly greater: context-derived annotations sit exactly at 0.8
    private static boolean isConfidentAggregation(IrNode node) {
        for (SemanticAnnotation annotation : node.semanticAnnotations()) {
            if (AGGREGATION.equals(annotation.concept()) && annotation.confidence() > MIN_CONFIDENCE) {
                return true;
            }
        }
        return false;
    }
}
