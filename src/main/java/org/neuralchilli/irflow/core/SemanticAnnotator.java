package org.neuralchilli.irflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Attaches semantic annotations to nodes that have none.
 *
 * Concepts of the supplied context that occur in the step's operation or description
 * are attached with confidence 0.8. Without a context match, a static concept table
 * keyed by the node's operation is used with confidence 0.6.
 */
@ApplicationScoped
public class SemanticAnnotator {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnnotator.class);

    static final double CONTEXT_CONFIDENCE = 0.8;
    static final double INFERRED_CONFIDENCE = 0.6;

    private static final Map<String, List<String>> OPERATION_CONCEPTS = Map.of(
            "task", List.of("execution", "process", "action"),
            "condition", List.of("decision", "branch", "logic"),
            "loop", List.of("iteration", "repetition", "cycle"),
            "parallel", List.of("concurrency", "parallelism", "distribution"),
            "transform", List.of("transformation", "mapping", "conversion"),
            "validate", List.of("validation", "verification", "check"),
            "aggregate", List.of("aggregation", "collection", "summarization")
    );

    /**
     * Annotate a node compiled from the given step. Nodes that already carry annotations
     * are returned unchanged.
     *
     * @param context the semantic context, may be null
     */
    public IrNode annotate(IrNode node, WorkflowStep step, SemanticContext context) {
        if (node.hasAnnotations()) {
            return node;
        }

        List<SemanticAnnotation> annotations = fromContext(step, context);
        if (annotations.isEmpty()) {
            annotations = inferred(node.operation());
        }

        if (annotations.isEmpty()) {
            return node;
        }

        log.trace("Annotated node {} with {} concepts", node.id(), annotations.size());
        return node.withSemanticAnnotations(annotations);
    }

    /**
     * Context concepts mentioned in the step's operation or description (case-insensitive).
     */
    public List<SemanticAnnotation> fromContext(WorkflowStep step, SemanticContext context) {
        if (context == null || step == null || context.concepts().isEmpty()) {
            return List.of();
        }

        String operation = lower(step.operation());
        String description = lower(step.description());

        List<SemanticAnnotation> annotations = new ArrayList<>();
        for (String concept : context.concepts()) {
            String needle = lower(concept);
            if (needle.isEmpty()) {
                continue;
            }
            if (operation.contains(needle) || description.contains(needle)) {
                annotations.add(new SemanticAnnotation(
                        concept,
                        CONTEXT_CONFIDENCE,
                        context.relationships().stream()
                                .filter(rel -> rel.object().contains(concept))
                                .map(SemanticContext.Relationship::predicate)
                                .toList(),
                        context.constraints().stream()
                                .filter(c -> c.property().contains(concept))
                                .map(SemanticContext.Constraint::type)
                                .toList()
                ));
            }
        }
        return annotations;
    }

    /**
     * Concepts from the static table for an operation. Unmapped operations get none.
     */
    public List<SemanticAnnotation> inferred(String operation) {
        List<String> concepts = operation != null ? OPERATION_CONCEPTS.get(operation) : null;
        if (concepts == null) {
            return List.of();
        }
        return concepts.stream()
                .map(concept -> SemanticAnnotation.of(concept, INFERRED_CONFIDENCE))
                .toList();
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : "";
    }
}
