package org.neuralchilli.irflow.domain;

import java.util.List;

/**
 * Confidence-scored association between a node and a domain concept.
 */
public record SemanticAnnotation(
        String concept,
        double confidence,
        List<String> relationships,
        List<String> constraints
) {
    public SemanticAnnotation {
        if (concept == null || concept.isBlank()) {
            throw new IllegalArgumentException("Annotation concept cannot be null or empty");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Annotation confidence must be within [0, 1], got: " + confidence);
        }
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    public static SemanticAnnotation of(String concept, double confidence) {
        return new SemanticAnnotation(concept, confidence, List.of(), List.of());
    }
}
