package org.neuralchilli.irflow.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Domain knowledge supplied by an external semantic provider.
 * The compiler only reads it; programs keep it as a back-reference.
 */
public record SemanticContext(
        List<String> concepts,
        List<Relationship> relationships,
        List<Constraint> constraints
) {
    public SemanticContext {
        concepts = concepts != null ? List.copyOf(concepts) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    public static SemanticContext empty() {
        return new SemanticContext(List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return concepts.isEmpty() && relationships.isEmpty() && constraints.isEmpty();
    }

    public record Relationship(String predicate, String object) {
        public Relationship {
            if (predicate == null || object == null) {
                throw new IllegalArgumentException("Relationship predicate and object are required");
            }
        }
    }

    public record Constraint(String property, String type) {
        public Constraint {
            if (property == null || type == null) {
                throw new IllegalArgumentException("Constraint property and type are required");
            }
        }
    }
}
