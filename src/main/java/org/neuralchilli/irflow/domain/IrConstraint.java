package org.neuralchilli.irflow.domain;

import java.util.Set;

/**
 * A constraint attached to a node input.
 *
 * @param type     range, pattern, cardinality, type or custom
 * @param value    constraint argument, free-form
 * @param severity error, warning or info
 */
public record IrConstraint(String type, Object value, String severity) {

    private static final Set<String> TYPES = Set.of("range", "pattern", "cardinality", "type", "custom");
    private static final Set<String> SEVERITIES = Set.of("error", "warning", "info");

    public IrConstraint {
        if (type == null || !TYPES.contains(type)) {
            throw new IllegalArgumentException("Invalid constraint type: " + type + ". Valid types: " + TYPES);
        }
        if (severity == null) {
            severity = "error";
        }
        if (!SEVERITIES.contains(severity)) {
            throw new IllegalArgumentException("Invalid constraint severity: " + severity);
        }
    }
}
