package org.neuralchilli.irflow.domain;

import java.util.List;

/**
 * An output declared on a workflow step.
 */
public record OutputSpec(
        String name,
        String type,
        List<String> targets,
        boolean cacheable
) {
    public OutputSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Output name cannot be null or empty");
        }
        targets = targets != null ? List.copyOf(targets) : List.of();
    }

    public static OutputSpec of(String name, String type) {
        return new OutputSpec(name, type, List.of(), true);
    }
}
