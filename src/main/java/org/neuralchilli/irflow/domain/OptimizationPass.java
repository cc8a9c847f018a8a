package org.neuralchilli.irflow.domain;

import java.util.Map;

/**
 * Descriptor of an optimization pass scheduled on a program.
 */
public record OptimizationPass(
        String name,
        int level,
        boolean enabled,
        Map<String, Object> parameters
) {
    public OptimizationPass {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pass name cannot be null or empty");
        }
        if (level < 0) {
            throw new IllegalArgumentException("Pass level cannot be negative");
        }
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static OptimizationPass enabled(String name, int level) {
        return new OptimizationPass(name, level, true, Map.of());
    }

    public OptimizationPass withEnabled(boolean enabled) {
        return new OptimizationPass(name, level, enabled, parameters);
    }
}
