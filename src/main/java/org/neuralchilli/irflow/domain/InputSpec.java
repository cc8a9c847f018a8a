package org.neuralchilli.irflow.domain;

import java.util.List;

/**
 * An input declared on a workflow step.
 *
 * @param type   authoring type name (string, number, integer, boolean, array, object, ...)
 * @param source value source; {@code const:<literal>} marks a constant
 */
public record InputSpec(
        String name,
        String type,
        String source,
        boolean optional,
        List<IrConstraint> constraints
) {
    public InputSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Input name cannot be null or empty");
        }
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    public static InputSpec of(String name, String type) {
        return new InputSpec(name, type, null, false, List.of());
    }

    public static InputSpec constant(String name, String type, Object literal) {
        return new InputSpec(name, type, IrInput.CONSTANT_PREFIX + literal, false, List.of());
    }
}
