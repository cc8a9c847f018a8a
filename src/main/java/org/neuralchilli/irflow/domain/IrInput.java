package org.neuralchilli.irflow.domain;

import java.util.List;

/**
 * An input port of a node.
 *
 * @param source where the value comes from; a {@code const:} prefix marks a literal
 */
public record IrInput(
        String id,
        String name,
        IrDataType type,
        List<IrConstraint> constraints,
        String source,
        boolean optional
) {
    public static final String CONSTANT_PREFIX = "const:";

    public IrInput {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Input name cannot be null or empty");
        }
        if (id == null || id.isBlank()) {
            id = name;
        }
        if (type == null) {
            type = IrDataType.OBJECT;
        }
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    public static IrInput of(String name, IrDataType type) {
        return new IrInput(name, name, type, List.of(), null, false);
    }

    public boolean hasConstantSource() {
        return source != null && source.startsWith(CONSTANT_PREFIX);
    }

    /**
     * The literal text after the {@code const:} prefix, or null if the source is not constant.
     */
    public String constantText() {
        return hasConstantSource() ? source.substring(CONSTANT_PREFIX.length()) : null;
    }
}
