package org.neuralchilli.irflow.domain;

import java.util.List;

/**
 * An output port of a node.
 *
 * @param value folded constant value, null unless the node was constant-folded
 */
public record IrOutput(
        String id,
        String name,
        IrDataType type,
        List<String> targets,
        boolean cacheable,
        Object value
) {
    public IrOutput {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Output name cannot be null or empty");
        }
        if (id == null || id.isBlank()) {
            id = name;
        }
        if (type == null) {
            type = IrDataType.OBJECT;
        }
        targets = targets != null ? List.copyOf(targets) : List.of();
    }

    public static IrOutput of(String name, IrDataType type, boolean cacheable) {
        return new IrOutput(name, name, type, List.of(), cacheable, null);
    }
}
