package org.neuralchilli.irflow.domain;

/**
 * Directed, typed link between two nodes.
 *
 * @param condition optional guard expression
 */
public record IrEdge(
        String id,
        String from,
        String to,
        IrDataType dataType,
        double weight,
        String condition
) {
    public IrEdge {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Edge id cannot be null or empty");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("Edge endpoints cannot be null");
        }
        if (dataType == null) {
            dataType = IrDataType.VOID;
        }
    }

    public boolean carriesData() {
        return dataType != IrDataType.VOID;
    }
}
