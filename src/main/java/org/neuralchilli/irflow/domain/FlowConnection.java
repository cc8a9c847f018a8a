package org.neuralchilli.irflow.domain;

/**
 * A declared control-flow connection between two steps or nodes.
 *
 * @param dataType  declared data type, void when absent
 * @param weight    edge weight, 1 when absent
 * @param condition optional guard expression
 */
public record FlowConnection(
        String from,
        String to,
        String dataType,
        Double weight,
        String condition
) {
    public FlowConnection {
        if (from == null || from.isBlank() || to == null || to.isBlank()) {
            throw new IllegalArgumentException("Flow connection requires both 'from' and 'to'");
        }
    }

    public static FlowConnection of(String from, String to) {
        return new FlowConnection(from, to, null, null, null);
    }
}
