package org.neuralchilli.irflow.core;

import org.neuralchilli.irflow.domain.IrNode;

/**
 * Creates a node pre-filled with the defaults of its kind.
 */
@FunctionalInterface
public interface NodeFactory {

    IrNode.Builder create(String nodeId);
}
