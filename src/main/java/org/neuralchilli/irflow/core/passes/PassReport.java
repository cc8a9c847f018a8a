package org.neuralchilli.irflow.core.passes;

import org.neuralchilli.irflow.monitoring.IrEventType;

/**
 * Outcome of one pass in an optimization run.
 *
 * @param impact number of nodes the pass affected
 */
public record PassReport(String passName, int level, IrEventType eventType, int impact) {
}
