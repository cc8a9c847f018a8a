package org.neuralchilli.irflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.IrMetadata;
import org.neuralchilli.irflow.domain.WorkflowStep;

import java.util.Map;

/**
 * Estimates per-node cost metadata.
 * cost = baseCost(operation) * complexity, where the base cost is looked up by operation name
 * and is 1 for operations without a table entry.
 */
@ApplicationScoped
public class CostModel {

    private static final Map<String, Double> BASE_COSTS = Map.of(
            "task", 5.0,
            "condition", 1.0,
            "loop", 10.0,
            "parallel", 8.0,
            "transform", 3.0,
            "validate", 2.0,
            "aggregate", 4.0
    );

    private static final double DEFAULT_BASE_COST = 1.0;

    public double baseCost(String operation) {
        if (operation == null) {
            return DEFAULT_BASE_COST;
        }
        return BASE_COSTS.getOrDefault(operation, DEFAULT_BASE_COST);
    }

    /**
     * Metadata for the node a step compiles to. Values the step omits come from the node kind defaults.
     */
    public IrMetadata estimate(WorkflowStep step, IrMetadata kindDefaults) {
        double complexity = step.complexity() != null ? step.complexity() : 1.0;

        return new IrMetadata(
                baseCost(step.operation()) * complexity,
                complexity,
                step.reliability() != null ? step.reliability() : kindDefaults.reliability(),
                step.estimatedLatency() != null ? step.estimatedLatency() : kindDefaults.latency(),
                step.estimatedMemory() != null ? step.estimatedMemory() : kindDefaults.memory(),
                step.estimatedCpu() != null ? step.estimatedCpu() : kindDefaults.cpu(),
                step.sourceLocation()
        );
    }
}
