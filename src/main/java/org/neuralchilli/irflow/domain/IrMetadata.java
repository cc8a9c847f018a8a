package org.neuralchilli.irflow.domain;

/**
 * Cost model estimates for a single node.
 */
public record IrMetadata(
        double cost,
        double complexity,
        double reliability,
        double latency,
        double memory,
        double cpu,
        SourceLocation sourceLocation
) {
    public IrMetadata {
        if (reliability < 0.0 || reliability > 1.0) {
            throw new IllegalArgumentException("Reliability must be within [0, 1], got: " + reliability);
        }
        if (cost < 0 || complexity < 0) {
            throw new IllegalArgumentException("Cost and complexity cannot be negative");
        }
    }

    public static IrMetadata of(double cost, double complexity, double reliability,
                                double latency, double memory, double cpu) {
        return new IrMetadata(cost, complexity, reliability, latency, memory, cpu, null);
    }

    public IrMetadata withCost(double cost) {
        return new IrMetadata(cost, complexity, reliability, latency, memory, cpu, sourceLocation);
    }

    public IrMetadata withComplexity(double complexity) {
        return new IrMetadata(cost, complexity, reliability, latency, memory, cpu, sourceLocation);
    }
}
