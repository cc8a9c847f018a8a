package org.neuralchilli.irflow.domain;

import javax.annotation.Nonnull;

/**
 * Aggregate cost figures for a program. Derived on demand, never stored.
 */
public record ComplexityAnalysis(
        double totalCost,
        double maxComplexity,
        double averageReliability,
        double parallelizability,
        int nodeCount,
        int edgeCount,
        int entryPoints,
        int exitPoints
) {
    public ComplexityAnalysis {
        if (nodeCount < 0 || edgeCount < 0 || entryPoints < 0 || exitPoints < 0) {
            throw new IllegalArgumentException("Counts cannot be negative");
        }
        if (parallelizability < 0.0 || parallelizability > 1.0) {
            throw new IllegalArgumentException("Parallelizability must be within [0, 1]");
        }
    }

    /**
     * Compute the analysis for a program. An empty program yields all zeros.
     */
    public static ComplexityAnalysis of(IrProgram program) {
        int nodeCount = program.nodes().size();
        if (nodeCount == 0) {
            return new ComplexityAnalysis(0, 0, 0, 0, 0,
                    program.edges().size(), program.entryPoints().size(), program.exitPoints().size());
        }

        double totalCost = 0;
        double maxComplexity = Double.NEGATIVE_INFINITY;
        double reliabilitySum = 0;
        int parallelizable = 0;

        for (IrNode node : program.nodes()) {
            totalCost += node.metadata().cost();
            maxComplexity = Math.max(maxComplexity, node.metadata().complexity());
            reliabilitySum += node.metadata().reliability();
            if (node.parallelizable()) {
                parallelizable++;
            }
        }

        return new ComplexityAnalysis(
                totalCost,
                maxComplexity,
                reliabilitySum / nodeCount,
                (double) parallelizable / nodeCount,
                nodeCount,
                program.edges().size(),
                program.entryPoints().size(),
                program.exitPoints().size()
        );
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "ComplexityAnalysis[nodes=%d, edges=%d, cost=%.2f, max_complexity=%.2f, reliability=%.3f, parallel=%.2f]",
                nodeCount, edgeCount, totalCost, maxComplexity, averageReliability, parallelizability
        );
    }
}
