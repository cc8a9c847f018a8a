package org.neuralchilli.irflow.core.passes;

import org.neuralchilli.irflow.domain.IrProgram;

import java.util.List;

/**
 * Result of an optimization run: the new program and one report per pass executed, in order.
 */
public record OptimizationRun(IrProgram program, List<PassReport> reports) {

    public OptimizationRun {
        if (program == null) {
            throw new IllegalArgumentException("Optimized program cannot be null");
        }
        reports = reports != null ? List.copyOf(reports) : List.of();
    }

    public List<String> passNames() {
        return reports.stream().map(PassReport::passName).toList();
    }
}
