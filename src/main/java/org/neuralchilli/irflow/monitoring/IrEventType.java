package org.neuralchilli.irflow.monitoring;

/**
 * Observable events of the compiler, the optimizer and the code generators.
 */
public enum IrEventType {
    WORKFLOW_COMPILED("workflowCompiled"),
    COMPILATION_ERROR("compilationError"),
    DEAD_CODE_ELIMINATED("deadCodeEliminated"),
    CONSTANTS_FOLDED("constantsFolded"),
    SEMANTICS_OPTIMIZED("semanticsOptimized"),
    PARALLELISM_DETECTED("parallelismDetected"),
    LOOPS_OPTIMIZED("loopsOptimized"),
    MEMORY_LAYOUT_OPTIMIZED("memoryLayoutOptimized"),
    OPTIMIZATION_APPLIED("optimizationApplied"),
    PROGRAM_OPTIMIZED("programOptimized"),
    CODE_GENERATED("codeGenerated");

    private final String wireName;

    IrEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
