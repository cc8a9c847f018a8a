package org.neuralchilli.irflow.domain;

import java.util.List;

/**
 * A single step of a workflow description.
 * The step type is kept as declared; the compiler rejects unknown types.
 */
public record WorkflowStep(
        String id,
        String type,
        String operation,
        String description,
        List<InputSpec> inputs,
        List<OutputSpec> outputs,
        List<String> dependencies,
        Boolean parallelizable,
        Double complexity,
        Double reliability,
        Double estimatedLatency,
        Double estimatedMemory,
        Double estimatedCpu,
        SourceLocation sourceLocation,
        List<SemanticAnnotation> annotations,
        String condition,   // condition and loop steps
        String loopType,
        Object iterator,    // literal count or source reference
        List<Object> parallel,
        String input,       // parallel and transform steps
        String transformType,
        String outputType
) {
    public WorkflowStep {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Step type cannot be null or empty");
        }
        if (operation == null || operation.isBlank()) {
            operation = type;
        }
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        parallel = parallel != null ? List.copyOf(parallel) : List.of();
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public static Builder task(String operation) {
        return new Builder("task").operation(operation);
    }

    public static class Builder {
        private final String type;
        private String id;
        private String operation;
        private String description;
        private List<InputSpec> inputs = List.of();
        private List<OutputSpec> outputs = List.of();
        private List<String> dependencies = List.of();
        private Boolean parallelizable;
        private Double complexity;
        private Double reliability;
        private Double estimatedLatency;
        private Double estimatedMemory;
        private Double estimatedCpu;
        private SourceLocation sourceLocation;
        private List<SemanticAnnotation> annotations = List.of();
        private String condition;
        private String loopType;
        private Object iterator;
        private List<Object> parallel = List.of();
        private String input;
        private String transformType;
        private String outputType;

        public Builder(String type) {
            this.type = type;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder inputs(List<InputSpec> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(List<OutputSpec> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder parallelizable(Boolean parallelizable) {
            this.parallelizable = parallelizable;
            return this;
        }

        public Builder complexity(Double complexity) {
            this.complexity = complexity;
            return this;
        }

        public Builder reliability(Double reliability) {
            this.reliability = reliability;
            return this;
        }

        public Builder estimatedLatency(Double estimatedLatency) {
            this.estimatedLatency = estimatedLatency;
            return this;
        }

        public Builder estimatedMemory(Double estimatedMemory) {
            this.estimatedMemory = estimatedMemory;
            return this;
        }

        public Builder estimatedCpu(Double estimatedCpu) {
            this.estimatedCpu = estimatedCpu;
            return this;
        }

        public Builder sourceLocation(SourceLocation sourceLocation) {
            this.sourceLocation = sourceLocation;
            return this;
        }

        public Builder annotations(List<SemanticAnnotation> annotations) {
            this.annotations = annotations;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder loopType(String loopType) {
            this.loopType = loopType;
            return this;
        }

        public Builder iterator(Object iterator) {
            this.iterator = iterator;
            return this;
        }

        public Builder parallel(List<Object> parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder input(String input) {
            this.input = input;
            return this;
        }

        public Builder transformType(String transformType) {
            this.transformType = transformType;
            return this;
        }

        public Builder outputType(String outputType) {
            this.outputType = outputType;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(id, type, operation, description, inputs, outputs, dependencies,
                    parallelizable, complexity, reliability, estimatedLatency, estimatedMemory, estimatedCpu,
                    sourceLocation, annotations, condition, loopType, iterator, parallel, input,
                    transformType, outputType);
        }
    }
}
