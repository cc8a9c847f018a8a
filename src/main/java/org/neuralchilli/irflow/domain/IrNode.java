package org.neuralchilli.irflow.domain;

import java.util.List;

/**
 * A typed operation in the IR graph.
 * Nodes are immutable; passes rewrite them through the {@code with*} methods.
 */
public record IrNode(
        String id,
        IrNodeKind kind,
        String operation,
        List<IrInput> inputs,
        List<IrOutput> outputs,
        IrMetadata metadata,
        int optimizationLevel,
        List<SemanticAnnotation> semanticAnnotations,
        List<String> dependencies,
        boolean parallelizable
) {
    public IrNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null");
        }
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("Node operation cannot be null or empty");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("Node metadata cannot be null");
        }
        if (optimizationLevel < 0) {
            throw new IllegalArgumentException("Optimization level cannot be negative");
        }
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        semanticAnnotations = semanticAnnotations != null ? List.copyOf(semanticAnnotations) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public boolean hasAnnotations() {
        return !semanticAnnotations.isEmpty();
    }

    public IrNode withKind(IrNodeKind kind) {
        return toBuilder().kind(kind).build();
    }

    public IrNode withOperation(String operation) {
        return toBuilder().operation(operation).build();
    }

    public IrNode withMetadata(IrMetadata metadata) {
        return toBuilder().metadata(metadata).build();
    }

    /**
     * Raise the optimization level. A lower level than the current one is ignored.
     */
    public IrNode withOptimizationLevel(int level) {
        return toBuilder().optimizationLevel(Math.max(optimizationLevel, level)).build();
    }

    public IrNode withSemanticAnnotations(List<SemanticAnnotation> annotations) {
        return toBuilder().semanticAnnotations(annotations).build();
    }

    public static Builder builder(String id, IrNodeKind kind) {
        return new Builder(id, kind);
    }

    public Builder toBuilder() {
        return new Builder(id, kind)
                .operation(operation)
                .inputs(inputs)
                .outputs(outputs)
                .metadata(metadata)
                .optimizationLevel(optimizationLevel)
                .semanticAnnotations(semanticAnnotations)
                .dependencies(dependencies)
                .parallelizable(parallelizable);
    }

    public static class Builder {
        private String id;
        private IrNodeKind kind;
        private String operation;
        private List<IrInput> inputs = List.of();
        private List<IrOutput> outputs = List.of();
        private IrMetadata metadata = IrMetadata.of(1, 1, 0.95, 10, 1024, 1);
        private int optimizationLevel = 0;
        private List<SemanticAnnotation> semanticAnnotations = List.of();
        private List<String> dependencies = List.of();
        private boolean parallelizable = false;

        public Builder(String id, IrNodeKind kind) {
            this.id = id;
            this.kind = kind;
            this.operation = kind != null ? kind.wireName() : null;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(IrNodeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder inputs(List<IrInput> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(List<IrOutput> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder metadata(IrMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder optimizationLevel(int optimizationLevel) {
            this.optimizationLevel = optimizationLevel;
            return this;
        }

        public Builder semanticAnnotations(List<SemanticAnnotation> semanticAnnotations) {
            this.semanticAnnotations = semanticAnnotations;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder parallelizable(boolean parallelizable) {
            this.parallelizable = parallelizable;
            return this;
        }

        public IrNode build() {
            return new IrNode(id, kind, operation, inputs, outputs, metadata,
                    optimizationLevel, semanticAnnotations, dependencies, parallelizable);
        }
    }
}
