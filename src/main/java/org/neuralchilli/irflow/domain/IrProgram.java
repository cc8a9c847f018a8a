package org.neuralchilli.irflow.domain;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A compiled workflow: a graph of IR nodes and edges plus the passes and targets it was compiled for.
 * Programs are immutable. Optimization derives a new program with a new id.
 */
public record IrProgram(
        String id,
        String name,
        String version,
        List<IrNode> nodes,
        List<IrEdge> edges,
        List<String> entryPoints,
        List<String> exitPoints,
        Map<String, Object> globalConstants,
        SemanticContext semanticContext,
        List<OptimizationPass> optimizationPasses,
        List<String> targetPlatforms
) {
    public IrProgram {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Program id cannot be null or empty");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Program name cannot be null or empty");
        }

        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        entryPoints = entryPoints != null ? List.copyOf(entryPoints) : List.of();
        exitPoints = exitPoints != null ? List.copyOf(exitPoints) : List.of();
        globalConstants = globalConstants != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(globalConstants))
                : Map.of();
        semanticContext = semanticContext != null ? semanticContext : SemanticContext.empty();
        optimizationPasses = optimizationPasses != null ? List.copyOf(optimizationPasses) : List.of();
        targetPlatforms = targetPlatforms != null ? List.copyOf(targetPlatforms) : List.of();

        validateGraph(nodes, edges);
    }

    private static void validateGraph(List<IrNode> nodes, List<IrEdge> edges) {
        Set<String> ids = new HashSet<>();
        for (IrNode node : nodes) {
            if (!ids.add(node.id())) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
        for (IrEdge edge : edges) {
            if (!ids.contains(edge.from()) || !ids.contains(edge.to())) {
                throw new IllegalArgumentException(
                        "Edge '" + edge.id() + "' references unknown node: " + edge.from() + " -> " + edge.to()
                );
            }
        }
    }

    public Optional<IrNode> node(String nodeId) {
        return nodes.stream()
                .filter(n -> n.id().equals(nodeId))
                .findFirst();
    }

    public List<String> nodeIds() {
        return nodes.stream()
                .map(IrNode::id)
                .collect(Collectors.toList());
    }

    public boolean targets(String platform) {
        return targetPlatforms.contains(platform);
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    public Builder toBuilder() {
        return new Builder(id, name)
                .version(version)
                .nodes(nodes)
                .edges(edges)
                .entryPoints(entryPoints)
                .exitPoints(exitPoints)
                .globalConstants(globalConstants)
                .semanticContext(semanticContext)
                .optimizationPasses(optimizationPasses)
                .targetPlatforms(targetPlatforms);
    }

    public static class Builder {
        private String id;
        private final String name;
        private String version = "1.0.0";
        private List<IrNode> nodes = List.of();
        private List<IrEdge> edges = List.of();
        private List<String> entryPoints = List.of();
        private List<String> exitPoints = List.of();
        private Map<String, Object> globalConstants = Map.of();
        private SemanticContext semanticContext = SemanticContext.empty();
        private List<OptimizationPass> optimizationPasses = List.of();
        private List<String> targetPlatforms = List.of();

        public Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder nodes(List<IrNode> nodes) {
            this.nodes = nodes;
            return this;
        }

        public Builder edges(List<IrEdge> edges) {
            this.edges = edges;
            return this;
        }

        public Builder entryPoints(List<String> entryPoints) {
            this.entryPoints = entryPoints;
            return this;
        }

        public Builder exitPoints(List<String> exitPoints) {
            this.exitPoints = exitPoints;
            return this;
        }

        public Builder globalConstants(Map<String, Object> globalConstants) {
            this.globalConstants = globalConstants;
            return this;
        }

        public Builder semanticContext(SemanticContext semanticContext) {
            this.semanticContext = semanticContext;
            return this;
        }

        public Builder optimizationPasses(List<OptimizationPass> optimizationPasses) {
            this.optimizationPasses = optimizationPasses;
            return this;
        }

        public Builder targetPlatforms(List<String> targetPlatforms) {
            this.targetPlatforms = targetPlatforms;
            return this;
        }

        public IrProgram build() {
            return new IrProgram(id, name, version, nodes, edges, entryPoints, exitPoints,
                    globalConstants, semanticContext, optimizationPasses, targetPlatforms);
        }
    }
}
