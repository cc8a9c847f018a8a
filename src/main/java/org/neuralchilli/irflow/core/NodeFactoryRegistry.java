package org.neuralchilli.irflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builtin node constructors, one per node kind.
 * Each factory fills in the kind's default ports and cost metadata; the compiler overrides
 * what the workflow step declares.
 */
@ApplicationScoped
public class NodeFactoryRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeFactoryRegistry.class);

    private final Map<IrNodeKind, NodeFactory> factories = new EnumMap<>(IrNodeKind.class);

    public NodeFactoryRegistry() {
        for (IrNodeKind kind : IrNodeKind.values()) {
            factories.put(kind, builtin(kind));
        }
    }

    /**
     * Create a node builder for the given kind.
     */
    public IrNode.Builder create(IrNodeKind kind, String nodeId) {
        NodeFactory factory = factories.get(kind);
        if (factory == null) {
            throw new IllegalArgumentException("No node factory registered for kind: " + kind);
        }
        return factory.create(nodeId);
    }

    /**
     * Replace the factory for a kind on this registry instance.
     */
    public void register(IrNodeKind kind, NodeFactory factory) {
        if (kind == null || factory == null) {
            throw new IllegalArgumentException("Node kind and factory are required");
        }
        log.debug("Registering node factory for kind: {}", kind);
        factories.put(kind, factory);
    }

    public Set<IrNodeKind> registeredKinds() {
        return Set.copyOf(factories.keySet());
    }

    private static NodeFactory builtin(IrNodeKind kind) {
        return switch (kind) {
            case ENTRY -> id -> IrNode.builder(id, IrNodeKind.ENTRY)
                    .operation("entry")
                    .outputs(List.of(output(id, "start", IrDataType.VOID, false)))
                    .metadata(IrMetadata.of(0, 0, 1.0, 0, 0, 0));
            case EXIT -> id -> IrNode.builder(id, IrNodeKind.EXIT)
                    .operation("exit")
                    .inputs(List.of(input(id, "end", IrDataType.VOID)))
                    .metadata(IrMetadata.of(0, 0, 1.0, 0, 0, 0));
            case OPERATION -> id -> IrNode.builder(id, IrNodeKind.OPERATION)
                    .operation("generic")
                    .metadata(IrMetadata.of(1, 1, 0.95, 10, 1024, 1))
                    .parallelizable(true);
            case CONDITION -> id -> IrNode.builder(id, IrNodeKind.CONDITION)
                    .operation("branch")
                    .inputs(List.of(input(id, "condition", IrDataType.BOOLEAN)))
                    .outputs(List.of(
                            output(id, "true", IrDataType.VOID, false),
                            output(id, "false", IrDataType.VOID, false)))
                    .metadata(IrMetadata.of(1, 1, 1.0, 1, 0, 0));
            case LOOP -> id -> IrNode.builder(id, IrNodeKind.LOOP)
                    .operation("for")
                    .inputs(List.of(
                            input(id, "iterator", IrDataType.INT32),
                            input(id, "condition", IrDataType.BOOLEAN)))
                    .outputs(List.of(output(id, "result", IrDataType.ARRAY, true)))
                    .metadata(IrMetadata.of(10, 3, 0.95, 50, 2048, 5))
                    .parallelizable(true);
            case PARALLEL -> id -> IrNode.builder(id, IrNodeKind.PARALLEL)
                    .operation("parallel")
                    .inputs(List.of(input(id, "input", IrDataType.ARRAY)))
                    .outputs(List.of(output(id, "output", IrDataType.ARRAY, true)))
                    .metadata(IrMetadata.of(5, 2, 0.90, 20, 4096, 2))
                    .parallelizable(true);
            case MERGE -> id -> IrNode.builder(id, IrNodeKind.MERGE)
                    .operation("merge")
                    .outputs(List.of(output(id, "merged", IrDataType.OBJECT, true)))
                    .metadata(IrMetadata.of(2, 1, 0.98, 5, 1024, 1));
            case SPLIT -> id -> IrNode.builder(id, IrNodeKind.SPLIT)
                    .operation("split")
                    .inputs(List.of(input(id, "input", IrDataType.ARRAY)))
                    .metadata(IrMetadata.of(2, 2, 0.95, 5, 0, 0))
                    .parallelizable(true);
            case TRANSFORM -> id -> IrNode.builder(id, IrNodeKind.TRANSFORM)
                    .operation("map")
                    .inputs(List.of(input(id, "input", IrDataType.OBJECT)))
                    .outputs(List.of(output(id, "output", IrDataType.OBJECT, true)))
                    .metadata(IrMetadata.of(3, 2, 0.95, 10, 1024, 2))
                    .parallelizable(true);
            case VALIDATE -> id -> IrNode.builder(id, IrNodeKind.VALIDATE)
                    .operation("validate")
                    .inputs(List.of(input(id, "input", IrDataType.OBJECT)))
                    .outputs(List.of(
                            output(id, "valid", IrDataType.BOOLEAN, false),
                            output(id, "errors", IrDataType.ARRAY, false)))
                    .metadata(IrMetadata.of(2, 2, 1.0, 8, 512, 1))
                    .parallelizable(true);
            case AGGREGATE -> id -> IrNode.builder(id, IrNodeKind.AGGREGATE)
                    .operation("reduce")
                    .inputs(List.of(input(id, "input", IrDataType.ARRAY)))
                    .outputs(List.of(output(id, "result", IrDataType.OBJECT, true)))
                    .metadata(IrMetadata.of(4, 2, 0.95, 15, 2048, 3))
                    .parallelizable(true);
            case EMIT -> id -> IrNode.builder(id, IrNodeKind.EMIT)
                    .operation("emit")
                    .inputs(List.of(input(id, "event", IrDataType.OBJECT)))
                    .metadata(IrMetadata.of(1, 1, 0.99, 2, 256, 1));
        };
    }

    static IrInput input(String nodeId, String name, IrDataType type) {
        return new IrInput(nodeId + ".in." + name, name, type, List.of(), null, false);
    }

    static IrOutput output(String nodeId, String name, IrDataType type, boolean cacheable) {
        return new IrOutput(nodeId + ".out." + name, name, type, List.of(), cacheable, null);
    }
}
