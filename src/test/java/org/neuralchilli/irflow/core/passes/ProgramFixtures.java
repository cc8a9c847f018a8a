package org.neuralchilli.irflow.core.passes;

import org.neuralchilli.irflow.domain.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Small hand-built programs for pass tests.
 */
final class ProgramFixtures {

    private ProgramFixtures() {
    }

    static IrNode operation(String id, String operation) {
        return IrNode.builder(id, IrNodeKind.OPERATION)
                .operation(operation)
                .metadata(IrMetadata.of(5, 1, 0.95, 10, 1024, 1))
                .parallelizable(true)
                .build();
    }

    static IrNode constantOperation(String id, String operation, String... literals) {
        List<IrInput> inputs = new ArrayList<>();
        for (int i = 0; i < literals.length; i++) {
            inputs.add(new IrInput(id + ".in.arg" + i, "arg" + i, IrDataType.FLOAT64, List.of(),
                    IrInput.CONSTANT_PREFIX + literals[i], false));
        }
        return operation(id, operation).toBuilder().inputs(inputs).build();
    }

    static IrNode loop(String id, String iteratorSource, boolean parallelizable) {
        return IrNode.builder(id, IrNodeKind.LOOP)
                .operation("for")
                .inputs(List.of(new IrInput(id + ".in.iterator", "iterator", IrDataType.INT32, List.of(),
                        iteratorSource, false)))
                .metadata(IrMetadata.of(10, 3, 0.95, 50, 2048, 5))
                .parallelizable(parallelizable)
                .build();
    }

    static IrEdge edge(String id, String from, String to) {
        return new IrEdge(id, from, to, IrDataType.VOID, 1, null);
    }

    static IrEdge dataEdge(String id, String from, String to) {
        return new IrEdge(id, from, to, IrDataType.OBJECT, 1, null);
    }

    static IrProgram program(List<IrNode> nodes, List<IrEdge> edges, String... entryPoints) {
        return IrProgram.builder("ir-source", "fixture")
                .nodes(nodes)
                .edges(edges)
                .entryPoints(List.of(entryPoints))
                .exitPoints(nodes.isEmpty() ? List.of() : List.of(nodes.get(nodes.size() - 1).id()))
                .build();
    }

    static ProgramDraft draft(List<IrNode> nodes, List<IrEdge> edges, String... entryPoints) {
        return new ProgramDraft(program(nodes, edges, entryPoints), "ir-draft");
    }
}
