package org.neuralchilli.irflow.core.passes;

import org.neuralchilli.irflow.domain.IrEdge;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.domain.IrProgram;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mutable working copy of a program while the optimization passes run.
 * Nodes and edges stay immutable; passes swap them in the lists.
 */
public final class ProgramDraft {

    private final IrProgram source;
    private final String id;
    private final List<IrNode> nodes;
    private final List<IrEdge> edges;

    public ProgramDraft(IrProgram source, String id) {
        if (source == null) {
            throw new IllegalArgumentException("Source program cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Draft id cannot be null or empty");
        }
        this.source = source;
        this.id = id;
        this.nodes = new ArrayList<>(source.nodes());
        this.edges = new ArrayList<>(source.edges());
    }

    public String id() {
        return id;
    }

    public IrProgram source() {
        return source;
    }

    /**
     * Live node list. Passes may replace, remove or reorder entries.
     */
    public List<IrNode> nodes() {
        return nodes;
    }

    /**
     * Live edge list.
     */
    public List<IrEdge> edges() {
        return edges;
    }

    public List<String> entryPoints() {
        return source.entryPoints();
    }

    /**
     * Build the optimized program. Entry and exit points that no longer exist are dropped.
     */
    public IrProgram toProgram() {
        Set<String> remaining = nodes.stream()
                .map(IrNode::id)
                .collect(Collectors.toSet());

        return source.toBuilder()
                .id(id)
                .nodes(nodes)
                .edges(edges)
                .entryPoints(source.entryPoints().stream().filter(remaining::contains).toList())
                .exitPoints(source.exitPoints().stream().filter(remaining::contains).toList())
                .build();
    }
}
