package org.neuralchilli.irflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.traverse.BreadthFirstIterator;
import org.neuralchilli.irflow.domain.IrEdge;
import org.neuralchilli.irflow.domain.IrNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Graph queries over IR nodes and edges, backed by JGraphT.
 * Vertices are node ids; parallel edges and self loops are allowed, as a workflow may declare them.
 */
@ApplicationScoped
public class IrGraphService {

    private static final Logger log = LoggerFactory.getLogger(IrGraphService.class);

    /**
     * Build a directed graph of node ids with the IR edges as graph edges.
     *
     * @throws IllegalStateException if an edge references a node that is not in the list
     */
    public DirectedPseudograph<String, IrEdge> buildGraph(List<IrNode> nodes, List<IrEdge> edges) {
        DirectedPseudograph<String, IrEdge> graph = new DirectedPseudograph<>(IrEdge.class);

        for (IrNode node : nodes) {
            graph.addVertex(node.id());
        }

        for (IrEdge edge : edges) {
            if (!graph.containsVertex(edge.from()) || !graph.containsVertex(edge.to())) {
                throw new IllegalStateException(
                        "Edge '" + edge.id() + "' references unknown node: " + edge.from() + " -> " + edge.to()
                );
            }
            graph.addEdge(edge.from(), edge.to(), edge);
        }

        log.trace("Built IR graph: {} vertices, {} edges", graph.vertexSet().size(), graph.edgeSet().size());
        return graph;
    }

    /**
     * Node ids reachable from the given roots by following outgoing edges, roots included.
     * Roots that are not in the graph are ignored.
     */
    public Set<String> reachableFrom(DirectedPseudograph<String, IrEdge> graph, Collection<String> roots) {
        List<String> startVertices = roots.stream()
                .filter(graph::containsVertex)
                .distinct()
                .toList();

        if (startVertices.isEmpty()) {
            return Set.of();
        }

        Set<String> reachable = new LinkedHashSet<>();
        BreadthFirstIterator<String, IrEdge> iterator = new BreadthFirstIterator<>(graph, startVertices);
        while (iterator.hasNext()) {
            reachable.add(iterator.next());
        }
        return reachable;
    }

    public List<IrEdge> incomingEdges(DirectedPseudograph<String, IrEdge> graph, String nodeId) {
        return new ArrayList<>(graph.incomingEdgesOf(nodeId));
    }

    public List<IrEdge> outgoingEdges(DirectedPseudograph<String, IrEdge> graph, String nodeId) {
        return new ArrayList<>(graph.outgoingEdgesOf(nodeId));
    }
}
