package org.neuralchilli.irflow.core.passes;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.graph.DirectedPseudograph;
import org.neuralchilli.irflow.core.IrGraphService;
import org.neuralchilli.irflow.domain.IrEdge;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.domain.IrNodeKind;
import org.neuralchilli.irflow.monitoring.IrEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ListIterator;
import java.util.Map;

/**
 * Promotes parallelizable nodes without data dependencies to the parallel kind.
 * A node has data dependencies when it has more than one incoming edge or any outgoing edge carrying data.
 */
@ApplicationScoped
public class ParallelDetectionPass implements IrPass {

    public static final String NAME = "parallel-detection";

    private static final Logger log = LoggerFactory.getLogger(ParallelDetectionPass.class);

    private final IrGraphService graphService;

    @Inject
    public ParallelDetectionPass(IrGraphService graphService) {
        this.graphService = graphService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int level() {
        return 2;
    }

    @Override
    public IrEventType eventType() {
        return IrEventType.PARALLELISM_DETECTED;
    }

    @Override
    public int apply(ProgramDraft draft, Map<String, Object> parameters) {
        DirectedPseudograph<String, IrEdge> graph = graphService.buildGraph(draft.nodes(), draft.edges());
        int promoted = 0;

        ListIterator<IrNode> iterator = draft.nodes().listIterator();
        while (iterator.hasNext()) {
            IrNode node = iterator.next();
            if (!node.parallelizable() || node.kind() == IrNodeKind.PARALLEL) {
                continue;
            }
            if (hasDataDependencies(graph, node.id())) {
                continue;
            }
            iterator.set(node.withKind(IrNodeKind.PARALLEL));
            promoted++;
            log.trace("Node {} marked parallel", node.id());
        }

        return promoted;
    }

    private boolean hasDataDependencies(DirectedPseudograph<String, IrEdge> graph, String nodeId) {
        return graphService.incomingEdges(graph, nodeId).size() > 1
                || graphService.outgoingEdges(graph, nodeId).stream().anyMatch(IrEdge::carriesData);
    }
}
