package org.neuralchilli.irflow.core.passes;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jgrapht.graph.DirectedPseudograph;
import org.neuralchilli.irflow.core.IrGraphService;
import org.neuralchilli.irflow.domain.IrEdge;
import org.neuralchilli.irflow.monitoring.IrEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Removes nodes not reachable from an entry point, and every edge touching them.
 */
@ApplicationScoped
public class DeadCodeEliminationPass implements IrPass {

    public static final String NAME = "dead-code-elimination";

    private static final Logger log = LoggerFactory.getLogger(DeadCodeEliminationPass.class);

    private final IrGraphService graphService;

    @Inject
    public DeadCodeEliminationPass(IrGraphService graphService) {
        this.graphService = graphService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int level() {
        return 1;
    }

    @Override
    public IrEventType eventType() {
        return IrEventType.DEAD_CODE_ELIMINATED;
    }

    @Override
    public int apply(ProgramDraft draft, Map<String, Object> parameters) {
        DirectedPseudograph<String, IrEdge> graph = graphService.buildGraph(draft.nodes(), draft.edges());
        Set<String> reachable = graphService.reachableFrom(graph, draft.entryPoints());

        int before = draft.nodes().size();
        draft.nodes().removeIf(node -> !reachable.contains(node.id()));
        draft.edges().removeIf(edge -> !reachable.contains(edge.from()) || !reachable.contains(edge.to()));

        int removed = before - draft.nodes().size();
        log.debug("Removed {} unreachable nodes from {}", removed, draft.id());
        return removed;
    }
}
