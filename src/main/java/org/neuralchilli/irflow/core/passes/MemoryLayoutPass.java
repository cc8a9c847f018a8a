package org.neuralchilli.irflow.core.passes;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.monitoring.IrEventType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Groups nodes with the same operation together, ordered by memory estimate within a group.
 * The sort is stable, so ties keep their compiled order.
 */
@ApplicationScoped
public class MemoryLayoutPass implements IrPass {

    public static final String NAME = "memory-layout";

    static final Comparator<IrNode> LAYOUT_ORDER = Comparator
            .comparing(IrNode::operation)
            .thenComparingDouble(node -> node.metadata().memory());

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int level() {
        return 3;
    }

    @Override
    public IrEventType eventType() {
        return IrEventType.MEMORY_LAYOUT_OPTIMIZED;
    }

    /**
     * @return the number of nodes that moved
     */
    @Override
    public int apply(ProgramDraft draft, Map<String, Object> parameters) {
        List<IrNode> before = new ArrayList<>(draft.nodes());
        draft.nodes().sort(LAYOUT_ORDER);

        int moved = 0;
        for (int i = 0; i < before.size(); i++) {
            if (!before.get(i).id().equals(draft.nodes().get(i).id())) {
                moved++;
            }
        }
        return moved;
    }
}
