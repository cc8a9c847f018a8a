package org.neuralchilli.irflow.core.passes;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.IrInput;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.domain.IrNodeKind;
import org.neuralchilli.irflow.monitoring.IrEventType;

import java.util.ListIterator;
import java.util.Map;

/**
 * Unrolls loops with a small constant iteration count and vectorizes other parallelizable loops.
 */
@ApplicationScoped
public class LoopOptimizationPass implements IrPass {

    public static final String NAME = "loop-optimization";

    static final double MAX_UNROLL_ITERATIONS = 10;
    static final String UNROLLED = "unrolled_loop";
    static final String VECTORIZED = "vectorized_loop";

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
        return IrEventType.LOOPS_OPTIMIZED;
    }

    @Override
    public int apply(ProgramDraft draft, Map<String, Object> parameters) {
        int optimized = 0;

        ListIterator<IrNode> iterator = draft.nodes().listIterator();
        while (iterator.hasNext()) {
            IrNode node = iterator.next();
            if (node.kind() != IrNodeKind.LOOP) {
                continue;
            }

            if (canUnroll(node)) {
                iterator.set(node.withOperation(UNROLLED).withOptimizationLevel(2));
                optimized++;
            } else if (canVectorize(node)) {
                iterator.set(node.withOperation(VECTORIZED).withOptimizationLevel(2));
                optimized++;
            }
        }

        return optimized;
    }

    static boolean canUnroll(IrNode node) {
        return node.inputs().stream()
                .filter(input -> "iterator".equals(input.name()))
                .filter(IrInput::hasConstantSource)
                .findFirst()
                .map(input -> {
                    try {
                        return Double.parseDouble(input.constantText().trim()) <= MAX_UNROLL_ITERATIONS;
                    } catch (NumberFormatException e) {
                        return false;
                    }
                })
                .orElse(false);
    }

    static boolean canVectorize(IrNode node) {
        return node.parallelizable() && !UNROLLED.equals(node.operation());
    }
}
