package org.neuralchilli.irflow.core.passes;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.*;
import org.neuralchilli.irflow.monitoring.IrEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

/**
 * Replaces operation nodes whose inputs are all literal constants with a constant node.
 * Supported operations: add, multiply (numeric) and concat (string).
 */
@ApplicationScoped
public class ConstantFoldingPass implements IrPass {

    public static final String NAME = "constant-folding";

    private static final Logger log = LoggerFactory.getLogger(ConstantFoldingPass.class);

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
        return IrEventType.CONSTANTS_FOLDED;
    }

    @Override
    public int apply(ProgramDraft draft, Map<String, Object> parameters) {
        int folded = 0;

        ListIterator<IrNode> iterator = draft.nodes().listIterator();
        while (iterator.hasNext()) {
            IrNode node = iterator.next();
            if (!canFold(node)) {
                continue;
            }

            Object value = evaluate(node);
            if (value != null) {
                iterator.set(toConstant(node, value));
                folded++;
                log.trace("Folded node {} ({}) to {}", node.id(), node.operation(), value);
            }
        }

        return folded;
    }

    static boolean canFold(IrNode node) {
        return node.kind() == IrNodeKind.OPERATION
                && node.inputs().size() >= 2
                && node.inputs().stream().allMatch(IrInput::hasConstantSource);
    }

    /**
     * Evaluate the node's constant expression, or null if it cannot be folded.
     */
    static Object evaluate(IrNode node) {
        List<String> literals = node.inputs().stream()
                .map(IrInput::constantText)
                .toList();

        return switch (node.operation()) {
            case "add" -> arithmetic(literals, 0.0, Double::sum);
            case "multiply" -> arithmetic(literals, 1.0, (a, b) -> a * b);
            case "concat" -> String.join("", literals);
            default -> null;
        };
    }

    private static Double arithmetic(List<String> literals, double identity,
                                     DoubleBinaryOperator operator) {
        double result = identity;
        for (String literal : literals) {
            double value;
            try {
                value = Double.parseDouble(literal.trim());
            } catch (NumberFormatException e) {
                return null;
            }
            if (Double.isNaN(value)) {
                return null;
            }
            result = operator.applyAsDouble(result, value);
        }
        return result;
    }

    private static IrNode toConstant(IrNode node, Object value) {
        IrDataType type = value instanceof Double ? IrDataType.FLOAT64 : IrDataType.STRING;

        return node.toBuilder()
                .operation("constant")
                .inputs(List.of())
                .outputs(List.of(new IrOutput(node.id() + ".out.value", "value", type, List.of(), true, value)))
                .metadata(node.metadata().withCost(0).withComplexity(0))
                .build();
    }
}
