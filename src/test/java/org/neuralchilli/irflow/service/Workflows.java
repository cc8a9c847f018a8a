package org.neuralchilli.irflow.service;

import org.neuralchilli.irflow.domain.InputSpec;
import org.neuralchilli.irflow.domain.SemanticAnnotation;
import org.neuralchilli.irflow.domain.WorkflowSpec;
import org.neuralchilli.irflow.domain.WorkflowStep;

import java.util.List;

/**
 * Workflow descriptions shared by the service tests.
 */
final class Workflows {

    private Workflows() {
    }

    /**
     * fetch, a foldable constant sum, and an aggregate confidently annotated as an aggregation.
     */
    static WorkflowSpec orders(List<String> targets) {
        return WorkflowSpec.builder("orders")
                .steps(List.of(
                        WorkflowStep.task("fetch").id("fetch").build(),
                        WorkflowStep.task("add").id("sum")
                                .inputs(List.of(
                                        InputSpec.constant("a", "number", 2),
                                        InputSpec.constant("b", "number", 3)))
                                .build(),
                        WorkflowStep.task("aggregate").id("total")
                                .annotations(List.of(SemanticAnnotation.of("aggregation", 0.9)))
                                .build()))
                .targetPlatforms(targets)
                .build();
    }

    static WorkflowSpec orders() {
        return orders(null);
    }
}
