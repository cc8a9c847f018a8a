package org.neuralchilli.irflow.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.irflow.domain.*;
import org.neuralchilli.irflow.util.CancellationToken;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.*;

class WorkflowCompilerTest {

    private final WorkflowCompiler compiler = CompilerFixtures.compiler();

    private static WorkflowSpec linear(String name, WorkflowStep... steps) {
        return WorkflowSpec.builder(name).steps(List.of(steps)).build();
    }

    @Test
    void shouldCompileLinearWorkflowIntoChain() {
        // Given: three tasks without a declared flow
        WorkflowSpec spec = linear("orders",
                WorkflowStep.task("fetch").build(),
                WorkflowStep.task("enrich").build(),
                WorkflowStep.task("store").build());

        // When
        IrProgram program = compiler.compile(spec, SemanticContext.empty());

        // Then: one node per step, chained with void edges of weight 1
        assertThat(program.nodes()).extracting(IrNode::id)
                .containsExactly("step-1", "step-2", "step-3");
        assertThat(program.edges()).hasSize(2);
        assertThat(program.edges()).allSatisfy(edge -> {
            assertThat(edge.dataType()).isEqualTo(IrDataType.VOID);
            assertThat(edge.weight()).isEqualTo(1.0);
            assertThat(edge.condition()).isNull();
        });
        assertThat(program.edges()).extracting(IrEdge::id).containsExactly("edge-1", "edge-2");
        assertThat(program.edges().get(0).from()).isEqualTo("step-1");
        assertThat(program.edges().get(0).to()).isEqualTo("step-2");
    }

    @Test
    void shouldApplyProgramDefaults() {
        WorkflowSpec spec = linear("defaults", WorkflowStep.task("noop").build());

        IrProgram program = compiler.compile(spec, null);

        assertThat(program.id()).startsWith("ir-");
        assertThat(program.version()).isEqualTo("1.0.0");
        assertThat(program.targetPlatforms()).containsExactly("nodejs");
        assertThat(program.optimizationPasses()).extracting(OptimizationPass::name).containsExactly(
                "dead-code-elimination", "constant-folding", "semantic-optimization",
                "parallel-detection", "loop-optimization", "memory-layout");
        assertThat(program.optimizationPasses()).allMatch(OptimizationPass::enabled);
    }

    @Test
    void shouldKeepDeclaredVersionTargetsAndConstants() {
        WorkflowSpec spec = WorkflowSpec.builder("declared")
                .version("2.1.0")
                .targetPlatforms(List.of("typescript", "wasm"))
                .constants(Map.of("retries", 3))
                .steps(List.of(WorkflowStep.task("noop").build()))
                .build();

        IrProgram program = compiler.compile(spec, SemanticContext.empty());

        assertThat(program.version()).isEqualTo("2.1.0");
        assertThat(program.targetPlatforms()).containsExactly("typescript", "wasm");
        assertThat(program.globalConstants()).containsEntry("retries", 3);
    }

    @Test
    void shouldScheduleConfiguredPassesAsDisabled() {
        WorkflowCompiler configured = CompilerFixtures.compiler(
                CompilerFixtures.withDisabledPasses("memory-layout"));

        IrProgram program = configured.compile(
                linear("disabled", WorkflowStep.task("noop").build()), SemanticContext.empty());

        assertThat(program.optimizationPasses())
                .filteredOn(pass -> !pass.enabled())
                .extracting(OptimizationPass::name)
                .containsExactly("memory-layout");
    }

    @Test
    void shouldBuildTaskNodeFromStep() {
        WorkflowStep step = WorkflowStep.task("fetch")
                .id("load")
                .inputs(List.of(InputSpec.of("url", "string")))
                .outputs(List.of(OutputSpec.of("body", "buffer")))
                .complexity(2.0)
                .build();

        IrNode node = compiler.compile(linear("task", step), SemanticContext.empty()).nodes().get(0);

        assertThat(node.id()).isEqualTo("load");
        assertThat(node.kind()).isEqualTo(IrNodeKind.OPERATION);
        assertThat(node.operation()).isEqualTo("fetch");
        assertThat(node.parallelizable()).isTrue();
        assertThat(node.inputs()).singleElement().satisfies(input -> {
            assertThat(input.id()).isEqualTo("load.in.url");
            assertThat(input.type()).isEqualTo(IrDataType.STRING);
        });
        assertThat(node.outputs()).singleElement().satisfies(output -> {
            assertThat(output.id()).isEqualTo("load.out.body");
            assertThat(output.type()).isEqualTo(IrDataType.BUFFER);
        });
        // "fetch" has no base cost entry, so the cost is the complexity
        assertThat(node.metadata().cost()).isEqualTo(2.0);
        assertThat(node.metadata().reliability()).isEqualTo(0.95);
        assertThat(node.metadata().latency()).isEqualTo(10.0);
    }

    @Test
    void shouldNotParallelizeTaskExplicitlyMarkedSequential() {
        WorkflowStep step = WorkflowStep.task("write").parallelizable(false).build();

        IrNode node = compiler.compile(linear("seq", step), SemanticContext.empty()).nodes().get(0);

        assertThat(node.parallelizable()).isFalse();
    }

    @Test
    void shouldCompileConditionIntoBranchAndMerge() {
        WorkflowStep step = WorkflowStep.builder("condition")
                .id("check")
                .condition("amount > 100")
                .build();

        IrProgram program = compiler.compile(linear("cond", step), SemanticContext.empty());

        assertThat(program.nodes()).extracting(IrNode::id).containsExactly("check", "check.merge");

        IrNode branch = program.nodes().get(0);
        assertThat(branch.kind()).isEqualTo(IrNodeKind.CONDITION);
        assertThat(branch.operation()).isEqualTo("branch");
        assertThat(branch.inputs()).singleElement().satisfies(input -> {
            assertThat(input.type()).isEqualTo(IrDataType.BOOLEAN);
            assertThat(input.source()).isEqualTo("amount > 100");
        });
        assertThat(branch.outputs()).extracting(IrOutput::name).containsExactly("true", "false");

        IrNode merge = program.nodes().get(1);
        assertThat(merge.kind()).isEqualTo(IrNodeKind.MERGE);
        assertThat(merge.inputs()).extracting(IrInput::name).containsExactly("branch1", "branch2");
        assertThat(merge.outputs()).extracting(IrOutput::name).containsExactly("merged");
        assertThat(merge.metadata()).isEqualTo(IrMetadata.of(1, 1, 1.0, 1, 0, 0));

        // linear chain also links the companion node
        assertThat(program.edges()).singleElement().satisfies(edge -> {
            assertThat(edge.from()).isEqualTo("check");
            assertThat(edge.to()).isEqualTo("check.merge");
        });
    }

    @Test
    void shouldTagNumericLoopIteratorAsConstant() {
        WorkflowStep step = WorkflowStep.builder("loop").id("repeat").iterator(5).build();

        IrNode node = compiler.compile(linear("loop", step), SemanticContext.empty()).nodes().get(0);

        assertThat(node.kind()).isEqualTo(IrNodeKind.LOOP);
        assertThat(node.operation()).isEqualTo("for");
        assertThat(node.parallelizable()).isFalse();
        assertThat(node.inputs()).extracting(IrInput::name).containsExactly("iterator", "condition");
        assertThat(node.inputs().get(0).source()).isEqualTo("const:5");
        assertThat(node.outputs()).singleElement().satisfies(output -> {
            assertThat(output.name()).isEqualTo("result");
            assertThat(output.type()).isEqualTo(IrDataType.ARRAY);
            assertThat(output.cacheable()).isTrue();
        });
    }

    @Test
    void shouldKeepNonNumericLoopIteratorAsReference() {
        WorkflowStep step = WorkflowStep.builder("loop")
                .loopType("while")
                .iterator("items")
                .parallelizable(true)
                .build();

        IrNode node = compiler.compile(linear("loop", step), SemanticContext.empty()).nodes().get(0);

        assertThat(node.operation()).isEqualTo("while");
        assertThat(node.parallelizable()).isTrue();
        assertThat(node.inputs().get(0).source()).isEqualTo("items");
        assertThat(node.inputs().get(0).hasConstantSource()).isFalse();
    }

    @Test
    void shouldCompileParallelIntoSplitAndMerge() {
        WorkflowStep step = WorkflowStep.builder("parallel")
                .id("fan")
                .input("orders")
                .parallel(List.<Object>of("a", "b", "c"))
                .build();

        IrProgram program = compiler.compile(linear("par", step), SemanticContext.empty());

        IrNode split = program.nodes().get(0);
        assertThat(split.kind()).isEqualTo(IrNodeKind.SPLIT);
        assertThat(split.operation()).isEqualTo("parallel_split");
        assertThat(split.outputs()).extracting(IrOutput::name).containsExactly("branch_0", "branch_1", "branch_2");
        assertThat(split.inputs()).singleElement().satisfies(input -> assertThat(input.source()).isEqualTo("orders"));
        assertThat(split.metadata().cost()).isEqualTo(8.0);
        assertThat(split.metadata().reliability()).isEqualTo(0.95);
        assertThat(split.metadata().latency()).isEqualTo(5.0);

        IrNode merge = program.nodes().get(1);
        assertThat(merge.id()).isEqualTo("fan.merge");
        assertThat(merge.operation()).isEqualTo("parallel_merge");
        assertThat(merge.inputs()).extracting(IrInput::name).containsExactly("result_0", "result_1", "result_2");
        assertThat(merge.outputs()).singleElement().satisfies(output -> assertThat(output.type()).isEqualTo(IrDataType.ARRAY));
        assertThat(merge.metadata().reliability()).isEqualTo(0.98);
        assertThat(merge.metadata().latency()).isEqualTo(2.0);
    }

    @Test
    void shouldCompileTransformWithDeclaredOutputType() {
        WorkflowStep step = WorkflowStep.builder("transform")
                .transformType("filter")
                .outputType("array")
                .build();

        IrNode node = compiler.compile(linear("tx", step), SemanticContext.empty()).nodes().get(0);

        assertThat(node.kind()).isEqualTo(IrNodeKind.TRANSFORM);
        assertThat(node.operation()).isEqualTo("filter");
        assertThat(node.inputs()).singleElement().satisfies(input -> assertThat(input.type()).isEqualTo(IrDataType.OBJECT));
        assertThat(node.outputs()).singleElement().satisfies(output -> {
            assertThat(output.name()).isEqualTo("output");
            assertThat(output.type()).isEqualTo(IrDataType.ARRAY);
        });
    }

    @Test
    void shouldRejectValidateAndAggregateAsStepTypes() {
        for (String type : List.of("validate", "aggregate")) {
            WorkflowSpec spec = linear("checks", WorkflowStep.builder(type).id("check").build());

            assertThatThrownBy(() -> compiler.compile(spec, SemanticContext.empty()))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Step 'check'")
                    .hasMessageContaining("Unknown step type: " + type);
        }
    }

    @Test
    void shouldCostTasksNamedAfterTableOperations() {
        // validate and aggregate remain operations with their own base cost
        IrProgram program = compiler.compile(linear("checks",
                WorkflowStep.task("validate").build(),
                WorkflowStep.task("aggregate").complexity(2.0).build()), SemanticContext.empty());

        assertThat(program.nodes()).extracting(IrNode::kind).containsOnly(IrNodeKind.OPERATION);
        assertThat(program.nodes()).extracting(node -> node.metadata().cost()).containsExactly(2.0, 8.0);
    }

    @Test
    void shouldIdentifyEntryAndExitPoints() {
        // Given: a task with declared input and output, between two port-less tasks
        WorkflowSpec spec = linear("ends",
                WorkflowStep.task("start").id("a").outputs(List.of(OutputSpec.of("out", "object"))).build(),
                WorkflowStep.task("work").id("b")
                        .inputs(List.of(InputSpec.of("in", "object")))
                        .outputs(List.of(OutputSpec.of("out", "object")))
                        .build(),
                WorkflowStep.task("finish").id("c").inputs(List.of(InputSpec.of("in", "object"))).build());

        IrProgram program = compiler.compile(spec, SemanticContext.empty());

        assertThat(program.entryPoints()).containsExactly("a");
        assertThat(program.exitPoints()).containsExactly("c");
    }

    @Test
    void shouldTreatEveryDisconnectedZeroInputNodeAsEntry() {
        // Structural policy: entry detection looks at ports, not at edges
        WorkflowSpec spec = WorkflowSpec.builder("islands")
                .steps(List.of(
                        WorkflowStep.task("a").id("a").build(),
                        WorkflowStep.task("b").id("b").build()))
                .flow(List.of())
                .build();

        IrProgram program = compiler.compile(spec, SemanticContext.empty());

        assertThat(program.edges()).isEmpty();
        assertThat(program.entryPoints()).containsExactly("a", "b");
        assertThat(program.exitPoints()).containsExactly("a", "b");
    }

    @Test
    void shouldBuildDeclaredFlowResolvingStepIds() {
        // Given: a condition step referenced by step id on both sides
        WorkflowSpec spec = WorkflowSpec.builder("flow")
                .steps(List.of(
                        WorkflowStep.task("load").id("load").build(),
                        WorkflowStep.builder("condition").id("check").condition("ok").build(),
                        WorkflowStep.task("save").id("save").build()))
                .flow(List.of(
                        new FlowConnection("load", "check", "object", 2.0, null),
                        new FlowConnection("check", "save", null, null, "total > 10 && valid")))
                .build();

        // When
        IrProgram program = compiler.compile(spec, SemanticContext.empty());

        // Then: 'check' resolves to its branch node as target and to its merge node as source
        assertThat(program.edges()).hasSize(2);

        IrEdge first = program.edges().get(0);
        assertThat(first.from()).isEqualTo("load");
        assertThat(first.to()).isEqualTo("check");
        assertThat(first.dataType()).isEqualTo(IrDataType.OBJECT);
        assertThat(first.weight()).isEqualTo(2.0);

        IrEdge second = program.edges().get(1);
        assertThat(second.from()).isEqualTo("check.merge");
        assertThat(second.to()).isEqualTo("save");
        assertThat(second.dataType()).isEqualTo(IrDataType.VOID);
        assertThat(second.weight()).isEqualTo(1.0);
        assertThat(second.condition()).isEqualTo("total > 10 && valid");
    }

    @Test
    void shouldAcceptNodeIdsInDeclaredFlow() {
        WorkflowSpec spec = WorkflowSpec.builder("flow")
                .steps(List.of(
                        WorkflowStep.task("load").id("load").build(),
                        WorkflowStep.builder("condition").id("check").build(),
                        WorkflowStep.task("save").id("save").build()))
                .flow(List.of(FlowConnection.of("load", "check.merge"), FlowConnection.of("check.merge", "save")))
                .build();

        IrProgram program = compiler.compile(spec, SemanticContext.empty());

        assertThat(program.edges()).extracting(IrEdge::from).containsExactly("load", "check.merge");
        assertThat(program.edges()).extracting(IrEdge::to).containsExactly("check.merge", "save");
    }

    @Test
    void shouldLeaveMultiNodeStepsFromTheirMergeNode() {
        // Given: condition and parallel steps used as flow sources by step id
        WorkflowSpec spec = WorkflowSpec.builder("fan")
                .steps(List.of(
                        WorkflowStep.builder("condition").id("c").condition("ready").build(),
                        WorkflowStep.builder("parallel").id("p").parallel(List.<Object>of("x", "y")).build(),
                        WorkflowStep.task("finish").id("t").build()))
                .flow(List.of(FlowConnection.of("c", "p"), FlowConnection.of("p", "t")))
                .build();

        // When
        IrProgram program = compiler.compile(spec, SemanticContext.empty());

        // Then: sources are the merge nodes, targets the primary nodes
        assertThat(program.edges()).extracting(IrEdge::from).containsExactly("c.merge", "p.merge");
        assertThat(program.edges()).extracting(IrEdge::to).containsExactly("p", "t");
    }

    @Test
    void shouldRejectFlowToUnknownNode() {
        WorkflowSpec spec = WorkflowSpec.builder("broken")
                .steps(List.of(WorkflowStep.task("a").id("a").build()))
                .flow(List.of(FlowConnection.of("a", "missing")))
                .build();

        assertThatThrownBy(() -> compiler.compile(spec, SemanticContext.empty()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void shouldRejectMalformedGuard() {
        WorkflowSpec spec = WorkflowSpec.builder("guard")
                .steps(List.of(
                        WorkflowStep.task("a").id("a").build(),
                        WorkflowStep.task("b").id("b").build()))
                .flow(List.of(new FlowConnection("a", "b", null, null, "x > && y")))
                .build();

        assertThatThrownBy(() -> compiler.compile(spec, SemanticContext.empty()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Malformed guard expression");
    }

    @Test
    void shouldRejectEmptyWorkflow() {
        WorkflowSpec spec = WorkflowSpec.builder("empty").build();

        assertThatThrownBy(() -> compiler.compile(spec, SemanticContext.empty()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("at least one step");
    }

    @Test
    void shouldRejectUnknownStepType() {
        WorkflowSpec spec = linear("unknown", WorkflowStep.builder("teleport").build());

        assertThatThrownBy(() -> compiler.compile(spec, SemanticContext.empty()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Unknown step type: teleport");
    }

    @Test
    void shouldRejectDuplicateStepIds() {
        WorkflowSpec spec = linear("dupes",
                WorkflowStep.task("a").id("same").build(),
                WorkflowStep.task("b").id("same").build());

        assertThatThrownBy(() -> compiler.compile(spec, SemanticContext.empty()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Duplicate step id: same");
    }

    @Test
    void shouldRejectStepIdCollidingWithCompanionNode() {
        WorkflowSpec spec = linear("collide",
                WorkflowStep.builder("condition").id("check").build(),
                WorkflowStep.task("b").id("check.merge").build());

        assertThatThrownBy(() -> compiler.compile(spec, SemanticContext.empty()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("check.merge");
    }

    @Test
    void shouldKeepExplicitAnnotationsAndInferTheRest() {
        SemanticAnnotation explicit = SemanticAnnotation.of("aggregation", 0.95);
        WorkflowSpec spec = linear("annotated",
                WorkflowStep.task("sum").annotations(List.of(explicit)).build(),
                WorkflowStep.task("task").build(),
                WorkflowStep.task("fetchOrders").build());

        IrProgram program = compiler.compile(spec, SemanticContext.empty());

        assertThat(program.nodes().get(0).semanticAnnotations()).containsExactly(explicit);
        assertThat(program.nodes().get(1).semanticAnnotations())
                .extracting(SemanticAnnotation::concept)
                .containsExactly("execution", "process", "action");
        assertThat(program.nodes().get(2).semanticAnnotations()).isEmpty();
    }

    @Test
    void shouldStopWhenCancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel("shutting down");

        WorkflowSpec spec = linear("cancelled", WorkflowStep.task("a").build());

        assertThatThrownBy(() -> compiler.compile(spec, SemanticContext.empty(), token))
                .isInstanceOf(CancellationException.class)
                .hasMessage("shutting down");
    }
}
