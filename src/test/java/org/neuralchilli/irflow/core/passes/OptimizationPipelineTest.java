package org.neuralchilli.irflow.core.passes;

import org.junit.jupiter.api.Test;
import org.neuralchilli.irflow.core.OptimizationException;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.domain.OptimizationPass;
import org.neuralchilli.irflow.monitoring.IrEventType;
import org.neuralchilli.irflow.util.CancellationToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.neuralchilli.irflow.core.passes.ProgramFixtures.*;

class OptimizationPipelineTest {

    private final OptimizationPipeline pipeline = new OptimizationPipeline(PassRegistry.builtin());

    private static IrProgram scheduled(IrProgram program, List<OptimizationPass> passes) {
        return program.toBuilder().optimizationPasses(passes).build();
    }

    private static List<OptimizationPass> defaultSchedule() {
        return PassRegistry.builtin().defaultSchedule(Set.of());
    }

    @Test
    void shouldRunOnlyPassesUpToTheRequestedLevel() {
        // Given
        IrProgram source = scheduled(
                program(List.of(operation("a", "fetch"), operation("dead", "noop")), List.of(), "a"),
                defaultSchedule());

        // When
        OptimizationRun run = pipeline.run(source, 1);

        // Then
        assertThat(run.passNames()).containsExactly("dead-code-elimination", "constant-folding");
        assertThat(run.reports().get(0).impact()).isEqualTo(1);
        assertThat(run.reports().get(0).eventType()).isEqualTo(IrEventType.DEAD_CODE_ELIMINATED);
        assertThat(run.program().nodes()).extracting(IrNode::id).containsExactly("a");
    }

    @Test
    void shouldRunAllPassesAtLevelThreeInLevelOrder() {
        IrProgram source = scheduled(program(List.of(operation("a", "fetch")), List.of(), "a"), defaultSchedule());

        OptimizationRun run = pipeline.run(source, 3);

        assertThat(run.passNames()).containsExactly(
                "dead-code-elimination", "constant-folding",
                "semantic-optimization", "parallel-detection",
                "loop-optimization", "memory-layout");
    }

    @Test
    void shouldRunNothingAtLevelZero() {
        IrProgram source = scheduled(program(List.of(operation("a", "fetch")), List.of(), "a"), defaultSchedule());

        OptimizationRun run = pipeline.run(source, 0);

        assertThat(run.reports()).isEmpty();
        assertThat(run.program().id()).isNotEqualTo(source.id());
        assertThat(run.program().nodes()).isEqualTo(source.nodes());
    }

    @Test
    void shouldLeaveSourceProgramUntouched() {
        IrProgram source = scheduled(
                program(List.of(constantOperation("sum", "add", "1", "2"), operation("dead", "noop")),
                        List.of(), "sum"),
                defaultSchedule());
        List<IrNode> before = new ArrayList<>(source.nodes());

        OptimizationRun run = pipeline.run(source, 3);

        assertThat(source.nodes()).isEqualTo(before);
        assertThat(run.program().id()).startsWith("ir-").isNotEqualTo(source.id());
        assertThat(run.program().optimizationPasses()).isEqualTo(source.optimizationPasses());
        assertThat(run.program().nodes()).extracting(IrNode::operation).containsExactly("constant");
    }

    @Test
    void shouldSkipDisabledAndUnknownPasses() {
        List<OptimizationPass> schedule = new ArrayList<>();
        schedule.add(new OptimizationPass("dead-code-elimination", 1, false, Map.of()));
        schedule.add(OptimizationPass.enabled("no-such-pass", 1));
        schedule.add(OptimizationPass.enabled("constant-folding", 1));
        IrProgram source = scheduled(program(List.of(operation("a", "fetch"), operation("b", "noop")), List.of(), "a"),
                schedule);

        OptimizationRun run = pipeline.run(source, 3);

        assertThat(run.passNames()).containsExactly("constant-folding");
        assertThat(run.program().nodes()).hasSize(2);
    }

    @Test
    void shouldWrapPassFailures() {
        IrPass failing = new IrPass() {
            @Override
            public String name() {
                return "exploding";
            }

            @Override
            public int level() {
                return 1;
            }

            @Override
            public IrEventType eventType() {
                return IrEventType.OPTIMIZATION_APPLIED;
            }

            @Override
            public int apply(ProgramDraft draft, Map<String, Object> parameters) {
                draft.nodes().clear();
                throw new IllegalStateException("boom");
            }
        };
        OptimizationPipeline failingPipeline = new OptimizationPipeline(new PassRegistry(List.of(failing)));
        IrProgram source = scheduled(program(List.of(operation("a", "fetch")), List.of(), "a"),
                List.of(OptimizationPass.enabled("exploding", 1)));

        assertThatThrownBy(() -> failingPipeline.run(source, 1))
                .isInstanceOf(OptimizationException.class)
                .hasMessageContaining("exploding")
                .hasMessageContaining("boom");
        assertThat(source.nodes()).hasSize(1);
    }

    @Test
    void shouldStopWhenCancelled() {
        IrProgram source = scheduled(program(List.of(operation("a", "fetch")), List.of(), "a"), defaultSchedule());
        CancellationToken token = CancellationToken.create();
        token.cancel("shutdown");

        assertThatThrownBy(() -> pipeline.run(source, 3, token))
                .isInstanceOf(CancellationException.class)
                .hasMessage("shutdown");
    }

    @Test
    void shouldSelectStablyByLevel() {
        List<OptimizationPass> schedule = List.of(
                OptimizationPass.enabled("late", 3),
                OptimizationPass.enabled("first", 1),
                OptimizationPass.enabled("second", 1),
                new OptimizationPass("off", 1, false, Map.of()));

        assertThat(OptimizationPipeline.select(schedule, 2))
                .extracting(OptimizationPass::name)
                .containsExactly("first", "second");
    }
}
