package org.neuralchilli.irflow.core.passes;

import org.junit.jupiter.api.Test;
import org.neuralchilli.irflow.domain.OptimizationPass;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PassRegistryTest {

    @Test
    void shouldOrderBuiltinPassesByLevel() {
        PassRegistry registry = PassRegistry.builtin();

        assertThat(registry.names()).containsExactly(
                "dead-code-elimination", "constant-folding",
                "semantic-optimization", "parallel-detection",
                "loop-optimization", "memory-layout");
        assertThat(registry.find("memory-layout")).get().isInstanceOf(MemoryLayoutPass.class);
        assertThat(registry.find("unknown")).isEmpty();
    }

    @Test
    void shouldMarkDisabledPassesInSchedule() {
        List<OptimizationPass> schedule = PassRegistry.builtin().defaultSchedule(Set.of("memory-layout"));

        assertThat(schedule).hasSize(6);
        assertThat(schedule).filteredOn(pass -> !pass.enabled())
                .extracting(OptimizationPass::name)
                .containsExactly("memory-layout");
        assertThat(schedule).extracting(OptimizationPass::level).containsExactly(1, 1, 2, 2, 3, 3);
    }

    @Test
    void shouldRejectDuplicatePassNames() {
        assertThatThrownBy(() -> new PassRegistry(List.of(new MemoryLayoutPass(), new MemoryLayoutPass())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("memory-layout");
    }
}
