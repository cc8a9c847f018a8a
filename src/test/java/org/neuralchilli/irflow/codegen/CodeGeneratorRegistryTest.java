package org.neuralchilli.irflow.codegen;

import org.junit.jupiter.api.Test;
import org.neuralchilli.irflow.core.BackendNotFoundException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeGeneratorRegistryTest {

    private final CodeGeneratorRegistry registry = new CodeGeneratorRegistry(List.of(
            new WasmCodeGenerator(), new NodeJsCodeGenerator(), new TypeScriptCodeGenerator()));

    @Test
    void shouldFindBackendsByExactTarget() {
        assertThat(registry.targets()).containsExactly("nodejs", "typescript", "wasm");
        assertThat(registry.get("wasm")).isInstanceOf(WasmCodeGenerator.class);
        assertThat(registry.find("NodeJS")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void shouldFailForUnknownTarget() {
        assertThatThrownBy(() -> registry.get("python"))
                .isInstanceOf(BackendNotFoundException.class)
                .hasMessage("No code generator registered for target: python");
    }

    @Test
    void shouldRejectDuplicateTargets() {
        assertThatThrownBy(() -> new CodeGeneratorRegistry(List.of(new WasmCodeGenerator(), new WasmCodeGenerator())))
                .isInstanceOf(IllegalStateException.class);
    }
}
