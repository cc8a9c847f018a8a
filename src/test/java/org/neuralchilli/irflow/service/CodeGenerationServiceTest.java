package org.neuralchilli.irflow.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.irflow.codegen.CodeGenerator;
import org.neuralchilli.irflow.codegen.CodeGeneratorRegistry;
import org.neuralchilli.irflow.core.BackendNotFoundException;
import org.neuralchilli.irflow.core.GenerationException;
import org.neuralchilli.irflow.core.ProgramNotFoundException;
import org.neuralchilli.irflow.core.UnsupportedTargetException;
import org.neuralchilli.irflow.domain.GeneratedCode;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.monitoring.IrEventPublisher;
import org.neuralchilli.irflow.monitoring.IrEventRecorder;
import org.neuralchilli.irflow.monitoring.IrEventType;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@QuarkusTest
class CodeGenerationServiceTest {

    @Inject
    WorkflowCompilerService compilerService;

    @Inject
    CodeGenerationService codeGenerationService;

    @Inject
    ProgramStoreService store;

    @Inject
    IrEventPublisher publisher;

    @Inject
    IrEventRecorder recorder;

    @BeforeEach
    void setup() {
        store.clear();
        recorder.clear();
    }

    @Test
    void shouldGenerateCodeForDeclaredTarget() {
        // Given
        IrProgram program = compilerService.compileWorkflow(Workflows.orders(List.of("nodejs", "wasm")), null);

        // When
        GeneratedCode code = codeGenerationService.generateCode(program.id(), "wasm");

        // Then
        assertThat(code.metadata().target()).isEqualTo("wasm");
        assertThat(code.source()).contains(";; Program nodes: 3");
        assertThat(codeGenerationService.generateCode(program.id(), "wasm").source()).isEqualTo(code.source());

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(recorder.events(IrEventType.CODE_GENERATED))
                        .filteredOn(event -> program.id().equals(event.programId()))
                        .hasSize(2)
                        .allSatisfy(event -> assertThat(event.details()).containsEntry("target", "wasm")));
    }

    @Test
    void shouldRejectTargetNotDeclaredByProgram() {
        // Given: only the default nodejs target
        IrProgram program = compilerService.compileWorkflow(Workflows.orders(), null);

        // When / Then
        assertThatThrownBy(() -> codeGenerationService.generateCode(program.id(), "wasm"))
                .isInstanceOf(UnsupportedTargetException.class)
                .hasMessageContaining("wasm");
    }

    @Test
    void shouldRejectDeclaredTargetWithoutBackend() {
        IrProgram program = compilerService.compileWorkflow(Workflows.orders(List.of("python")), null);

        assertThatThrownBy(() -> codeGenerationService.generateCode(program.id(), "python"))
                .isInstanceOf(BackendNotFoundException.class)
                .hasMessage("No code generator registered for target: python");
    }

    @Test
    void shouldFailForUnknownProgram() {
        assertThatThrownBy(() -> codeGenerationService.generateCode("missing", "nodejs"))
                .isInstanceOf(ProgramNotFoundException.class);
    }

    @Test
    void shouldWrapBackendFailures() {
        // Given: a backend that always fails
        CodeGenerator failing = mock(CodeGenerator.class);
        when(failing.target()).thenReturn("nodejs");
        when(failing.generate(any())).thenThrow(new IllegalStateException("template missing"));

        CodeGenerationService service = new CodeGenerationService(
                store, new CodeGeneratorRegistry(List.of(failing)), publisher);
        IrProgram program = compilerService.compileWorkflow(Workflows.orders(), null);

        // When / Then
        assertThatThrownBy(() -> service.generateCode(program.id(), "nodejs"))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("template missing")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
