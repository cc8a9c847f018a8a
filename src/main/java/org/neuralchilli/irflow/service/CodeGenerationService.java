package org.neuralchilli.irflow.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.codegen.CodeGenerator;
import org.neuralchilli.irflow.codegen.CodeGeneratorRegistry;
import org.neuralchilli.irflow.core.BackendNotFoundException;
import org.neuralchilli.irflow.core.GenerationException;
import org.neuralchilli.irflow.core.ProgramNotFoundException;
import org.neuralchilli.irflow.core.UnsupportedTargetException;
import org.neuralchilli.irflow.domain.GeneratedCode;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.monitoring.IrEventPublisher;
import org.neuralchilli.irflow.monitoring.IrEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Generates target code for stored programs.
 */
@ApplicationScoped
public class CodeGenerationService {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerationService.class);

    private final ProgramStoreService store;
    private final CodeGeneratorRegistry generators;
    private final IrEventPublisher events;

    @Inject
    public CodeGenerationService(ProgramStoreService store, CodeGeneratorRegistry generators, IrEventPublisher events) {
        this.store = store;
        this.generators = generators;
        this.events = events;
    }

    /**
     * @throws ProgramNotFoundException   if no program has the id
     * @throws UnsupportedTargetException if the program does not declare the target
     * @throws BackendNotFoundException   if the target is declared but no backend serves it
     * @throws GenerationException        if the backend fails
     */
    public GeneratedCode generateCode(String programId, String target) {
        IrProgram program = store.get(programId);

        if (!program.targets(target)) {
            throw new UnsupportedTargetException(programId, target, program.targetPlatforms());
        }

        CodeGenerator generator = generators.get(target);

        GeneratedCode code;
        try {
            code = generator.generate(program);
        } catch (RuntimeException e) {
            log.error("Code generation for program {} ({}) failed", programId, target, e);
            throw new GenerationException(
                    "Backend '" + target + "' failed for program " + programId + ": " + e.getMessage(), e);
        }

        log.info("Generated {} code for program {} ({} bytes)", target, programId, code.metadata().size());
        events.publish(IrEventType.CODE_GENERATED, programId, Map.of(
                "target", target,
                "size", code.metadata().size(),
                "impact", code.metadata().size()
        ));
        return code;
    }
}
