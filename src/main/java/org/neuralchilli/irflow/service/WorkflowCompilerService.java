package org.neuralchilli.irflow.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.core.CompilationException;
import org.neuralchilli.irflow.core.WorkflowCompiler;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.domain.SemanticContext;
import org.neuralchilli.irflow.domain.WorkflowSpec;
import org.neuralchilli.irflow.monitoring.IrEventPublisher;
import org.neuralchilli.irflow.monitoring.IrEventType;
import org.neuralchilli.irflow.monitoring.IrMetrics;
import org.neuralchilli.irflow.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Compiles workflows and stores the resulting programs.
 */
@ApplicationScoped
public class WorkflowCompilerService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCompilerService.class);

    @Inject
    WorkflowCompiler compiler;

    @Inject
    ProgramStoreService store;

    @Inject
    IrEventPublisher events;

    @Inject
    IrMetrics metrics;

    public IrProgram compileWorkflow(WorkflowSpec spec, SemanticContext semanticContext) {
        return compileWorkflow(spec, semanticContext, CancellationToken.none());
    }

    /**
     * Compile and store a workflow.
     *
     * @throws CompilationException if the workflow is malformed; nothing is stored
     */
    public IrProgram compileWorkflow(WorkflowSpec spec, SemanticContext semanticContext, CancellationToken token) {
        String workflowName = spec != null ? spec.name() : null;
        IrMetrics.Timer timer = metrics.startTimer("compile");

        IrProgram program;
        try {
            program = compiler.compile(spec, semanticContext, token);
        } catch (CompilationException e) {
            publishError(workflowName, e);
            throw e;
        } catch (IllegalArgumentException e) {
            CompilationException failure = new CompilationException(
                    "Invalid workflow '" + workflowName + "': " + e.getMessage(), e);
            publishError(workflowName, failure);
            throw failure;
        } finally {
            timer.stop();
        }

        store.save(program);
        log.info("Compiled workflow '{}' into program {} ({} nodes, {} edges)",
                program.name(), program.id(), program.nodes().size(), program.edges().size());

        events.publish(IrEventType.WORKFLOW_COMPILED, program.id(), Map.of(
                "name", program.name(),
                "nodeCount", program.nodes().size(),
                "edgeCount", program.edges().size(),
                "impact", program.nodes().size()
        ));
        return program;
    }

    private void publishError(String workflowName, CompilationException e) {
        log.error("Compilation of workflow '{}' failed: {}", workflowName, e.getMessage());

        Map<String, Object> details = new HashMap<>();
        details.put("error", e.getMessage());
        if (workflowName != null) {
            details.put("name", workflowName);
        }
        events.publish(IrEventType.COMPILATION_ERROR, null, details);
    }
}
