package org.neuralchilli.irflow.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.config.IrflowConfig;
import org.neuralchilli.irflow.core.OptimizationException;
import org.neuralchilli.irflow.core.ProgramNotFoundException;
import org.neuralchilli.irflow.core.passes.OptimizationPipeline;
import org.neuralchilli.irflow.core.passes.OptimizationRun;
import org.neuralchilli.irflow.core.passes.PassReport;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.monitoring.IrEventPublisher;
import org.neuralchilli.irflow.monitoring.IrEventType;
import org.neuralchilli.irflow.monitoring.IrMetrics;
import org.neuralchilli.irflow.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Optimizes stored programs. The optimized program is stored under a new id; the original is left as is.
 */
@ApplicationScoped
public class ProgramOptimizerService {

    private static final Logger log = LoggerFactory.getLogger(ProgramOptimizerService.class);

    @Inject
    OptimizationPipeline pipeline;

    @Inject
    ProgramStoreService store;

    @Inject
    IrEventPublisher events;

    @Inject
    IrMetrics metrics;

    @Inject
    IrflowConfig config;

    /**
     * Optimize at the configured default level.
     */
    public IrProgram optimizeProgram(String programId) {
        return optimizeProgram(programId, config.defaultOptimizationLevel());
    }

    public IrProgram optimizeProgram(String programId, int level) {
        return optimizeProgram(programId, level, CancellationToken.none());
    }

    /**
     * @throws ProgramNotFoundException if no program has the id
     * @throws OptimizationException if a pass fails; nothing is stored
     */
    public IrProgram optimizeProgram(String programId, int level, CancellationToken token) {
        IrProgram source = store.get(programId);

        IrMetrics.Timer timer = metrics.startTimer("optimize");
        OptimizationRun run;
        try {
            run = pipeline.run(source, level, token);
        } catch (OptimizationException e) {
            log.error("Optimization of program {} failed in pass '{}'", programId, e.passName(), e);
            throw e;
        } finally {
            timer.stop();
        }

        IrProgram optimized = run.program();
        store.save(optimized);

        for (PassReport report : run.reports()) {
            events.publish(report.eventType(), optimized.id(), Map.of(
                    "passName", report.passName(),
                    "impact", report.impact()
            ));
            events.publish(IrEventType.OPTIMIZATION_APPLIED, optimized.id(), Map.of(
                    "passName", report.passName(),
                    "impact", report.impact()
            ));
        }

        log.info("Optimized program {} into {} at level {} (passes: {})",
                programId, optimized.id(), level, run.passNames());

        events.publish(IrEventType.PROGRAM_OPTIMIZED, optimized.id(), Map.of(
                "originalId", programId,
                "optimizedId", optimized.id(),
                "level", level,
                "impact", run.reports().size()
        ));
        return optimized;
    }
}
