package org.neuralchilli.irflow.core.passes;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.core.OptimizationException;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.domain.OptimizationPass;
import org.neuralchilli.irflow.util.CancellationToken;
import org.neuralchilli.irflow.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Runs the scheduled passes of a program up to a requested level.
 *
 * The source program is never touched: passes rewrite a draft with a fresh program id.
 * Selected passes are those enabled with a level at most the requested one, stably sorted by level.
 */
@ApplicationScoped
public class OptimizationPipeline {

    private static final Logger log = LoggerFactory.getLogger(OptimizationPipeline.class);

    private final PassRegistry registry;

    @Inject
    public OptimizationPipeline(PassRegistry registry) {
        this.registry = registry;
    }

    public OptimizationRun run(IrProgram source, int level) {
        return run(source, level, CancellationToken.none());
    }

    /**
     * @throws OptimizationException if a pass fails; nothing of the run is kept
     * @throws CancellationException if the token is cancelled between passes
     */
    public OptimizationRun run(IrProgram source, int level, CancellationToken token) {
        ProgramDraft draft = new ProgramDraft(source, IdGenerator.programId());
        List<OptimizationPass> selected = select(source.optimizationPasses(), level);

        log.debug("Optimizing {} into {} at level {}: {} passes selected",
                source.id(), draft.id(), level, selected.size());

        List<PassReport> reports = new ArrayList<>();
        for (OptimizationPass scheduled : selected) {
            token.throwIfCancelled();

            Optional<IrPass> pass = registry.find(scheduled.name());
            if (pass.isEmpty()) {
                log.warn("Skipping unknown optimization pass '{}' on program {}", scheduled.name(), source.id());
                continue;
            }

            int impact;
            try {
                impact = pass.get().apply(draft, scheduled.parameters());
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new OptimizationException(scheduled.name(),
                        "Pass '" + scheduled.name() + "' failed on program " + source.id() + ": " + e.getMessage(), e);
            }

            log.debug("Pass {} affected {} nodes", scheduled.name(), impact);
            reports.add(new PassReport(scheduled.name(), scheduled.level(), pass.get().eventType(), impact));
        }

        IrProgram optimized;
        try {
            optimized = draft.toProgram();
        } catch (IllegalArgumentException e) {
            throw new OptimizationException(null, "Optimized program is not a valid graph: " + e.getMessage(), e);
        }
        return new OptimizationRun(optimized, reports);
    }

    static List<OptimizationPass> select(List<OptimizationPass> schedule, int level) {
        return schedule.stream()
                .filter(pass -> pass.enabled() && pass.level() <= level)
                .sorted(Comparator.comparingInt(OptimizationPass::level))
                .toList();
    }
}
