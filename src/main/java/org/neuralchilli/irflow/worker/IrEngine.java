package org.neuralchilli.irflow.worker;

import io.quarkus.runtime.ShutdownEvent;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.domain.*;
import org.neuralchilli.irflow.monitoring.IrMetrics;
import org.neuralchilli.irflow.service.CodeGenerationService;
import org.neuralchilli.irflow.service.ProgramOptimizerService;
import org.neuralchilli.irflow.service.ProgramStoreService;
import org.neuralchilli.irflow.service.WorkflowCompilerService;
import org.neuralchilli.irflow.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Asynchronous facade over the compiler, optimizer, generators and store.
 *
 * Operations run one at a time, in subscription order, on a single worker thread.
 * Nothing runs until the returned {@link Uni} is subscribed.
 */
@ApplicationScoped
public class IrEngine {

    private static final Logger log = LoggerFactory.getLogger(IrEngine.class);

    @Inject
    WorkflowCompilerService compilerService;

    @Inject
    ProgramOptimizerService optimizerService;

    @Inject
    CodeGenerationService codeGenerationService;

    @Inject
    ProgramStoreService store;

    @Inject
    IrMetrics metrics;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newSingleThreadExecutor(new EngineThreadFactory());
        log.info("IR engine worker started");
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public Uni<IrProgram> compileWorkflow(WorkflowSpec spec, SemanticContext context) {
        return compileWorkflow(spec, context, CancellationToken.none());
    }

    public Uni<IrProgram> compileWorkflow(WorkflowSpec spec, SemanticContext context, CancellationToken token) {
        return submit(() -> compilerService.compileWorkflow(spec, context, token));
    }

    public Uni<IrProgram> optimizeProgram(String programId) {
        return submit(() -> optimizerService.optimizeProgram(programId));
    }

    public Uni<IrProgram> optimizeProgram(String programId, int level, CancellationToken token) {
        return submit(() -> optimizerService.optimizeProgram(programId, level, token));
    }

    public Uni<GeneratedCode> generateCode(String programId, String target) {
        return submit(() -> codeGenerationService.generateCode(programId, target));
    }

    public Uni<IrProgram> getProgram(String programId) {
        return submit(() -> store.get(programId));
    }

    public Uni<List<IrProgram>> listPrograms() {
        return submit(store::list);
    }

    public Uni<Boolean> deleteProgram(String programId) {
        return submit(() -> store.delete(programId));
    }

    public Uni<ComplexityAnalysis> analyzeComplexity(String programId) {
        return submit(() -> store.analyzeComplexity(programId));
    }

    private <T> Uni<T> submit(Supplier<T> operation) {
        return Uni.createFrom().item(operation).runSubscriptionOn(executor);
    }

    /**
     * Stop accepting work, letting queued operations finish.
     */
    public void stop() {
        if (executor == null || executor.isShutdown()) {
            return;
        }

        log.info("Stopping IR engine worker...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("IR engine worker did not terminate in 30 seconds, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("IR engine worker stopped");
        metrics.logSummary();
    }

    private static class EngineThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("ir-engine-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
