package org.neuralchilli.irflow.monitoring;

import io.quarkus.vertx.ConsumeEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every published event and feeds the metrics counters.
 */
@ApplicationScoped
public class IrEventLogger {

    private static final Logger log = LoggerFactory.getLogger(IrEventLogger.class);

    @Inject
    IrMetrics metrics;

    @ConsumeEvent(IrEventPublisher.ADDRESS)
    public void onEvent(IrEvent event) {
        metrics.record(event);

        switch (event.type()) {
            case COMPILATION_ERROR -> log.warn("{} for program {}: {}",
                    event.type(), event.programId(), event.details());
            case WORKFLOW_COMPILED, PROGRAM_OPTIMIZED, CODE_GENERATED -> log.info("{} {} {}",
                    event.type(), event.programId(), event.details());
            default -> log.debug("{} {} {}", event.type(), event.programId(), event.details());
        }
    }
}
