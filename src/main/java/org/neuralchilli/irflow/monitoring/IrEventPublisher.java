package org.neuralchilli.irflow.monitoring;

import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Publishes {@link IrEvent}s on the application event bus.
 */
@ApplicationScoped
public class IrEventPublisher {

    public static final String ADDRESS = "ir.events";

    private static final Logger log = LoggerFactory.getLogger(IrEventPublisher.class);

    @Inject
    EventBus eventBus;

    public void publish(IrEventType type, String programId, Map<String, Object> details) {
        publish(IrEvent.of(type, programId, details));
    }

    public void publish(IrEvent event) {
        log.trace("Publishing {}", event);
        eventBus.publish(ADDRESS, event);
    }
}
