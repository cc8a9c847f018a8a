package org.neuralchilli.irflow.monitoring;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event published on the event bus for every observable compiler step.
 */
public final class IrEvent {

    private final IrEventType type;
    private final String programId;
    private final Map<String, Object> details;
    private final Instant timestamp;

    public IrEvent(IrEventType type, String programId, Map<String, Object> details, Instant timestamp) {
        if (type == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        this.type = type;
        this.programId = programId;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static IrEvent of(IrEventType type, String programId, Map<String, Object> details) {
        return new IrEvent(type, programId, details, Instant.now());
    }

    public IrEventType type() {
        return type;
    }

    /**
     * The program the event concerns. Null for compilation errors raised before an id was assigned.
     */
    public String programId() {
        return programId;
    }

    public Map<String, Object> details() {
        return details;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Numeric impact of the event (removed nodes, folded constants, ...), or 0 when not reported.
     */
    public long impact() {
        Object value = details.get("impact");
        return value instanceof Number number ? number.longValue() : 0L;
    }

    @Override
    public String toString() {
        return "IrEvent[type=" + type + ", programId=" + programId + ", details=" + details + "]";
    }
}
