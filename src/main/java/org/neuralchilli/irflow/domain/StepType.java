package org.neuralchilli.irflow.domain;

import java.util.Locale;

/**
 * Kinds of workflow step accepted by the compiler.
 */
public enum StepType {
    TASK,
    CONDITION,
    LOOP,
    PARALLEL,
    TRANSFORM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a step type (case-insensitive).
     *
     * @throws IllegalArgumentException for null or unknown names
     */
    public static StepType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Step type cannot be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown step type: " + value +
                            ". Valid types: task, condition, loop, parallel, transform"
            );
        }
    }
}
