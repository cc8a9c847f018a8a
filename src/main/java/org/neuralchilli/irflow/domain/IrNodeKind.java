package org.neuralchilli.irflow.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of IR node.
 */
public enum IrNodeKind {
    ENTRY,
    EXIT,
    OPERATION,
    CONDITION,
    LOOP,
    PARALLEL,
    MERGE,
    SPLIT,
    TRANSFORM,
    VALIDATE,
    AGGREGATE,
    EMIT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IrNodeKind fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Node kind cannot be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid node kind: " + value);
        }
    }

    @Override
    public String toString() {
        return wireName();
    }
}
