package org.neuralchilli.irflow.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Data types carried by node ports and edges.
 */
public enum IrDataType {
    VOID("void"),
    BOOLEAN("boolean"),
    INT8("int8"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    FLOAT32("float32"),
    FLOAT64("float64"),
    STRING("string"),
    BUFFER("buffer"),
    OBJECT("object"),
    ARRAY("array"),
    SEMANTIC("semantic"),
    OWL_ENTITY("owl-entity"),
    WORKFLOW("workflow"),
    TASK("task");

    // Authoring-layer names that differ from the IR names
    private static final Map<String, IrDataType> ALIASES = Map.of(
            "number", FLOAT64,
            "integer", INT32,
            "int", INT32,
            "double", FLOAT64,
            "float", FLOAT32,
            "long", INT64,
            "bool", BOOLEAN
    );

    private final String wireName;

    IrDataType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a declared type name. Unknown or missing names map to OBJECT.
     */
    @JsonCreator
    public static IrDataType fromString(String value) {
        if (value == null || value.isBlank()) {
            return OBJECT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (IrDataType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return ALIASES.getOrDefault(normalized, OBJECT);
    }

    /**
     * Resolve a declared type name, using the given default when the name is absent.
     */
    public static IrDataType fromString(String value, IrDataType defaultType) {
        if (value == null || value.isBlank()) {
            return defaultType;
        }
        return fromString(value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
