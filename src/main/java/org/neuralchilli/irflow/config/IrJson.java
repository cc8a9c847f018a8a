package org.neuralchilli.irflow.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.neuralchilli.irflow.domain.IrProgram;

/**
 * JSON encoding of IR programs, shared by the store serializer and the export API.
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private IrJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(IrProgram program) {
        try {
            return MAPPER.writeValueAsString(program);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode program " + program.id(), e);
        }
    }

    public static String toPrettyJson(IrProgram program) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(program);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode program " + program.id(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the JSON is not a valid program
     */
    public static IrProgram fromJson(String json) {
        try {
            return MAPPER.readValue(json, IrProgram.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid program JSON: " + e.getOriginalMessage(), e);
        }
    }
}
