package org.neuralchilli.irflow.util;

import java.util.UUID;

/**
 * Program identifiers. Random UUIDs keep ids unique across concurrent compilations.
 */
public final class IdGenerator {

    private static final String PROGRAM_PREFIX = "ir-";

    private IdGenerator() {
    }

    public static String programId() {
        return PROGRAM_PREFIX + UUID.randomUUID();
    }
}
