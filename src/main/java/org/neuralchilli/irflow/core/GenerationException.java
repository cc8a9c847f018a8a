package org.neuralchilli.irflow.core;

/**
 * Thrown when a code generator backend fails internally.
 */
public class GenerationException extends IrException {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
