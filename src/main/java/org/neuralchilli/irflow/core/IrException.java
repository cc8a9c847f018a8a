package org.neuralchilli.irflow.core;

/**
 * Base class of every failure raised by the IR engine.
 * Unchecked: callers of the engine decide where to handle failures.
 */
public class IrException extends RuntimeException {

    public IrException(String message) {
        super(message);
    }

    public IrException(String message, Throwable cause) {
        super(message, cause);
    }
}
