package org.neuralchilli.irflow.core;

/**
 * Thrown when a workflow cannot be compiled: unknown step type, empty workflow,
 * duplicate step ids, a flow connection to a non-existent node or a malformed guard.
 */
public class CompilationException extends IrException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
