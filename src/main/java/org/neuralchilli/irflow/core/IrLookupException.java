package org.neuralchilli.irflow.core;

/**
 * Thrown when a requested program or backend does not exist.
 */
public class IrLookupException extends IrException {

    public IrLookupException(String message) {
        super(message);
    }
}
