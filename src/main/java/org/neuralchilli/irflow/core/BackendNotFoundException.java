package org.neuralchilli.irflow.core;

/**
 * Thrown when a program declares a target platform that no code generator handles.
 */
public class BackendNotFoundException extends IrLookupException {

    public BackendNotFoundException(String target) {
        super("No code generator registered for target: " + target);
    }
}
