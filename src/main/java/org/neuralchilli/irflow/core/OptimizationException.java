package org.neuralchilli.irflow.core;

/**
 * Thrown when an optimization pass fails. The run is abandoned and nothing is stored.
 */
public class OptimizationException extends IrException {

    private final String passName;

    public OptimizationException(String passName, String message, Throwable cause) {
        super(message, cause);
        this.passName = passName;
    }

    public String passName() {
        return passName;
    }
}
