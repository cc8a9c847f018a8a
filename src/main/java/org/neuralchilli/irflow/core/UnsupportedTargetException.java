package org.neuralchilli.irflow.core;

import java.util.List;

/**
 * Thrown when code generation is requested for a target the program does not declare.
 */
public class UnsupportedTargetException extends IrException {

    public UnsupportedTargetException(String programId, String target, List<String> declared) {
        super("Target platform " + target + " not supported by program " + programId +
                " (declared: " + declared + ")");
    }
}
