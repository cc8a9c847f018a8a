package org.neuralchilli.irflow.codegen;

import org.neuralchilli.irflow.domain.GeneratedCode;
import org.neuralchilli.irflow.domain.IrProgram;

/**
 * A backend that turns an IR program into source for one target platform.
 */
public interface CodeGenerator {

    /**
     * Target platform name, matched exactly against a program's target platforms.
     */
    String target();

    GeneratedCode generate(IrProgram program);
}
