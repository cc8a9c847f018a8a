package org.neuralchilli.irflow.codegen;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.domain.IrProgram;

import java.time.Clock;

/**
 * CommonJS module exposing the workflow as an event emitter.
 */
@ApplicationScoped
public class NodeJsCodeGenerator extends AbstractCodeGenerator {

    public static final String TARGET = "nodejs";

    public NodeJsCodeGenerator() {
    }

    public NodeJsCodeGenerator(Clock clock) {
        super(clock);
    }

    @Override
    public String target() {
        return TARGET;
    }

    @Override
    protected String render(IrProgram program) {
        StringBuilder source = new StringBuilder()
                .append("// Generated from IR Program: ").append(program.name()).append('\n')
                .append("// Version: ").append(program.version()).append('\n')
                .append('\n')
                .append("const { EventEmitter } = require('events');\n")
                .append('\n')
                .append("class GeneratedWorkflow extends EventEmitter {\n")
                .append("  async execute(input) {\n");

        for (IrNode node : program.nodes()) {
            source.append("    // ").append(describe(node)).append('\n');
        }

        return source
                .append("    return input;\n")
                .append("  }\n")
                .append("}\n")
                .append('\n')
                .append("module.exports = { GeneratedWorkflow };\n")
                .toString();
    }
}
