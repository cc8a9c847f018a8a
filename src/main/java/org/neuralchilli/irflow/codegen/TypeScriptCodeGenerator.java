package org.neuralchilli.irflow.codegen;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.util.StringFunctions;

import java.time.Clock;

/**
 * Typed module with a class named after the program.
 */
@ApplicationScoped
public class TypeScriptCodeGenerator extends AbstractCodeGenerator {

    public static final String TARGET = "typescript";

    public TypeScriptCodeGenerator() {
    }

    public TypeScriptCodeGenerator(Clock clock) {
        super(clock);
    }

    @Override
    public String target() {
        return TARGET;
    }

    @Override
    protected String render(IrProgram program) {
        StringBuilder source = new StringBuilder()
                .append("// Generated TypeScript from IR Program: ").append(program.name()).append('\n')
                .append("// Version: ").append(program.version()).append('\n')
                .append('\n')
                .append("export interface WorkflowInput {\n")
                .append("  [key: string]: unknown;\n")
                .append("}\n")
                .append('\n')
                .append("export interface WorkflowOutput {\n")
                .append("  [key: string]: unknown;\n")
                .append("}\n")
                .append('\n')
                .append("export class ").append(className(program)).append(" {\n")
                .append("  async execute(input: WorkflowInput): Promise<WorkflowOutput> {\n");

        for (IrNode node : program.nodes()) {
            source.append("    // ").append(describe(node)).append('\n');
        }

        return source
                .append("    return input;\n")
                .append("  }\n")
                .append("}\n")
                .toString();
    }

    static String className(IrProgram program) {
        String base = StringFunctions.toPascalCase(program.name());
        return (base.isEmpty() ? "Generated" : base) + "Workflow";
    }
}
