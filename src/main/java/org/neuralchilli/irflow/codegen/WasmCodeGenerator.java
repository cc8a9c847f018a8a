package org.neuralchilli.irflow.codegen;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.util.StringFunctions;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * WebAssembly text format module with one exported function per node.
 */
@ApplicationScoped
public class WasmCodeGenerator extends AbstractCodeGenerator {

    public static final String TARGET = "wasm";

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    public WasmCodeGenerator() {
    }

    public WasmCodeGenerator(Clock clock) {
        super(clock);
    }

    @Override
    public String target() {
        return TARGET;
    }

    @Override
    protected String render(IrProgram program) {
        StringBuilder source = new StringBuilder()
                .append(";; Generated WASM from IR Program: ").append(program.name()).append('\n')
                .append(";; Version: ").append(program.version()).append('\n')
                .append("(module\n")
                .append("  ;; Program nodes: ").append(program.nodes().size()).append('\n')
                .append("  ;; Optimization passes: ").append(program.optimizationPasses().size()).append('\n');

        for (int i = 0; i < program.nodes().size(); i++) {
            IrNode node = program.nodes().get(i);
            source.append("  ;; ").append(describe(node)).append('\n')
                    .append("  (func $").append(functionName(i, node))
                    .append(" (export ").append(watString(node.id())).append("))\n");
        }

        return source.append(")\n").toString();
    }

    /**
     * Quoted WAT string literal. Quotes, backslashes and bytes outside printable ASCII become \hh escapes.
     */
    static String watString(String value) {
        StringBuilder literal = new StringBuilder("\"");
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xff;
            if (c < 0x20 || c >= 0x7f || c == '"' || c == '\\') {
                literal.append('\\').append(HEX[c >> 4]).append(HEX[c & 0xf]);
            } else {
                literal.append((char) c);
            }
        }
        return literal.append('"').toString();
    }

    private static String functionName(int index, IrNode node) {
        String name = StringFunctions.toSnakeCase(node.id());
        return "n" + index + (name.isEmpty() ? "" : "_" + name);
    }
}
