package org.neuralchilli.irflow.codegen;

import org.neuralchilli.irflow.domain.GeneratedCode;
import org.neuralchilli.irflow.domain.IrNode;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.util.StringFunctions;

import java.time.Clock;
import java.time.Instant;

/**
 * Base backend: renders the source, then measures and checksums it.
 * The rendered source depends on the program only, never on the clock.
 */
public abstract class AbstractCodeGenerator implements CodeGenerator {

    private final Clock clock;

    protected AbstractCodeGenerator() {
        this(Clock.systemUTC());
    }

    protected AbstractCodeGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public GeneratedCode generate(IrProgram program) {
        String source = render(program);

        return new GeneratedCode(source, new GeneratedCode.Metadata(
                target(),
                StringFunctions.utf8Length(source),
                StringFunctions.sha256Hex(source),
                Instant.now(clock).toString()
        ));
    }

    protected abstract String render(IrProgram program);

    protected static String describe(IrNode node) {
        return "Node: " + node.id() + " (" + node.kind().wireName() + ": " + node.operation() + ")";
    }
}
