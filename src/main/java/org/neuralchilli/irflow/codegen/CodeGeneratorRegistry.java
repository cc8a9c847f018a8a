package org.neuralchilli.irflow.codegen;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.core.BackendNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Code generator backends by target name. Lookup is exact.
 */
@ApplicationScoped
public class CodeGeneratorRegistry {

    private static final Logger log = LoggerFactory.getLogger(CodeGeneratorRegistry.class);

    private final Map<String, CodeGenerator> generators = new TreeMap<>();

    @Inject
    public CodeGeneratorRegistry(@Any Instance<CodeGenerator> generators) {
        this(generators.stream().toList());
    }

    public CodeGeneratorRegistry(List<CodeGenerator> generators) {
        for (CodeGenerator generator : generators) {
            if (this.generators.putIfAbsent(generator.target(), generator) != null) {
                throw new IllegalStateException("Duplicate code generator for target: " + generator.target());
            }
        }
        log.debug("Registered code generators: {}", this.generators.keySet());
    }

    public Optional<CodeGenerator> find(String target) {
        if (target == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(generators.get(target));
    }

    /**
     * @throws BackendNotFoundException if no backend serves the target
     */
    public CodeGenerator get(String target) {
        return find(target).orElseThrow(() -> new BackendNotFoundException(target));
    }

    public Set<String> targets() {
        return Collections.unmodifiableSet(generators.keySet());
    }
}
