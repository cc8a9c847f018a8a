package org.neuralchilli.irflow.core.passes;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.core.IrGraphService;
import org.neuralchilli.irflow.domain.OptimizationPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Registry of optimization passes by name.
 */
@ApplicationScoped
public class PassRegistry {

    private static final Logger log = LoggerFactory.getLogger(PassRegistry.class);

    /**
     * Order of the builtin passes within a level.
     */
    static final List<String> BUILTIN_ORDER = List.of(
            DeadCodeEliminationPass.NAME,
            ConstantFoldingPass.NAME,
            SemanticOptimizationPass.NAME,
            ParallelDetectionPass.NAME,
            LoopOptimizationPass.NAME,
            MemoryLayoutPass.NAME
    );

    private final Map<String, IrPass> passes = new LinkedHashMap<>();

    @Inject
    public PassRegistry(@Any Instance<IrPass> passes) {
        this(passes.stream().toList());
    }

    public PassRegistry(List<IrPass> passes) {
        List<IrPass> ordered = new ArrayList<>(passes);
        ordered.sort(Comparator
                .comparingInt(IrPass::level)
                .thenComparingInt(PassRegistry::builtinRank)
                .thenComparing(IrPass::name));

        for (IrPass pass : ordered) {
            if (this.passes.putIfAbsent(pass.name(), pass) != null) {
                throw new IllegalStateException("Duplicate optimization pass: " + pass.name());
            }
        }
        log.debug("Registered optimization passes: {}", this.passes.keySet());
    }

    /**
     * A registry of the builtin passes, for use outside the container.
     */
    public static PassRegistry builtin() {
        IrGraphService graphService = new IrGraphService();
        return new PassRegistry(List.of(
                new DeadCodeEliminationPass(graphService),
                new ConstantFoldingPass(),
                new SemanticOptimizationPass(),
                new ParallelDetectionPass(graphService),
                new LoopOptimizationPass(),
                new MemoryLayoutPass()
        ));
    }

    public Optional<IrPass> find(String name) {
        return Optional.ofNullable(passes.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(passes.keySet());
    }

    /**
     * Pass schedule attached to newly compiled programs, ordered by level.
     *
     * @param disabled names of passes scheduled as disabled
     */
    public List<OptimizationPass> defaultSchedule(Set<String> disabled) {
        return passes.values().stream()
                .map(pass -> new OptimizationPass(pass.name(), pass.level(), !disabled.contains(pass.name()), Map.of()))
                .toList();
    }

    private static int builtinRank(IrPass pass) {
        int rank = BUILTIN_ORDER.indexOf(pass.name());
        return rank >= 0 ? rank : BUILTIN_ORDER.size();
    }
}
