package org.neuralchilli.irflow.core;

import java.util.List;
import java.util.Set;

/**
 * Defaults applied when a workflow leaves them unspecified.
 *
 * @param disabledPasses passes scheduled disabled on every newly compiled program
 */
public record CompilerOptions(
        String defaultVersion,
        List<String> defaultTargetPlatforms,
        Set<String> disabledPasses
) {
    public CompilerOptions {
        if (defaultVersion == null || defaultVersion.isBlank()) {
            defaultVersion = "1.0.0";
        }
        defaultTargetPlatforms = defaultTargetPlatforms != null && !defaultTargetPlatforms.isEmpty()
                ? List.copyOf(defaultTargetPlatforms)
                : List.of("nodejs");
        disabledPasses = disabledPasses != null ? Set.copyOf(disabledPasses) : Set.of();
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions("1.0.0", List.of("nodejs"), Set.of());
    }
}
