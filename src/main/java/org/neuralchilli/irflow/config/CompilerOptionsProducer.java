package org.neuralchilli.irflow.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.irflow.core.CompilerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Produces the compiler defaults from configuration.
 */
@ApplicationScoped
public class CompilerOptionsProducer {

    private static final Logger log = LoggerFactory.getLogger(CompilerOptionsProducer.class);

    @Inject
    IrflowConfig config;

    @Produces
    @Singleton
    public CompilerOptions compilerOptions() {
        CompilerOptions options = new CompilerOptions(
                config.defaultVersion(),
                config.defaultTargetPlatforms(),
                config.disabledPasses().orElse(Set.of())
        );
        log.info("Compiler defaults: version={}, targets={}, disabled passes={}",
                options.defaultVersion(), options.defaultTargetPlatforms(), options.disabledPasses());
        return options;
    }
}
