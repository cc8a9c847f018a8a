package org.neuralchilli.irflow.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@ConfigMapping(prefix = "irflow")
public interface IrflowConfig {

    @WithName("default-version")
    @WithDefault("1.0.0")
    String defaultVersion();

    @WithName("default-target-platforms")
    @WithDefault("nodejs")
    List<String> defaultTargetPlatforms();

    @WithName("default-optimization-level")
    @WithDefault("2")
    int defaultOptimizationLevel();

    /**
     * Passes scheduled as disabled on newly compiled programs.
     */
    @WithName("disabled-passes")
    Optional<Set<String>> disabledPasses();

    /**
     * Directory of workflow YAML files compiled at startup. Nothing is loaded when absent.
     */
    @WithName("workflow-directory")
    Optional<String> workflowDirectory();

    Store store();

    interface Store {

        @WithName("cluster-name")
        @WithDefault("irflow-dev")
        String clusterName();

        @WithName("map-name")
        @WithDefault("ir-programs")
        String mapName();
    }
}
