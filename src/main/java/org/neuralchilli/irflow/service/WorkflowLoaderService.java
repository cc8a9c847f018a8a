package org.neuralchilli.irflow.service;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.config.IrflowConfig;
import org.neuralchilli.irflow.config.WorkflowYamlParser;
import org.neuralchilli.irflow.domain.IrProgram;
import org.neuralchilli.irflow.domain.SemanticContext;
import org.neuralchilli.irflow.domain.WorkflowSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads workflow YAML files and compiles them.
 * A {@value #CONTEXT_FILE} file in a workflow directory supplies the semantic context for the others.
 */
@ApplicationScoped
public class WorkflowLoaderService {

    public static final String CONTEXT_FILE = "semantic-context.yaml";

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoaderService.class);

    @Inject
    WorkflowYamlParser yamlParser;

    @Inject
    WorkflowCompilerService compilerService;

    @Inject
    IrflowConfig config;

    /**
     * Compile every workflow of the configured directory on startup
     */
    void onStart(@Observes StartupEvent event) {
        config.workflowDirectory().ifPresentOrElse(
                directory -> {
                    log.info("Loading workflows from: {}", directory);
                    logResults(loadAll(Path.of(directory)));
                },
                () -> log.debug("No workflow directory configured")
        );
    }

    /**
     * Load and compile all workflow files of a directory, recursively
     */
    public List<LoadResult> loadAll(Path directory) {
        List<LoadResult> results = new ArrayList<>();

        if (!Files.isDirectory(directory)) {
            log.warn("Workflow directory does not exist: {}", directory);
            return results;
        }

        SemanticContext context = loadSemanticContext(directory.resolve(CONTEXT_FILE));

        try (Stream<Path> paths = Files.walk(directory)) {
            paths.filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                    .filter(p -> !CONTEXT_FILE.equals(p.getFileName().toString()))
                    .sorted()
                    .forEach(path -> results.add(loadWorkflow(path, context)));
        } catch (IOException e) {
            log.error("Error scanning workflow directory: {}", directory, e);
        }

        return results;
    }

    /**
     * Load and compile a single workflow file
     */
    public LoadResult loadWorkflow(Path path, SemanticContext context) {
        try {
            log.debug("Loading workflow from: {}", path);

            WorkflowSpec spec = yamlParser.parseWorkflow(Files.readString(path));
            IrProgram program = compilerService.compileWorkflow(spec, context);

            log.info("Loaded workflow: {} ({} steps) as {}", spec.name(), spec.steps().size(), program.id());
            return LoadResult.success(spec.name(), program.id());

        } catch (IOException e) {
            log.error("Failed to read workflow file: {}", path, e);
            return LoadResult.failure(path.getFileName().toString(), e);
        } catch (RuntimeException e) {
            log.error("Failed to load workflow from: {}", path, e);
            return LoadResult.failure(path.getFileName().toString(), e);
        }
    }

    /**
     * Read a semantic context file. A missing file yields an empty context.
     *
     * @throws IllegalArgumentException if the file exists but cannot be read or parsed
     */
    public SemanticContext loadSemanticContext(Path path) {
        if (!Files.isRegularFile(path)) {
            return SemanticContext.empty();
        }
        try {
            SemanticContext context = yamlParser.parseSemanticContext(Files.readString(path));
            log.info("Loaded semantic context from {} ({} concepts)", path, context.concepts().size());
            return context;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read semantic context: " + path, e);
        }
    }

    private void logResults(List<LoadResult> results) {
        long successful = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - successful;

        if (failed > 0) {
            log.warn("Loaded {} workflows: {} successful, {} failed", results.size(), successful, failed);
            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  {}: {}", r.name(), r.error().orElse("unknown error")));
        } else {
            log.info("Loaded {} workflows: all successful", results.size());
        }
    }
}
