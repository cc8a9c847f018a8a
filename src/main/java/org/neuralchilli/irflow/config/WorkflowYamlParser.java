package org.neuralchilli.irflow.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.irflow.domain.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.InputStream;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Parses YAML documents into workflow descriptions and semantic contexts.
 */
@ApplicationScoped
public class WorkflowYamlParser {

    private final Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));

    /**
     * Parse a workflow from a YAML string
     */
    public WorkflowSpec parseWorkflow(String yamlContent) {
        return parseWorkflowFromMap(load(yamlContent));
    }

    /**
     * Parse a workflow from an InputStream
     */
    public WorkflowSpec parseWorkflow(InputStream inputStream) {
        return parseWorkflowFromMap(load(inputStream));
    }

    /**
     * Parse a semantic context from a YAML string
     */
    public SemanticContext parseSemanticContext(String yamlContent) {
        return parseSemanticContextFromMap(load(yamlContent));
    }

    public SemanticContext parseSemanticContext(InputStream inputStream) {
        return parseSemanticContextFromMap(load(inputStream));
    }

    private Map<String, Object> load(String yamlContent) {
        return asDocument(yaml.load(yamlContent));
    }

    private Map<String, Object> load(InputStream inputStream) {
        return asDocument(yaml.load(inputStream));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asDocument(Object document) {
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Expected a YAML mapping at document root");
        }
        return (Map<String, Object>) document;
    }

    @SuppressWarnings("unchecked")
    private WorkflowSpec parseWorkflowFromMap(Map<String, Object> data) {
        String name = getString(data, "name", true);
        String version = getString(data, "version", false);

        List<WorkflowStep> steps = new ArrayList<>();
        int index = 0;
        for (Map<String, Object> stepData : getMapList(data, "steps")) {
            index++;
            try {
                steps.add(parseStep(stepData));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid step " + index + ": " + e.getMessage(), e);
            }
        }

        List<FlowConnection> flow = null;
        Object flowValue = data.get("flow");
        if (flowValue instanceof Map<?, ?> flowMap) {
            flow = parseConnections(getMapList((Map<String, Object>) flowMap, "connections"));
        } else if (flowValue instanceof List<?>) {
            flow = parseConnections(getMapList(data, "flow"));
        }

        List<String> targetPlatforms = data.containsKey("targetPlatforms")
                ? getStringList(data, "targetPlatforms", List.of())
                : null;

        Map<String, Object> constants = new LinkedHashMap<>();
        Object constantsValue = data.get("constants");
        if (constantsValue instanceof Map<?, ?> constantsMap) {
            constantsMap.forEach((k, v) -> {
                if (v != null) {
                    constants.put(k.toString(), v);
                }
            });
        }

        return WorkflowSpec.builder(name)
                .version(version)
                .steps(steps)
                .flow(flow)
                .targetPlatforms(targetPlatforms)
                .constants(constants)
                .build();
    }

    @SuppressWarnings("unchecked")
    private WorkflowStep parseStep(Map<String, Object> data) {
        WorkflowStep.Builder step = WorkflowStep.builder(getString(data, "type", true))
                .id(getString(data, "id", false))
                .operation(getString(data, "operation", false))
                .description(getString(data, "description", false))
                .inputs(parseInputs(data.get("inputs")))
                .outputs(parseOutputs(data.get("outputs")))
                .dependencies(getStringList(data, "dependencies", List.of()))
                .parallelizable(getOptionalBoolean(data, "parallelizable"))
                .complexity(getDouble(data, "complexity"))
                .reliability(getDouble(data, "reliability"))
                .estimatedLatency(getDouble(data, "estimatedLatency"))
                .estimatedMemory(getDouble(data, "estimatedMemory"))
                .estimatedCpu(getDouble(data, "estimatedCpu"))
                .annotations(getMapList(data, "annotations").stream()
                        .map(this::parseAnnotation)
                        .collect(Collectors.toList()))
                .condition(getString(data, "condition", false))
                .loopType(getString(data, "loopType", false))
                .iterator(data.get("iterator"))
                .input(getString(data, "input", false))
                .transformType(getString(data, "transformType", false))
                .outputType(getString(data, "outputType", false));

        if (data.get("sourceLocation") instanceof Map<?, ?> location) {
            step.sourceLocation(parseSourceLocation((Map<String, Object>) location));
        }
        if (data.get("parallel") instanceof List<?> branches) {
            step.parallel(new ArrayList<>(branches));
        }

        return step.build();
    }

    @SuppressWarnings("unchecked")
    private List<InputSpec> parseInputs(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }

        List<InputSpec> inputs = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> input = (Map<String, Object>) map;
                inputs.add(new InputSpec(
                        getString(input, "name", true),
                        getString(input, "type", false),
                        getString(input, "source", false),
                        getBoolean(input, "optional", false),
                        getMapList(input, "constraints").stream()
                                .map(this::parseConstraint)
                                .collect(Collectors.toList())
                ));
            } else if (item != null) {
                // Shorthand: a bare input name
                inputs.add(InputSpec.of(item.toString(), null));
            }
        }
        return inputs;
    }

    @SuppressWarnings("unchecked")
    private List<OutputSpec> parseOutputs(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }

        List<OutputSpec> outputs = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> output = (Map<String, Object>) map;
                outputs.add(new OutputSpec(
                        getString(output, "name", true),
                        getString(output, "type", false),
                        getStringList(output, "targets", List.of()),
                        getBoolean(output, "cacheable", true)
                ));
            } else if (item != null) {
                outputs.add(OutputSpec.of(item.toString(), null));
            }
        }
        return outputs;
    }

    private IrConstraint parseConstraint(Map<String, Object> data) {
        return new IrConstraint(
                getString(data, "type", true),
                data.get("value"),
                getString(data, "severity", false)
        );
    }

    private SemanticAnnotation parseAnnotation(Map<String, Object> data) {
        Double confidence = getDouble(data, "confidence");
        return new SemanticAnnotation(
                getString(data, "concept", true),
                confidence != null ? confidence : 1.0,
                getStringList(data, "relationships", List.of()),
                getStringList(data, "constraints", List.of())
        );
    }

    private SourceLocation parseSourceLocation(Map<String, Object> data) {
        return new SourceLocation(
                getString(data, "file", false),
                getInt(data, "line", 0),
                getInt(data, "column", 0),
                getInt(data, "length", 0)
        );
    }

    private List<FlowConnection> parseConnections(List<Map<String, Object>> connections) {
        return connections.stream()
                .map(data -> new FlowConnection(
                        getString(data, "from", true),
                        getString(data, "to", true),
                        getString(data, "dataType", false),
                        getDouble(data, "weight"),
                        getString(data, "condition", false)))
                .collect(Collectors.toList());
    }

    private SemanticContext parseSemanticContextFromMap(Map<String, Object> data) {
        List<SemanticContext.Relationship> relationships = getMapList(data, "relationships").stream()
                .map(r -> new SemanticContext.Relationship(
                        getString(r, "predicate", true),
                        getString(r, "object", true)))
                .collect(Collectors.toList());

        List<SemanticContext.Constraint> constraints = getMapList(data, "constraints").stream()
                .map(c -> new SemanticContext.Constraint(
                        getString(c, "property", true),
                        getString(c, "type", true)))
                .collect(Collectors.toList());

        return new SemanticContext(getStringList(data, "concepts", List.of()), relationships, constraints);
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Boolean value = getOptionalBoolean(map, key);
        return value != null ? value : defaultValue;
    }

    private Boolean getOptionalBoolean(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    private Double getDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + key + "' is not a number: " + value, e);
        }
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Expected a mapping in '" + key + "', got: " + item);
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }
}
