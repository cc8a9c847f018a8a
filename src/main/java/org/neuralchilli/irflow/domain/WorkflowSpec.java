package org.neuralchilli.irflow.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative workflow description handed to the compiler by the authoring layer.
 */
public final class WorkflowSpec {

    private final String name;
    private final String version;
    private final List<WorkflowStep> steps;
    private final List<FlowConnection> flow;
    private final List<String> targetPlatforms;
    private final Map<String, Object> constants;

    /**
     * @param flow declared connections, or null for a linear chain of steps
     */
    public WorkflowSpec(
            String name,
            String version,
            List<WorkflowStep> steps,
            List<FlowConnection> flow,
            List<String> targetPlatforms,
            Map<String, Object> constants
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be null or empty");
        }

        this.name = name;
        this.version = version;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.flow = flow != null ? List.copyOf(flow) : null;
        this.targetPlatforms = targetPlatforms != null ? List.copyOf(targetPlatforms) : null;
        this.constants = constants != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(constants))
                : Map.of();
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public List<WorkflowStep> steps() {
        return steps;
    }

    /**
     * Declared connections, or null when the workflow has no explicit flow.
     */
    public List<FlowConnection> flow() {
        return flow;
    }

    public boolean hasExplicitFlow() {
        return flow != null;
    }

    /**
     * Declared target platforms, or null to use the configured defaults.
     */
    public List<String> targetPlatforms() {
        return targetPlatforms;
    }

    public Map<String, Object> constants() {
        return constants;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        WorkflowSpec that = (WorkflowSpec) obj;
        return Objects.equals(this.name, that.name) &&
                Objects.equals(this.version, that.version) &&
                Objects.equals(this.steps, that.steps) &&
                Objects.equals(this.flow, that.flow) &&
                Objects.equals(this.targetPlatforms, that.targetPlatforms) &&
                Objects.equals(this.constants, that.constants);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, steps, flow, targetPlatforms, constants);
    }

    @Override
    public String toString() {
        return "WorkflowSpec[" +
                "name=" + name + ", " +
                "version=" + version + ", " +
                "steps=" + steps.size() + ", " +
                "flow=" + (flow != null ? flow.size() + " connections" : "linear") + ", " +
                "targetPlatforms=" + targetPlatforms + ']';
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String version;
        private List<WorkflowStep> steps = List.of();
        private List<FlowConnection> flow;
        private List<String> targetPlatforms;
        private Map<String, Object> constants = Map.of();

        public Builder(String name) {
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps = steps;
            return this;
        }

        public Builder flow(List<FlowConnection> flow) {
            this.flow = flow;
            return this;
        }

        public Builder targetPlatforms(List<String> targetPlatforms) {
            this.targetPlatforms = targetPlatforms;
            return this;
        }

        public Builder constants(Map<String, Object> constants) {
            this.constants = constants;
            return this;
        }

        public WorkflowSpec build() {
            return new WorkflowSpec(name, version, steps, flow, targetPlatforms, constants);
        }
    }
}
