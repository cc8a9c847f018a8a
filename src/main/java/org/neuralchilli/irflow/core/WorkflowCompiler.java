package org.neuralchilli.irflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.irflow.core.passes.PassRegistry;
import org.neuralchilli.irflow.domain.*;
import org.neuralchilli.irflow.util.CancellationToken;
import org.neuralchilli.irflow.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compiles a workflow description into an IR program.
 *
 * Each step becomes one or two nodes (condition and parallel steps add a merge node),
 * control-flow edges are derived from the declared flow or chained linearly,
 * and nodes without annotations are annotated afterwards.
 */
@ApplicationScoped
public class WorkflowCompiler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final NodeFactoryRegistry nodeFactories;
    private final SemanticAnnotator annotator;
    private final CostModel costModel;
    private final GuardExpressionParser guardParser;
    private final PassRegistry passRegistry;
    private final CompilerOptions options;

    @Inject
    public WorkflowCompiler(
            NodeFactoryRegistry nodeFactories,
            SemanticAnnotator annotator,
            CostModel costModel,
            GuardExpressionParser guardParser,
            PassRegistry passRegistry,
            CompilerOptions options
    ) {
        this.nodeFactories = nodeFactories;
        this.annotator = annotator;
        this.costModel = costModel;
        this.guardParser = guardParser;
        this.passRegistry = passRegistry;
        this.options = options;
    }

    public IrProgram compile(WorkflowSpec spec, SemanticContext semanticContext) {
        return compile(spec, semanticContext, CancellationToken.none());
    }

    /**
     * Compile a workflow. Nothing is stored; the caller decides what to do with the program.
     *
     * @throws CompilationException if the workflow is malformed
     * @throws java.util.concurrent.CancellationException if the token is cancelled between steps
     */
    public IrProgram compile(WorkflowSpec spec, SemanticContext semanticContext, CancellationToken token) {
        if (spec == null) {
            throw new CompilationException("Workflow spec cannot be null");
        }
        if (spec.steps().isEmpty()) {
            throw new CompilationException("Workflow '" + spec.name() + "' must have at least one step");
        }

        String programId = IdGenerator.programId();
        log.debug("Compiling workflow '{}' ({} steps) as program {}", spec.name(), spec.steps().size(), programId);

        CompilationUnit unit = new CompilationUnit();

        for (int i = 0; i < spec.steps().size(); i++) {
            token.throwIfCancelled();

            WorkflowStep step = spec.steps().get(i);
            String stepId = step.id() != null && !step.id().isBlank() ? step.id() : "step-" + (i + 1);
            StepType type = parseStepType(step, stepId);

            List<IrNode> stepNodes = switch (type) {
                case TASK -> compileTask(stepId, step);
                case CONDITION -> compileCondition(stepId, step);
                case LOOP -> compileLoop(stepId, step);
                case PARALLEL -> compileParallel(stepId, step);
                case TRANSFORM -> compileTransform(stepId, step);
            };

            unit.addStep(stepId, step, stepNodes);
            log.trace("Compiled step {} ({}) into {} nodes", stepId, type.wireName(), stepNodes.size());
        }

        List<IrEdge> edges = spec.hasExplicitFlow()
                ? declaredFlow(spec.flow(), unit)
                : linearFlow(unit.nodes);

        List<IrNode> nodes = new ArrayList<>(unit.nodes.size());
        for (IrNode node : unit.nodes) {
            nodes.add(annotator.annotate(node, unit.origins.get(node.id()), semanticContext));
        }

        IrProgram program = IrProgram.builder(programId, spec.name())
                .version(spec.version() != null ? spec.version() : options.defaultVersion())
                .nodes(nodes)
                .edges(edges)
                .entryPoints(identifyEntryPoints(nodes))
                .exitPoints(identifyExitPoints(nodes))
                .globalConstants(spec.constants())
                .semanticContext(semanticContext)
                .optimizationPasses(passRegistry.defaultSchedule(options.disabledPasses()))
                .targetPlatforms(spec.targetPlatforms() != null
                        ? spec.targetPlatforms()
                        : options.defaultTargetPlatforms())
                .build();

        log.debug("Compiled program {}: {} nodes, {} edges, {} entry points, {} exit points",
                programId, nodes.size(), edges.size(),
                program.entryPoints().size(), program.exitPoints().size());

        return program;
    }

    /**
     * Nodes of kind entry or without inputs. Disconnected zero-input nodes all count as entries.
     */
    public static List<String> identifyEntryPoints(List<IrNode> nodes) {
        return nodes.stream()
                .filter(node -> node.kind() == IrNodeKind.ENTRY || node.inputs().isEmpty())
                .map(IrNode::id)
                .toList();
    }

    /**
     * Nodes of kind exit or without outputs.
     */
    public static List<String> identifyExitPoints(List<IrNode> nodes) {
        return nodes.stream()
                .filter(node -> node.kind() == IrNodeKind.EXIT || node.outputs().isEmpty())
                .map(IrNode::id)
                .toList();
    }

    private StepType parseStepType(WorkflowStep step, String stepId) {
        try {
            return StepType.fromString(step.type());
        } catch (IllegalArgumentException e) {
            throw new CompilationException("Step '" + stepId + "': " + e.getMessage(), e);
        }
    }

    // Step handlers

    private List<IrNode> compileTask(String stepId, WorkflowStep step) {
        IrNode.Builder node = nodeFactories.create(IrNodeKind.OPERATION, stepId);
        IrNode defaults = node.build();

        return List.of(node
                .operation(step.operation())
                .inputs(compileInputs(stepId, step.inputs()))
                .outputs(compileOutputs(stepId, step.outputs()))
                .metadata(costModel.estimate(step, defaults.metadata()))
                .semanticAnnotations(step.annotations())
                .dependencies(step.dependencies())
                .parallelizable(!Boolean.FALSE.equals(step.parallelizable()))
                .build());
    }

    private List<IrNode> compileCondition(String stepId, WorkflowStep step) {
        IrNode.Builder branch = nodeFactories.create(IrNodeKind.CONDITION, stepId);
        IrNode defaults = branch.build();

        IrNode conditionNode = branch
                .inputs(List.of(new IrInput(stepId + ".in.condition", "condition", IrDataType.BOOLEAN,
                        List.of(), step.condition(), false)))
                .metadata(costModel.estimate(step, defaults.metadata()))
                .semanticAnnotations(step.annotations())
                .parallelizable(false)
                .build();

        String mergeId = stepId + ".merge";
        IrNode mergeNode = nodeFactories.create(IrNodeKind.MERGE, mergeId)
                .operation("merge")
                .inputs(List.of(
                        NodeFactoryRegistry.input(mergeId, "branch1", IrDataType.VOID),
                        NodeFactoryRegistry.input(mergeId, "branch2", IrDataType.VOID)))
                .outputs(List.of(NodeFactoryRegistry.output(mergeId, "merged", IrDataType.VOID, false)))
                .metadata(IrMetadata.of(1, 1, 1.0, 1, 0, 0))
                .parallelizable(false)
                .build();

        return List.of(conditionNode, mergeNode);
    }

    private List<IrNode> compileLoop(String stepId, WorkflowStep step) {
        IrNode.Builder loop = nodeFactories.create(IrNodeKind.LOOP, stepId);
        IrNode defaults = loop.build();

        return List.of(loop
                .operation(step.loopType() != null ? step.loopType() : "for")
                .inputs(List.of(
                        new IrInput(stepId + ".in.iterator", "iterator", IrDataType.INT32,
                                List.of(), iteratorSource(step.iterator()), false),
                        new IrInput(stepId + ".in.condition", "condition", IrDataType.BOOLEAN,
                                List.of(), step.condition(), false)))
                .metadata(costModel.estimate(step, defaults.metadata()))
                .semanticAnnotations(step.annotations())
                .parallelizable(Boolean.TRUE.equals(step.parallelizable()))
                .build());
    }

    private List<IrNode> compileParallel(String stepId, WorkflowStep step) {
        int branches = step.parallel().size();

        IrNode.Builder split = nodeFactories.create(IrNodeKind.SPLIT, stepId);
        IrNode defaults = split.build();

        List<IrOutput> branchOutputs = new ArrayList<>(branches);
        for (int i = 0; i < branches; i++) {
            branchOutputs.add(NodeFactoryRegistry.output(stepId, "branch_" + i, IrDataType.OBJECT, false));
        }

        IrNode splitNode = split
                .operation("parallel_split")
                .inputs(List.of(new IrInput(stepId + ".in.input", "input", IrDataType.ARRAY,
                        List.of(), step.input(), false)))
                .outputs(branchOutputs)
                .metadata(costModel.estimate(step, defaults.metadata()))
                .semanticAnnotations(step.annotations())
                .parallelizable(true)
                .build();

        String mergeId = stepId + ".merge";
        List<IrInput> resultInputs = new ArrayList<>(branches);
        for (int i = 0; i < branches; i++) {
            resultInputs.add(NodeFactoryRegistry.input(mergeId, "result_" + i, IrDataType.OBJECT));
        }

        IrNode mergeNode = nodeFactories.create(IrNodeKind.MERGE, mergeId)
                .operation("parallel_merge")
                .inputs(resultInputs)
                .outputs(List.of(NodeFactoryRegistry.output(mergeId, "merged", IrDataType.ARRAY, true)))
                .metadata(IrMetadata.of(1, 1, 0.98, 2, 0, 0))
                .parallelizable(false)
                .build();

        return List.of(splitNode, mergeNode);
    }

    private List<IrNode> compileTransform(String stepId, WorkflowStep step) {
        IrNode.Builder transform = nodeFactories.create(IrNodeKind.TRANSFORM, stepId);
        IrNode defaults = transform.build();

        List<IrOutput> outputs = step.outputs().isEmpty()
                ? List.of(NodeFactoryRegistry.output(stepId, "output",
                        IrDataType.fromString(step.outputType(), IrDataType.OBJECT), true))
                : compileOutputs(stepId, step.outputs());

        return List.of(transform
                .operation(step.transformType() != null ? step.transformType() : "map")
                .inputs(inputsOrDefault(stepId, step, IrDataType.OBJECT))
                .outputs(outputs)
                .metadata(costModel.estimate(step, defaults.metadata()))
                .semanticAnnotations(step.annotations())
                .dependencies(step.dependencies())
                .parallelizable(!Boolean.FALSE.equals(step.parallelizable()))
                .build());
    }

    // Ports

    private List<IrInput> inputsOrDefault(String nodeId, WorkflowStep step, IrDataType defaultType) {
        if (!step.inputs().isEmpty()) {
            return compileInputs(nodeId, step.inputs());
        }
        return List.of(new IrInput(nodeId + ".in.input", "input", defaultType, List.of(), step.input(), false));
    }

    private List<IrInput> compileInputs(String nodeId, List<InputSpec> inputs) {
        return inputs.stream()
                .map(in -> new IrInput(
                        nodeId + ".in." + in.name(),
                        in.name(),
                        IrDataType.fromString(in.type()),
                        in.constraints(),
                        in.source(),
                        in.optional()))
                .toList();
    }

    private List<IrOutput> compileOutputs(String nodeId, List<OutputSpec> outputs) {
        return outputs.stream()
                .map(out -> new IrOutput(
                        nodeId + ".out." + out.name(),
                        out.name(),
                        IrDataType.fromString(out.type()),
                        out.targets(),
                        out.cacheable(),
                        null))
                .toList();
    }

    /**
     * Numeric iterators are literal counts and get tagged as constants.
     */
    private static String iteratorSource(Object iterator) {
        if (iterator == null) {
            return null;
        }
        if (iterator instanceof Number number) {
            double value = number.doubleValue();
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return IrInput.CONSTANT_PREFIX + (long) value;
            }
            return IrInput.CONSTANT_PREFIX + value;
        }
        return iterator.toString();
    }

    // Control flow

    private List<IrEdge> linearFlow(List<IrNode> nodes) {
        List<IrEdge> edges = new ArrayList<>();
        for (int i = 0; i < nodes.size() - 1; i++) {
            edges.add(new IrEdge(
                    "edge-" + (edges.size() + 1),
                    nodes.get(i).id(),
                    nodes.get(i + 1).id(),
                    IrDataType.VOID,
                    1,
                    null
            ));
        }
        return edges;
    }

    private List<IrEdge> declaredFlow(List<FlowConnection> connections, CompilationUnit unit) {
        List<IrEdge> edges = new ArrayList<>();
        for (FlowConnection connection : connections) {
            String from = unit.resolveSource(connection.from());
            String to = unit.resolveTarget(connection.to());

            edges.add(new IrEdge(
                    "edge-" + (edges.size() + 1),
                    from,
                    to,
                    IrDataType.fromString(connection.dataType(), IrDataType.VOID),
                    connection.weight() != null ? connection.weight() : 1,
                    guardParser.parse(connection.condition())
            ));
        }
        return edges;
    }

    /**
     * Nodes compiled so far, indexed by node id and by step id.
     */
    private static final class CompilationUnit {
        private final List<IrNode> nodes = new ArrayList<>();
        private final Map<String, WorkflowStep> origins = new HashMap<>();
        private final Map<String, List<IrNode>> nodesByStep = new HashMap<>();

        void addStep(String stepId, WorkflowStep step, List<IrNode> stepNodes) {
            if (nodesByStep.containsKey(stepId)) {
                throw new CompilationException("Duplicate step id: " + stepId);
            }
            for (IrNode node : stepNodes) {
                if (origins.containsKey(node.id())) {
                    throw new CompilationException("Duplicate node id: " + node.id());
                }
                origins.put(node.id(), step);
            }
            nodesByStep.put(stepId, stepNodes);
            nodes.addAll(stepNodes);
        }

        /**
         * A step id standing for the step's last node, or a node id.
         * Step ids win, so a condition or parallel step id resolves to its merge node.
         */
        String resolveSource(String ref) {
            List<IrNode> stepNodes = nodesByStep.get(ref);
            if (stepNodes != null) {
                return stepNodes.get(stepNodes.size() - 1).id();
            }
            if (origins.containsKey(ref)) {
                return ref;
            }
            throw new CompilationException("Flow connection references unknown node: " + ref);
        }

        /**
         * A node id, or a step id standing for the step's first node.
         */
        String resolveTarget(String ref) {
            if (origins.containsKey(ref)) {
                return ref;
            }
            List<IrNode> stepNodes = nodesByStep.get(ref);
            if (stepNodes != null) {
                return stepNodes.get(0).id();
            }
            throw new CompilationException("Flow connection references unknown node: " + ref);
        }
    }
}
