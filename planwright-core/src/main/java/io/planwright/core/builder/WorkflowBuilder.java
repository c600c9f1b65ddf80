package io.planwright.core.builder;

import io.planwright.core.exception.WorkflowValidationException;
import io.planwright.core.plan.ExecutableEdge;
import io.planwright.core.plan.ExecutableNode;
import io.planwright.core.plan.ExecutionPlan;
import io.planwright.core.plan.HandleType;
import io.planwright.core.plan.LoopBoundary;
import io.planwright.core.plan.ParallelBoundary;
import io.planwright.core.plan.PlanSummary;
import io.planwright.core.workflow.WorkflowDefinition;
import io.planwright.core.workflow.WorkflowEdge;
import io.planwright.core.workflow.WorkflowNode;
import io.planwright.core.workflow.node.LoopType;
import io.planwright.core.workflow.node.NodeCategory;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Compiles a {@link WorkflowDefinition} into an {@link ExecutionPlan}.
///
/// ### Pipeline
/// ```
/// validate definition
///   → PathConstructor     reachability, dangling edge warnings
///   → NodeConstructor     executable nodes, seeded edges, parallel branches
///   → LoopConstructor     sentinels and loop rewiring
///   → EdgeConstructor     handle classification, edge warnings
///   → config checks       (if enabled)
///   → structural limits   loop nesting depth, parallel branch count
///   → execution levels, start nodes
///   → assemble and verify plan
/// ```
///
/// ### Contracts
/// - **Precondition**: the definition has a non-empty node map, an edge list and an
///   existing entry point, else {@link WorkflowValidationException}
/// - **Postcondition**: the returned plan is immutable and internally consistent
/// - **Invariant**: building the same definition twice yields structurally identical plans
///
/// @implNote Thread-safe. The builder holds only immutable options and a listener; all
/// build state lives in a {@link ConstructionContext} scoped to one call.
///
/// @see ExecutionPlan for the output
public final class WorkflowBuilder {

    private static final Logger logger = Logger.getLogger(WorkflowBuilder.class.getName());

    private final BuildOptions options;
    private final BuildListener listener;

    /// Creates a builder with default options and no listener.
    public WorkflowBuilder() {
        this(BuildOptions.defaults(), BuildListener.NOOP);
    }

    /// Creates a builder with the given default options.
    ///
    /// @param options options used by {@link #build(WorkflowDefinition)}, not null
    public WorkflowBuilder(BuildOptions options) {
        this(options, BuildListener.NOOP);
    }

    /// Creates a builder with options and a progress listener.
    ///
    /// @param options options used by {@link #build(WorkflowDefinition)}, not null
    /// @param listener receives stage and warning callbacks, not null
    public WorkflowBuilder(BuildOptions options, BuildListener listener) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    public BuildOptions getOptions() {
        return options;
    }

    /// Builds a plan with this builder's options.
    ///
    /// @param definition the definition, not null
    /// @return compiled plan, never null
    /// @throws WorkflowValidationException on structural errors or exceeded limits
    public ExecutionPlan build(WorkflowDefinition definition) {
        return build(definition, options);
    }

    /// Builds a plan with per-call options.
    ///
    /// @param definition the definition, not null
    /// @param buildOptions options for this build, not null
    /// @return compiled plan, never null
    /// @throws WorkflowValidationException on structural errors or exceeded limits
    /// @throws IllegalStateException if the assembled plan is internally inconsistent
    public ExecutionPlan build(WorkflowDefinition definition, BuildOptions buildOptions) {
        Objects.requireNonNull(buildOptions, "buildOptions must not be null");
        validateDefinition(definition);
        logger.info(
                "Building execution plan for workflow '"
                        + definition.getName()
                        + "' ("
                        + definition.getNodes().size()
                        + " nodes, "
                        + definition.getEdges().size()
                        + " edges)");

        ReachabilityResult reachability = PathConstructor.build(definition);
        ConstructionContext context = new ConstructionContext(definition, buildOptions, reachability);
        PathConstructor.validateEdgeReferences(definition).forEach(context::warn);
        listener.onStageComplete(BuildStage.PATHS, context);

        NodeConstructor.build(definition, reachability, context);
        NodeConstructor.expandParallelNodes(context);
        listener.onStageComplete(BuildStage.NODES, context);

        LoopConstructor.expand(context);
        listener.onStageComplete(BuildStage.LOOPS, context);

        EdgeConstructor.build(definition, reachability, context);
        listener.onStageComplete(BuildStage.EDGES, context);

        if (buildOptions.validateConfigs()) {
            validateConfigs(context);
        }
        checkLoopDepth(context);
        checkParallelBranches(context);

        List<List<String>> levels = computeExecutionLevels(context);
        List<String> startNodes = findStartNodes(context);
        listener.onStageComplete(BuildStage.LEVELS, context);

        ExecutionPlan plan =
                ExecutionPlan.builder()
                        .definition(definition)
                        .entryPoint(reachability.entryPointId())
                        .nodes(context.getNodes())
                        .edges(context.getEdges())
                        .startNodes(startNodes)
                        .executionLevels(levels)
                        .loopBoundaries(context.getLoopBoundaries())
                        .parallelBoundaries(context.getParallelBoundaries())
                        .warnings(context.getWarnings())
                        .outputNodeIds(findOutputNodes(context))
                        .maxConcurrentNodes(definition.getSettings().effectiveMaxConcurrentNodes())
                        .build();
        verifyPlan(plan);

        plan.getWarnings().forEach(listener::onWarning);
        logger.info(
                "Built execution plan: "
                        + plan.getNodeCount()
                        + " nodes, "
                        + plan.getEdges().size()
                        + " edges, "
                        + levels.size()
                        + " levels, "
                        + plan.getWarnings().size()
                        + " warnings");
        return plan;
    }

    /// Checks a definition without failing.
    ///
    /// @param definition the definition, may be malformed
    /// @return validation outcome, never null
    public ValidationResult validateWorkflow(WorkflowDefinition definition) {
        return validateWorkflow(definition, options);
    }

    /// Checks a definition without failing.
    ///
    /// Builds the plan and adds warnings for unreachable nodes and for nodes with no edge
    /// at all. Any exception raised by the build becomes `valid = false` with its message.
    ///
    /// @param definition the definition, may be malformed
    /// @param buildOptions options for the trial build, not null
    /// @return validation outcome, never null
    public ValidationResult validateWorkflow(
            WorkflowDefinition definition, BuildOptions buildOptions) {
        try {
            ExecutionPlan plan = build(definition, buildOptions);
            List<BuildWarning> warnings = new ArrayList<>(plan.getWarnings());
            warnings.addAll(connectivityWarnings(definition));
            return new ValidationResult(true, List.of(), warnings);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.warning("Workflow validation failed: " + message);
            return new ValidationResult(false, List.of(message), List.of());
        }
    }

    /// Summarizes a plan.
    ///
    /// @param plan the plan, not null
    /// @return summary, never null
    public static PlanSummary getExecutionPlanSummary(ExecutionPlan plan) {
        int widest = 0;
        for (List<String> level : plan.getExecutionLevels()) {
            widest = Math.max(widest, level.size());
        }
        List<String> terminals = new ArrayList<>();
        for (ExecutableNode node : plan.getNodes().values()) {
            if (node.isTerminal()) {
                terminals.add(node.getId());
            }
        }
        return new PlanSummary(
                plan.getNodeCount(),
                plan.getEdges().size(),
                plan.getExecutionLevels().size(),
                plan.getLoopBoundaries().size(),
                plan.getParallelBoundaries().size(),
                plan.getWarnings().size(),
                widest,
                plan.getMaxConcurrentNodes(),
                plan.getEntryPoint(),
                terminals,
                plan.getOutputNodeIds());
    }

    // -----------------------------------------------------------------------
    // Validation
    // -----------------------------------------------------------------------

    private static void validateDefinition(WorkflowDefinition definition) {
        if (definition == null) {
            throw new WorkflowValidationException("Workflow definition is required");
        }
        if (definition.getNodes() == null || definition.getNodes().isEmpty()) {
            throw new WorkflowValidationException("Workflow has no nodes");
        }
        if (definition.getEdges() == null) {
            throw new WorkflowValidationException("Workflow has no edge list");
        }
        String entryPoint = definition.getEntryPoint();
        if (entryPoint == null || entryPoint.isBlank()) {
            throw new WorkflowValidationException("Workflow has no entry point");
        }
        if (!definition.getNodes().containsKey(entryPoint)) {
            throw new WorkflowValidationException(
                    "Entry point '" + entryPoint + "' does not exist", entryPoint);
        }
    }

    private static List<BuildWarning> connectivityWarnings(WorkflowDefinition definition) {
        Set<String> connected = new HashSet<>();
        for (WorkflowEdge edge : definition.getEdges()) {
            connected.add(edge.source());
            connected.add(edge.target());
        }
        ReachabilityResult reachability = PathConstructor.build(definition);
        List<BuildWarning> warnings = new ArrayList<>();
        for (String nodeId : reachability.unreachableNodeIds()) {
            if (connected.contains(nodeId)) {
                warnings.add(
                        BuildWarning.forNode(
                                WarningCode.UNREACHABLE_NODE,
                                "Node '" + nodeId + "' is not reachable from the entry point",
                                nodeId));
            } else {
                warnings.add(
                        BuildWarning.forNode(
                                WarningCode.UNCONNECTED_NODE,
                                "Node '" + nodeId + "' has no incoming or outgoing edges",
                                nodeId));
            }
        }
        return warnings;
    }

    /// Per-node config checks. Every finding is a warning; the build continues.
    static void validateConfigs(ConstructionContext context) {
        for (ExecutableNode node : context.getNodes().values()) {
            if (node.isLoopSentinel()) {
                continue;
            }
            Map<String, Object> config = node.getConfig();
            if (node.getCategory() == NodeCategory.LOOP) {
                checkLoopConfig(context, node, config);
            }
            if (config.containsKey("errorPort") && !(config.get("errorPort") instanceof Boolean)) {
                invalidConfig(context, node, "config.errorPort must be a boolean");
            }
            WorkflowNode raw = context.getDefinition().getNodes().get(node.getId());
            if (raw != null
                    && raw.onError() != null
                    && raw.onError().isGoto()
                    && (raw.onError().targetNodeId() == null
                            || raw.onError().targetNodeId().isBlank())) {
                invalidConfig(context, node, "onError strategy 'goto' requires a target node");
            }
        }
    }

    private static void checkLoopConfig(
            ConstructionContext context, ExecutableNode node, Map<String, Object> config) {
        switch (LoopType.fromNodeType(node.getType())) {
            case FOR -> {
                if (config.containsKey("count") && !isPositiveInteger(config.get("count"))) {
                    invalidConfig(context, node, "loop count must be a positive number");
                }
            }
            case FOR_EACH -> {
                if (isBlank(config.get("sourceArray")) && isBlank(config.get("arrayPath"))) {
                    invalidConfig(context, node, "forEach loop has no source array");
                }
            }
            case WHILE, DO_WHILE -> {
                if (isBlank(config.get("condition"))) {
                    invalidConfig(context, node, node.getType() + " loop has no condition");
                }
            }
        }
    }

    private static boolean isPositiveInteger(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue() >= 1;
        }
        if (raw instanceof String text) {
            try {
                return Integer.parseInt(text.trim()) >= 1;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    private static boolean isBlank(Object raw) {
        return !(raw instanceof String text) || text.isBlank();
    }

    private static void invalidConfig(ConstructionContext context, ExecutableNode node, String problem) {
        context.warn(
                BuildWarning.forNode(
                        WarningCode.INVALID_NODE_CONFIG,
                        "Node '" + node.getId() + "': " + problem,
                        node.getId()));
    }

    // -----------------------------------------------------------------------
    // Structural limits
    // -----------------------------------------------------------------------

    private static void checkLoopDepth(ConstructionContext context) {
        int limit = context.getOptions().maxLoopDepth();
        for (String nodeId : context.getNodes().keySet()) {
            int depth = LoopConstructor.getLoopDepth(context, nodeId);
            if (depth > limit) {
                throw new WorkflowValidationException(
                        "Node '"
                                + nodeId
                                + "' exceeds maximum loop nesting depth of "
                                + limit
                                + " (depth "
                                + depth
                                + ")",
                        nodeId);
            }
        }
    }

    private static void checkParallelBranches(ConstructionContext context) {
        int limit = context.getOptions().maxParallelBranches();
        for (ParallelBoundary boundary : context.getParallelBoundaries().values()) {
            if (boundary.branchCount() > limit) {
                throw new WorkflowValidationException(
                        "Parallel node '"
                                + boundary.parallelNodeId()
                                + "' has "
                                + boundary.branchCount()
                                + " branches, exceeding the maximum of "
                                + limit,
                        boundary.parallelNodeId());
            }
        }
    }

    // -----------------------------------------------------------------------
    // Scheduling
    // -----------------------------------------------------------------------

    /// Groups nodes into levels: a node joins the first level after all its dependencies.
    ///
    /// If a pass assigns nothing, the remaining nodes depend on each other; they are
    /// reported as {@link WarningCode#CYCLE_DETECTED} and placed together in a final level.
    static List<List<String>> computeExecutionLevels(ConstructionContext context) {
        Map<String, ExecutableNode> nodes = context.getNodes();
        Set<String> assigned = new HashSet<>();
        Set<String> remaining = new LinkedHashSet<>(nodes.keySet());
        List<List<String>> levels = new ArrayList<>();
        while (!remaining.isEmpty()) {
            List<String> level = new ArrayList<>();
            for (String nodeId : remaining) {
                boolean ready = true;
                for (String dependency : nodes.get(nodeId).getDependencies()) {
                    if (nodes.containsKey(dependency) && !assigned.contains(dependency)) {
                        ready = false;
                        break;
                    }
                }
                if (ready) {
                    level.add(nodeId);
                }
            }
            if (level.isEmpty()) {
                reportCycle(context, remaining);
                levels.add(new ArrayList<>(remaining));
                break;
            }
            assigned.addAll(level);
            remaining.removeAll(level);
            levels.add(level);
        }
        logger.fine("Computed " + levels.size() + " execution levels");
        return levels;
    }

    private static void reportCycle(ConstructionContext context, Set<String> remaining) {
        List<String> cycles = PathConstructor.detectCycles(context.getDefinition(), remaining);
        String message =
                "Dependency cycle among "
                        + remaining.size()
                        + " nodes; scheduling them in one final level"
                        + (cycles.isEmpty() ? "" : ": " + cycles.get(0));
        context.warn(
                BuildWarning.forNode(
                        WarningCode.CYCLE_DETECTED, message, remaining.iterator().next()));
    }

    static List<String> findStartNodes(ConstructionContext context) {
        String entryPoint = context.getReachability().entryPointId();
        List<String> starts = new ArrayList<>();
        starts.add(entryPoint);
        for (ExecutableNode node : context.getNodes().values()) {
            boolean hasDependency =
                    node.getDependencies().stream().anyMatch(context::hasNode);
            if (!hasDependency && !node.getId().equals(entryPoint)) {
                starts.add(node.getId());
            }
        }
        return starts;
    }

    private static List<String> findOutputNodes(ConstructionContext context) {
        List<String> outputs = new ArrayList<>();
        for (ExecutableNode node : context.getNodes().values()) {
            boolean explicit = "output".equalsIgnoreCase(node.getType());
            if (explicit || (node.isTerminal() && !node.isLoopSentinel())) {
                outputs.add(node.getId());
            }
        }
        return outputs;
    }

    // -----------------------------------------------------------------------
    // Integrity
    // -----------------------------------------------------------------------

    /// Verifies the assembled plan's internal references.
    ///
    /// @param plan the plan, not null
    /// @throws IllegalStateException on a dangling reference or malformed loop wiring
    static void verifyPlan(ExecutionPlan plan) {
        Map<String, ExecutableNode> nodes = plan.getNodes();
        for (ExecutableNode node : nodes.values()) {
            for (String dependency : node.getDependencies()) {
                if (!nodes.containsKey(dependency)) {
                    throw new IllegalStateException(
                            "Node '" + node.getId() + "' depends on missing node '" + dependency + "'");
                }
            }
            for (String dependent : node.getDependents()) {
                if (!nodes.containsKey(dependent)) {
                    throw new IllegalStateException(
                            "Node '" + node.getId() + "' has missing dependent '" + dependent + "'");
                }
            }
        }
        for (ExecutableEdge edge : plan.getEdges()) {
            if (!nodes.containsKey(edge.source()) || !nodes.containsKey(edge.target())) {
                throw new IllegalStateException(
                        "Edge '" + edge.id() + "' references a missing node");
            }
        }
        for (LoopBoundary boundary : plan.getLoopBoundaries().values()) {
            if (!nodes.containsKey(boundary.startSentinelId())
                    || !nodes.containsKey(boundary.endSentinelId())) {
                throw new IllegalStateException(
                        "Loop '" + boundary.loopNodeId() + "' is missing a sentinel node");
            }
            long entries = countLoopEdges(plan, boundary.loopNodeId(), boundary.startSentinelId());
            long iterations = countLoopEdges(plan, boundary.endSentinelId(), boundary.loopNodeId());
            if (entries != 1 || iterations != 1) {
                throw new IllegalStateException(
                        "Loop '" + boundary.loopNodeId() + "' is not wired through its sentinels");
            }
        }
    }

    private static long countLoopEdges(ExecutionPlan plan, String source, String target) {
        return plan.getEdges().stream()
                .filter(e -> e.source().equals(source) && e.target().equals(target))
                .filter(e -> e.handleType() == HandleType.LOOP)
                .count();
    }
}
