package io.planwright.core.builder;

import io.planwright.core.plan.ExecutableEdge;
import io.planwright.core.plan.ExecutableNode;
import io.planwright.core.plan.HandleType;
import io.planwright.core.workflow.WorkflowDefinition;
import io.planwright.core.workflow.WorkflowEdge;
import io.planwright.core.workflow.WorkflowNode;
import io.planwright.core.workflow.node.NodeCategory;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Final construction stage for edges: handle classification, branch data extraction and
/// edge-level checks.
///
/// ### Classification
/// Decided from the source handle first, then from the source node's category
/// (case-insensitive):
///
/// | Source handle | Handle type |
/// |---|---|
/// | `error`, `error-*` | error |
/// | `loop`, `loopBody`, `loop-*` | loop |
/// | `true`, `false`, `condition-true`, `condition-false`, `branch-*`, `case-*` | condition |
/// | `route-*`, `path-*` | router |
/// | anything else from a logic node | condition |
/// | anything but `exit`/`complete` from a loop node | loop |
/// | otherwise | source |
///
/// A loop node's edge without a handle enters its body. Exit edges carry `exit` or
/// `complete`.
///
/// Synthetic edges inserted by loop rewiring keep the handle type they were created with.
///
/// The static query methods work on any edge list and back the equivalent
/// {@link io.planwright.core.plan.ExecutionPlan} queries.
public final class EdgeConstructor {

    private static final Logger logger = Logger.getLogger(EdgeConstructor.class.getName());

    private EdgeConstructor() {}

    /// Finalizes `context.edges` and assigns every node's dominant handle type.
    ///
    /// Checks the reachable definition edges for duplicate ids and for self-loops on
    /// non-loop nodes, and the finished edges for conditional nodes lacking a `true` or
    /// `false` branch and routers without any route edge.
    ///
    /// @param definition the definition, not null
    /// @param reachability result of the path stage, not null
    /// @param context construction context after loop expansion, not null
    public static void build(
            WorkflowDefinition definition,
            ReachabilityResult reachability,
            ConstructionContext context) {
        List<ExecutableEdge> finalized = new ArrayList<>(context.getEdges().size());
        for (ExecutableEdge edge : context.getEdges()) {
            finalized.add(edge.synthetic() ? edge : classify(edge, sourceType(context, edge)));
        }
        context.replaceEdges(finalized);

        for (ExecutableNode node : context.getNodes().values()) {
            node.setHandleType(dominantHandleType(finalized, node.getId()));
        }

        checkDefinitionEdges(definition, reachability, context);
        checkBranches(context, finalized);
        logger.fine("Finalized " + finalized.size() + " edges");
    }

    /// Classifies an edge by its source handle and source node type.
    ///
    /// @param sourceHandle handle name, may be null
    /// @param sourceNodeType type of the source node, may be null
    /// @return handle type, never null
    public static HandleType determineHandleType(String sourceHandle, String sourceNodeType) {
        String handle = sourceHandle != null ? sourceHandle.toLowerCase(Locale.ROOT) : null;
        if (handle != null) {
            if (handle.equals("error") || handle.startsWith("error-")) {
                return HandleType.ERROR;
            }
            if (handle.equals("loop") || handle.equals("loopbody") || handle.startsWith("loop-")) {
                return HandleType.LOOP;
            }
            if (handle.equals("true")
                    || handle.equals("false")
                    || handle.equals("condition-true")
                    || handle.equals("condition-false")
                    || handle.startsWith("branch-")
                    || handle.startsWith("case-")) {
                return HandleType.CONDITION;
            }
            if (handle.startsWith("route-") || handle.startsWith("path-")) {
                return HandleType.ROUTER;
            }
        }
        NodeCategory category = NodeCategory.of(sourceNodeType);
        if (category == NodeCategory.LOGIC) {
            return HandleType.CONDITION;
        }
        if (category == NodeCategory.LOOP
                && !"exit".equals(handle)
                && !"complete".equals(handle)) {
            return HandleType.LOOP;
        }
        return HandleType.SOURCE;
    }

    /// Extracts the branch value of a condition edge.
    ///
    /// `true`/`false`/`default` (also as `condition-true`/`condition-false`), the suffix
    /// of `branch-*`/`case-*`, a purely numeric handle as-is, else the raw handle.
    ///
    /// @param sourceHandle handle name, may be null
    /// @return condition value, or null without a handle
    public static String extractConditionValue(String sourceHandle) {
        if (sourceHandle == null) {
            return null;
        }
        String lower = sourceHandle.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "true", "condition-true" -> {
                return "true";
            }
            case "false", "condition-false" -> {
                return "false";
            }
            case "default" -> {
                return "default";
            }
            default -> {}
        }
        if (lower.startsWith("branch-")) {
            return sourceHandle.substring("branch-".length());
        }
        if (lower.startsWith("case-")) {
            return sourceHandle.substring("case-".length());
        }
        return sourceHandle;
    }

    /// Extracts the route name of a router edge: the handle without `route-`/`path-`.
    ///
    /// @param sourceHandle handle name, may be null
    /// @return router path, or null without a handle
    public static String extractRouterPath(String sourceHandle) {
        if (sourceHandle == null) {
            return null;
        }
        String lower = sourceHandle.toLowerCase(Locale.ROOT);
        if (lower.startsWith("route-")) {
            return sourceHandle.substring("route-".length());
        }
        if (lower.startsWith("path-")) {
            return sourceHandle.substring("path-".length());
        }
        return sourceHandle;
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    public static List<ExecutableEdge> getOutgoingEdges(List<ExecutableEdge> edges, String nodeId) {
        return edges.stream().filter(e -> e.source().equals(nodeId)).toList();
    }

    public static List<ExecutableEdge> getIncomingEdges(List<ExecutableEdge> edges, String nodeId) {
        return edges.stream().filter(e -> e.target().equals(nodeId)).toList();
    }

    public static List<ExecutableEdge> getEdgesByHandleType(
            List<ExecutableEdge> edges, HandleType handleType) {
        return edges.stream().filter(e -> e.handleType() == handleType).toList();
    }

    /// Returns the first error edge leaving a node.
    ///
    /// @param edges edge list, not null
    /// @param nodeId source node id, not null
    /// @return error edge, or empty if the node has none
    public static Optional<ExecutableEdge> getErrorEdge(List<ExecutableEdge> edges, String nodeId) {
        return getOutgoingEdges(edges, nodeId).stream()
                .filter(e -> e.handleType() == HandleType.ERROR)
                .findFirst();
    }

    /// Returns the condition edge of a node carrying the given branch value.
    ///
    /// @param edges edge list, not null
    /// @param nodeId source node id, not null
    /// @param value branch value such as `true` or a case name, not null
    /// @return matching edge, or empty
    public static Optional<ExecutableEdge> getConditionEdge(
            List<ExecutableEdge> edges, String nodeId, String value) {
        return getOutgoingEdges(edges, nodeId).stream()
                .filter(e -> e.handleType() == HandleType.CONDITION)
                .filter(e -> value.equalsIgnoreCase(e.conditionValue()))
                .findFirst();
    }

    /// Returns the fallback edge of a node: the `default` branch, then the `else` branch,
    /// then the first plain source edge.
    ///
    /// @param edges edge list, not null
    /// @param nodeId source node id, not null
    /// @return fallback edge, or empty
    public static Optional<ExecutableEdge> getDefaultEdge(
            List<ExecutableEdge> edges, String nodeId) {
        List<ExecutableEdge> outgoing = getOutgoingEdges(edges, nodeId);
        for (String name : List.of("default", "else")) {
            for (ExecutableEdge edge : outgoing) {
                if (name.equalsIgnoreCase(edge.sourceHandle())
                        || name.equalsIgnoreCase(edge.conditionValue())) {
                    return Optional.of(edge);
                }
            }
        }
        return outgoing.stream().filter(e -> e.handleType() == HandleType.SOURCE).findFirst();
    }

    /// Returns the distinct handle types leaving a node.
    ///
    /// @param edges edge list, not null
    /// @param nodeId source node id, not null
    /// @return handle types, never null
    public static Set<HandleType> getHandleTypesFromSource(
            List<ExecutableEdge> edges, String nodeId) {
        Set<HandleType> types = EnumSet.noneOf(HandleType.class);
        for (ExecutableEdge edge : getOutgoingEdges(edges, nodeId)) {
            types.add(edge.handleType());
        }
        return types;
    }

    /// Finds the target of the branch a conditional or router node selected.
    ///
    /// Matches the branch name against condition values, router paths and raw handles.
    ///
    /// @param edges edge list, not null
    /// @param nodeId source node id, not null
    /// @param branch selected branch name, not null
    /// @return target node id, or empty if no edge carries that branch
    public static Optional<String> findBranchTarget(
            List<ExecutableEdge> edges, String nodeId, String branch) {
        return getOutgoingEdges(edges, nodeId).stream()
                .filter(
                        e ->
                                branch.equalsIgnoreCase(e.conditionValue())
                                        || branch.equalsIgnoreCase(e.routerPath())
                                        || branch.equalsIgnoreCase(e.sourceHandle()))
                .map(ExecutableEdge::target)
                .findFirst();
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    static ExecutableEdge classify(ExecutableEdge edge, String sourceType) {
        HandleType type = determineHandleType(edge.sourceHandle(), sourceType);
        String condition =
                type == HandleType.CONDITION ? extractConditionValue(edge.sourceHandle()) : null;
        String route = type == HandleType.ROUTER ? extractRouterPath(edge.sourceHandle()) : null;
        return edge.withClassification(type, condition, route);
    }

    private static String sourceType(ConstructionContext context, ExecutableEdge edge) {
        ExecutableNode node = context.getNode(edge.source());
        if (node != null) {
            return node.getType();
        }
        WorkflowNode raw = PathConstructor.nodesOf(context.getDefinition()).get(edge.source());
        return raw != null ? raw.type() : null;
    }

    private static HandleType dominantHandleType(List<ExecutableEdge> edges, String nodeId) {
        HandleType dominant = HandleType.SOURCE;
        for (ExecutableEdge edge : edges) {
            if (edge.source().equals(nodeId) && edge.handleType().dominates(dominant)) {
                dominant = edge.handleType();
            }
        }
        return dominant;
    }

    private static void checkDefinitionEdges(
            WorkflowDefinition definition,
            ReachabilityResult reachability,
            ConstructionContext context) {
        Set<String> seenIds = new HashSet<>();
        Set<String> reportedIds = new HashSet<>();
        for (WorkflowEdge edge : PathConstructor.filterReachableEdges(definition, reachability)) {
            if (edge.id() != null && !seenIds.add(edge.id()) && reportedIds.add(edge.id())) {
                context.warn(
                        BuildWarning.forEdge(
                                WarningCode.DUPLICATE_EDGE_ID,
                                "Duplicate edge id '" + edge.id() + "'",
                                edge.id()));
            }
            if (edge.source().equals(edge.target())) {
                WorkflowNode node = definition.getNodes().get(edge.source());
                if (NodeCategory.of(node.type()) != NodeCategory.LOOP) {
                    context.warn(
                            new BuildWarning(
                                    WarningCode.ILLEGAL_SELF_LOOP,
                                    "Node '"
                                            + edge.source()
                                            + "' has a self-loop but is not a loop node",
                                    edge.source(),
                                    edge.id()));
                }
            }
        }
    }

    private static void checkBranches(ConstructionContext context, List<ExecutableEdge> edges) {
        for (ExecutableNode node : context.getNodes().values()) {
            if (NodeCategory.isConditional(node.getType())) {
                boolean hasTrue = getConditionEdge(edges, node.getId(), "true").isPresent();
                boolean hasFalse = getConditionEdge(edges, node.getId(), "false").isPresent();
                if (!hasTrue || !hasFalse) {
                    context.warn(
                            BuildWarning.forNode(
                                    WarningCode.CONDITIONAL_MISSING_BRANCH,
                                    "Conditional node '"
                                            + node.getId()
                                            + "' is missing true/false branches",
                                    node.getId()));
                }
            } else if (NodeCategory.isRouter(node.getType())
                    && !getHandleTypesFromSource(edges, node.getId()).contains(HandleType.ROUTER)) {
                context.warn(
                        BuildWarning.forNode(
                                WarningCode.ROUTER_WITHOUT_ROUTES,
                                "Router node '" + node.getId() + "' has no route edges",
                                node.getId()));
            }
        }
    }
}
