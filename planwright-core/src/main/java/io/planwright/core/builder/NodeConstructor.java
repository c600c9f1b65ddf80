package io.planwright.core.builder;

import io.planwright.core.plan.ExecutableEdge;
import io.planwright.core.plan.ExecutableNode;
import io.planwright.core.plan.HandleType;
import io.planwright.core.plan.ParallelBoundary;
import io.planwright.core.plan.ParallelBranch;
import io.planwright.core.plan.ParallelContext;
import io.planwright.core.workflow.WorkflowDefinition;
import io.planwright.core.workflow.WorkflowEdge;
import io.planwright.core.workflow.WorkflowNode;
import io.planwright.core.workflow.node.NodeCategory;
import io.planwright.core.workflow.node.ParallelAggregation;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Second construction stage: materializes {@link ExecutableNode}s and partitions
/// parallel blocks into branches.
///
/// ### Materialized nodes
/// Reachable nodes, plus unreachable ones when
/// {@link BuildOptions#includeUnreachable()} is set, always in definition order.
/// Dependencies and dependents only ever name materialized nodes. A node never depends
/// on itself.
///
/// ### Error ports
/// A node has an error port if its category always has one (llm, http, integration,
/// agent), if its `onError` strategy is `goto`, or if `config.errorPort` is `true`.
///
/// @see LoopConstructor for the stage that follows
public final class NodeConstructor {

    private static final Logger logger = Logger.getLogger(NodeConstructor.class.getName());

    /// Depth assigned to nodes with no path from the entry point.
    public static final int UNREACHABLE_DEPTH = -1;

    private NodeConstructor() {}

    /// Builds executable nodes and seeds the context's edge list.
    ///
    /// Every definition edge between two materialized nodes is copied with a handle type
    /// from {@link EdgeConstructor#determineHandleType}, so loop expansion can find loop
    /// body edges before the edge stage runs.
    ///
    /// @param definition the definition, not null
    /// @param reachability result of the path stage, not null
    /// @param context construction context to fill, not null
    public static void build(
            WorkflowDefinition definition,
            ReachabilityResult reachability,
            ConstructionContext context) {
        Map<String, WorkflowNode> rawNodes = PathConstructor.nodesOf(definition);
        boolean includeUnreachable = context.getOptions().includeUnreachable();
        Set<String> materialized = new LinkedHashSet<>();
        for (String nodeId : rawNodes.keySet()) {
            if (includeUnreachable || reachability.isReachable(nodeId)) {
                materialized.add(nodeId);
            }
        }

        Map<String, Integer> depths =
                PathConstructor.calculateNodeDepths(definition, reachability.entryPointId());
        for (String nodeId : materialized) {
            WorkflowNode raw = rawNodes.get(nodeId);
            context.addNode(
                    ExecutableNode.builder(nodeId)
                            .type(raw.type())
                            .name(raw.name())
                            .config(raw.config())
                            .position(raw.position())
                            .errorPort(hasErrorPort(raw))
                            .depth(depths.getOrDefault(nodeId, UNREACHABLE_DEPTH))
                            .build());
        }

        for (WorkflowEdge edge : PathConstructor.edgesOf(definition)) {
            if (!materialized.contains(edge.source()) || !materialized.contains(edge.target())) {
                continue;
            }
            context.link(edge.source(), edge.target());
            String id = edge.id() != null ? edge.id() : edge.source() + "->" + edge.target();
            HandleType handleType =
                    EdgeConstructor.determineHandleType(
                            edge.sourceHandle(), rawNodes.get(edge.source()).type());
            context.addEdge(
                    new ExecutableEdge(
                            id,
                            edge.source(),
                            edge.target(),
                            handleType,
                            edge.sourceHandle(),
                            edge.targetHandle(),
                            null,
                            null,
                            false));
        }
        logger.fine(
                "Materialized "
                        + materialized.size()
                        + " nodes and "
                        + context.getEdges().size()
                        + " edges");
    }

    /// Returns whether a raw node exposes an error port.
    ///
    /// @param node raw node, not null
    /// @return true if failures can be routed along an error edge
    public static boolean hasErrorPort(WorkflowNode node) {
        if (NodeCategory.of(node.type()).hasErrorPort()) {
            return true;
        }
        if (node.onError() != null && node.onError().isGoto()) {
            return true;
        }
        return Boolean.TRUE.equals(node.config().get("errorPort"));
    }

    /// Partitions every parallel node's downstream graph into branches.
    ///
    /// Each outgoing edge (definition order, self-edges ignored) starts one branch. A
    /// branch is a breadth-first walk from its start that never enters another parallel
    /// node and never returns to the originating one. Branches may overlap where they
    /// reconverge; a node keeps the parallel context of the first branch that reached it.
    ///
    /// @param context construction context with materialized nodes and seeded edges, not null
    public static void expandParallelNodes(ConstructionContext context) {
        Map<String, List<String>> adjacency =
                GraphTraversal.outgoing(context.getEdges(), context::hasNode);
        for (ExecutableNode node : context.getNodes().values()) {
            if (node.getCategory() == NodeCategory.PARALLEL) {
                expandParallelNode(context, node, adjacency);
            }
        }
    }

    private static void expandParallelNode(
            ConstructionContext context,
            ExecutableNode parallel,
            Map<String, List<String>> adjacency) {
        String parallelId = parallel.getId();
        checkBranchConfig(context, parallel);

        List<String> starts = new ArrayList<>();
        for (ExecutableEdge edge : context.getEdges()) {
            if (edge.source().equals(parallelId)
                    && !edge.target().equals(parallelId)
                    && context.hasNode(edge.target())) {
                starts.add(edge.target());
            }
        }
        if (starts.isEmpty()) {
            context.warn(
                    BuildWarning.forNode(
                            WarningCode.PARALLEL_NO_BRANCHES,
                            "Parallel node '" + parallelId + "' has no outgoing branches",
                            parallelId));
            return;
        }
        if (starts.size() < 2) {
            context.warn(
                    BuildWarning.forNode(
                            WarningCode.PARALLEL_FEW_BRANCHES,
                            "Parallel node '"
                                    + parallelId
                                    + "' has only "
                                    + starts.size()
                                    + " branch",
                            parallelId));
        }

        List<ParallelBranch> branches = new ArrayList<>();
        for (int index = 0; index < starts.size(); index++) {
            String start = starts.get(index);
            List<String> visited =
                    GraphTraversal.bfs(
                            List.of(start),
                            id -> adjacency.getOrDefault(id, List.of()),
                            (from, to) ->
                                    !to.equals(parallelId)
                                            && context.getNode(to).getCategory()
                                                    != NodeCategory.PARALLEL);
            for (String memberId : visited) {
                ExecutableNode member = context.getNode(memberId);
                if (member.getParallelContext() == null) {
                    member.setParallelContext(new ParallelContext(parallelId, index));
                }
            }
            branches.add(
                    new ParallelBranch(index, visited, start, branchEnd(visited, adjacency)));
        }

        context.addParallelBoundary(
                new ParallelBoundary(parallelId, branches, aggregation(context, parallel)));
        logger.fine("Parallel node '" + parallelId + "' split into " + branches.size() + " branches");
    }

    private static String branchEnd(List<String> visited, Map<String, List<String>> adjacency) {
        Set<String> members = new LinkedHashSet<>(visited);
        for (String nodeId : visited) {
            List<String> targets = adjacency.getOrDefault(nodeId, List.of());
            if (targets.stream().noneMatch(members::contains)) {
                return nodeId;
            }
        }
        return visited.get(visited.size() - 1);
    }

    private static void checkBranchConfig(ConstructionContext context, ExecutableNode parallel) {
        Map<String, Object> config = parallel.getConfig();
        if (!config.containsKey("branches")) {
            return;
        }
        Object branches = config.get("branches");
        if (!(branches instanceof List<?> list) || list.isEmpty()) {
            context.warn(
                    BuildWarning.forNode(
                            WarningCode.PARALLEL_INVALID_BRANCH_CONFIG,
                            "Parallel node '"
                                    + parallel.getId()
                                    + "' declares branches that are empty or not a list",
                            parallel.getId()));
        }
    }

    private static ParallelAggregation aggregation(
            ConstructionContext context, ExecutableNode parallel) {
        Object raw = parallel.getConfig().get("aggregation");
        if (raw == null) {
            return ParallelAggregation.ALL;
        }
        return ParallelAggregation.parse(raw)
                .orElseGet(
                        () -> {
                            context.warn(
                                    BuildWarning.forNode(
                                            WarningCode.PARALLEL_INVALID_AGGREGATION,
                                            "Parallel node '"
                                                    + parallel.getId()
                                                    + "' has unknown aggregation '"
                                                    + raw
                                                    + "', using 'all'",
                                            parallel.getId()));
                            return ParallelAggregation.ALL;
                        });
    }
}
