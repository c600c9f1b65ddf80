package io.planwright.core.builder;

import io.planwright.core.exception.WorkflowValidationException;
import io.planwright.core.workflow.WorkflowDefinition;
import io.planwright.core.workflow.WorkflowEdge;
import io.planwright.core.workflow.WorkflowNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// First construction stage: reachability and raw-graph analysis over the definition.
///
/// Every method is pure. Edges naming nodes that do not exist are ignored by the
/// traversals and reported by {@link #validateEdgeReferences}.
///
/// @see NodeConstructor for the stage that consumes the {@link ReachabilityResult}
public final class PathConstructor {

    private static final Logger logger = Logger.getLogger(PathConstructor.class.getName());

    private PathConstructor() {}

    /// Partitions the definition's nodes into reachable and unreachable ones.
    ///
    /// FIFO breadth-first search from the entry point with a visited set.
    ///
    /// @param definition the definition, not null
    /// @return reachability partition, never null
    /// @throws WorkflowValidationException if the entry point is missing or unknown
    public static ReachabilityResult build(WorkflowDefinition definition) {
        Map<String, WorkflowNode> nodes = nodesOf(definition);
        String entryPoint = definition.getEntryPoint();
        if (entryPoint == null || entryPoint.isBlank()) {
            throw new WorkflowValidationException("Workflow has no entry point");
        }
        if (!nodes.containsKey(entryPoint)) {
            throw new WorkflowValidationException(
                    "Entry point '" + entryPoint + "' does not exist", entryPoint);
        }

        Map<String, List<String>> adjacency = buildAdjacency(definition);
        Set<String> reachable = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        reachable.add(entryPoint);
        queue.add(entryPoint);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String target : adjacency.getOrDefault(current, List.of())) {
                if (nodes.containsKey(target) && reachable.add(target)) {
                    queue.add(target);
                }
            }
        }

        Set<String> unreachable = new LinkedHashSet<>();
        for (String nodeId : nodes.keySet()) {
            if (!reachable.contains(nodeId)) {
                unreachable.add(nodeId);
            }
        }
        logger.fine(
                "Reachability from '"
                        + entryPoint
                        + "': "
                        + reachable.size()
                        + " reachable, "
                        + unreachable.size()
                        + " unreachable");
        return new ReachabilityResult(reachable, unreachable, entryPoint);
    }

    /// Builds the ordered `source → [targets]` adjacency of the definition.
    ///
    /// Dangling ids are kept; callers filter against the node map.
    ///
    /// @param definition the definition, not null
    /// @return adjacency map without duplicate targets, never null
    public static Map<String, List<String>> buildAdjacency(WorkflowDefinition definition) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (WorkflowEdge edge : edgesOf(definition)) {
            if (edge.source() == null || edge.target() == null) {
                continue;
            }
            List<String> targets = adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>());
            if (!targets.contains(edge.target())) {
                targets.add(edge.target());
            }
        }
        return adjacency;
    }

    /// Returns the edges whose source and target are both reachable.
    ///
    /// @param definition the definition, not null
    /// @param reachability result of {@link #build}, not null
    /// @return edges in definition order, never null
    public static List<WorkflowEdge> filterReachableEdges(
            WorkflowDefinition definition, ReachabilityResult reachability) {
        List<WorkflowEdge> result = new ArrayList<>();
        for (WorkflowEdge edge : edgesOf(definition)) {
            if (reachability.isReachable(edge.source()) && reachability.isReachable(edge.target())) {
                result.add(edge);
            }
        }
        return result;
    }

    /// Reports edges whose source or target names a node that does not exist.
    ///
    /// @param definition the definition, not null
    /// @return one {@link WarningCode#DANGLING_EDGE} warning per dangling end, never null
    public static List<BuildWarning> validateEdgeReferences(WorkflowDefinition definition) {
        Map<String, WorkflowNode> nodes = nodesOf(definition);
        List<BuildWarning> warnings = new ArrayList<>();
        for (WorkflowEdge edge : edgesOf(definition)) {
            if (!nodes.containsKey(edge.source())) {
                warnings.add(
                        BuildWarning.forEdge(
                                WarningCode.DANGLING_EDGE,
                                "Edge '"
                                        + edge.id()
                                        + "' references unknown source node '"
                                        + edge.source()
                                        + "'",
                                edge.id()));
            }
            if (!nodes.containsKey(edge.target())) {
                warnings.add(
                        BuildWarning.forEdge(
                                WarningCode.DANGLING_EDGE,
                                "Edge '"
                                        + edge.id()
                                        + "' references unknown target node '"
                                        + edge.target()
                                        + "'",
                                edge.id()));
            }
        }
        return warnings;
    }

    /// Finds cycles with a depth-first search that tracks the recursion stack.
    ///
    /// Each back edge yields one cycle, rendered as the id path from the revisited node
    /// back to itself, e.g. `a -> b -> a`. Nodes already fully explored from an earlier
    /// start are not searched again, so not every elementary cycle is listed.
    ///
    /// @param definition the definition, not null
    /// @param startIds ids to start the search from, in order, not null
    /// @return cycles in discovery order, never null (empty for an acyclic graph)
    public static List<String> detectCycles(
            WorkflowDefinition definition, Collection<String> startIds) {
        Map<String, WorkflowNode> nodes = nodesOf(definition);
        Map<String, List<String>> adjacency = buildAdjacency(definition);
        Set<String> visited = new HashSet<>();
        List<String> stack = new ArrayList<>();
        Set<String> onStack = new HashSet<>();
        List<String> cycles = new ArrayList<>();
        for (String start : startIds) {
            if (nodes.containsKey(start) && !visited.contains(start)) {
                searchCycles(start, nodes, adjacency, visited, stack, onStack, cycles);
            }
        }
        return cycles;
    }

    private static void searchCycles(
            String nodeId,
            Map<String, WorkflowNode> nodes,
            Map<String, List<String>> adjacency,
            Set<String> visited,
            List<String> stack,
            Set<String> onStack,
            List<String> cycles) {
        visited.add(nodeId);
        stack.add(nodeId);
        onStack.add(nodeId);
        for (String next : adjacency.getOrDefault(nodeId, List.of())) {
            if (!nodes.containsKey(next)) {
                continue;
            }
            if (onStack.contains(next)) {
                List<String> path = new ArrayList<>(stack.subList(stack.indexOf(next), stack.size()));
                path.add(next);
                cycles.add(String.join(" -> ", path));
            } else if (!visited.contains(next)) {
                searchCycles(next, nodes, adjacency, visited, stack, onStack, cycles);
            }
        }
        stack.remove(stack.size() - 1);
        onStack.remove(nodeId);
    }

    /// Computes the shortest hop distance of every reachable node from the entry point.
    ///
    /// A node's depth only ever decreases; it is re-queued whenever a shorter path is found.
    ///
    /// @param definition the definition, not null
    /// @param entryPoint start node id, not null
    /// @return depth per reachable node id, never null
    public static Map<String, Integer> calculateNodeDepths(
            WorkflowDefinition definition, String entryPoint) {
        Map<String, WorkflowNode> nodes = nodesOf(definition);
        Map<String, List<String>> adjacency = buildAdjacency(definition);
        Map<String, Integer> depths = new HashMap<>();
        if (!nodes.containsKey(entryPoint)) {
            return depths;
        }
        Deque<String> queue = new ArrayDeque<>();
        depths.put(entryPoint, 0);
        queue.add(entryPoint);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int candidate = depths.get(current) + 1;
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (!nodes.containsKey(next)) {
                    continue;
                }
                Integer known = depths.get(next);
                if (known == null || candidate < known) {
                    depths.put(next, candidate);
                    queue.add(next);
                }
            }
        }
        return depths;
    }

    /// Returns the reachable nodes without a reachable successor.
    ///
    /// @param definition the definition, not null
    /// @param reachability result of {@link #build}, not null
    /// @return terminal ids in reachability order, never null
    public static List<String> findTerminalNodes(
            WorkflowDefinition definition, ReachabilityResult reachability) {
        Map<String, List<String>> adjacency = buildAdjacency(definition);
        List<String> terminals = new ArrayList<>();
        for (String nodeId : reachability.reachableNodeIds()) {
            boolean hasSuccessor =
                    adjacency.getOrDefault(nodeId, List.of()).stream()
                            .anyMatch(reachability::isReachable);
            if (!hasSuccessor) {
                terminals.add(nodeId);
            }
        }
        return terminals;
    }

    /// Orders the reachable subgraph topologically (Kahn's algorithm).
    ///
    /// @param definition the definition, not null
    /// @param reachability result of {@link #build}, not null
    /// @return topological order, or empty if the reachable subgraph has a cycle
    public static Optional<List<String>> topologicalSort(
            WorkflowDefinition definition, ReachabilityResult reachability) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String nodeId : reachability.reachableNodeIds()) {
            inDegree.put(nodeId, 0);
        }
        for (WorkflowEdge edge : filterReachableEdges(definition, reachability)) {
            List<String> targets = adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>());
            if (!targets.contains(edge.target())) {
                targets.add(edge.target());
                inDegree.merge(edge.target(), 1, Integer::sum);
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach(
                (nodeId, degree) -> {
                    if (degree == 0) {
                        ready.add(nodeId);
                    }
                });
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return order.size() == inDegree.size() ? Optional.of(order) : Optional.empty();
    }

    static Map<String, WorkflowNode> nodesOf(WorkflowDefinition definition) {
        return definition.getNodes() != null ? definition.getNodes() : Collections.emptyMap();
    }

    static List<WorkflowEdge> edgesOf(WorkflowDefinition definition) {
        return definition.getEdges() != null ? definition.getEdges() : List.of();
    }
}
