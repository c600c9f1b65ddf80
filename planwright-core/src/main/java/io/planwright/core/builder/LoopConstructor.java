package io.planwright.core.builder;

import io.planwright.core.plan.ExecutableEdge;
import io.planwright.core.plan.ExecutableNode;
import io.planwright.core.plan.HandleType;
import io.planwright.core.plan.LoopBoundary;
import io.planwright.core.plan.LoopConfig;
import io.planwright.core.plan.LoopContext;
import io.planwright.core.workflow.node.LoopType;
import io.planwright.core.workflow.node.NodeCategory;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Third construction stage: inserts START/END sentinels around every loop body and
/// rewires the loop's edges through them.
///
/// ### Rewiring
/// For a loop `L` with body entries `E*` and body terminals `T*`:
/// ```
/// before:  L ─loop─▶ E ... T ─▶ L ─▶ exit
/// after:   L ─loop─▶ L__loop_start ─▶ E ... T ─▶ L__loop_end ─loop─▶ L
///                                                 L ─▶ exit (also waits on L__loop_end)
/// ```
/// The body walk stops at the loop node and at END sentinels of loops expanded earlier.
/// A body terminal is a body node whose outgoing edges all leave the body or return to
/// the loop node. Every body node with an edge back to the loop node is routed to END.
/// If no body node qualifies, the last discovered body node is used.
///
/// Once every loop is expanded, each body lists an inner loop's START and END sentinels
/// right after the inner loop node, whichever loop came first in the definition.
///
/// The `L__loop_end → L` iteration edge is not a dependency: it exists for the runtime,
/// not for level scheduling.
///
/// ### Ownership
/// Loops are expanded in definition order. A node reached by several loop bodies keeps
/// the loop context of the first; bodies that overlap without nesting are reported as
/// {@link WarningCode#LOOP_BODY_OVERLAP}.
public final class LoopConstructor {

    private static final Logger logger = Logger.getLogger(LoopConstructor.class.getName());

    public static final String START_SUFFIX = "__loop_start";
    public static final String END_SUFFIX = "__loop_end";
    public static final int DEFAULT_COUNT = 1;

    private LoopConstructor() {}

    /// Expands every loop node of the context.
    ///
    /// @param context construction context after node construction, not null
    public static void expand(ConstructionContext context) {
        List<ExecutableNode> loops = new ArrayList<>();
        for (ExecutableNode node : context.getNodes().values()) {
            if (node.getCategory() == NodeCategory.LOOP) {
                loops.add(node);
            }
        }
        for (ExecutableNode loop : loops) {
            expandLoop(context, loop);
        }
        for (LoopBoundary boundary : List.copyOf(context.getLoopBoundaries().values())) {
            context.addLoopBoundary(
                    boundary.withBodyNodeIds(withInnerSentinels(context, boundary)));
        }
    }

    private static List<String> withInnerSentinels(
            ConstructionContext context, LoopBoundary boundary) {
        Map<String, LoopBoundary> boundaries = context.getLoopBoundaries();
        Set<String> body = new LinkedHashSet<>();
        for (String nodeId : boundary.bodyNodeIds()) {
            if (context.getNode(nodeId).isLoopSentinel()) {
                continue;
            }
            body.add(nodeId);
            LoopBoundary inner = boundaries.get(nodeId);
            if (inner != null) {
                body.add(inner.startSentinelId());
                body.add(inner.endSentinelId());
            }
        }
        return new ArrayList<>(body);
    }

    private static void expandLoop(ConstructionContext context, ExecutableNode loop) {
        String loopId = loop.getId();
        List<String> entries = new ArrayList<>();
        for (ExecutableEdge edge : context.getEdges()) {
            if (edge.source().equals(loopId)
                    && edge.handleType() == HandleType.LOOP
                    && !edge.target().equals(loopId)
                    && !entries.contains(edge.target())) {
                entries.add(edge.target());
            }
        }
        if (entries.isEmpty()) {
            context.warn(
                    BuildWarning.forNode(
                            WarningCode.LOOP_WITHOUT_BODY,
                            "Loop node '" + loopId + "' has no loop body edges",
                            loopId));
            return;
        }

        String startId = loopId + START_SUFFIX;
        String endId = loopId + END_SUFFIX;
        Map<String, List<String>> adjacency =
                GraphTraversal.outgoing(context.getEdges(), context::hasNode);
        List<String> body =
                GraphTraversal.bfs(
                        entries,
                        id -> adjacency.getOrDefault(id, List.of()),
                        (from, to) ->
                                !to.equals(loopId)
                                        && !to.equals(endId)
                                        && !isEndSentinel(context.getNode(to)));
        Set<String> bodySet = new LinkedHashSet<>(body);
        assignOwnership(context, loopId, body);

        ExecutableNode start = sentinel(startId, loop, LoopContext.Sentinel.START, loop.getDepth() + 1);
        ExecutableNode end =
                sentinel(endId, loop, LoopContext.Sentinel.END, loop.getDepth() + body.size() + 1);
        context.addNode(start);
        context.addNode(end);

        Set<String> inside = withInnerEnds(context, bodySet);
        List<String> terminals = findBodyTerminals(body, inside, adjacency, loopId);
        rewire(context, loopId, startId, endId, entries, bodySet, terminals);
        for (String innerEnd : inside) {
            if (!bodySet.contains(innerEnd) && loop.getDependencies().contains(innerEnd)) {
                context.unlink(innerEnd, loopId);
                context.link(innerEnd, endId);
            }
        }

        context.addLoopBoundary(
                new LoopBoundary(
                        loopId,
                        startId,
                        endId,
                        body,
                        LoopType.fromNodeType(loop.getType()),
                        loopConfig(loop),
                        maxIterations(loop),
                        loopId + "_index",
                        itemVariable(loop)));
        logger.fine(
                "Loop '"
                        + loopId
                        + "': "
                        + body.size()
                        + " body nodes, "
                        + terminals.size()
                        + " terminals");
    }

    private static void assignOwnership(
            ConstructionContext context, String loopId, List<String> body) {
        for (String nodeId : body) {
            ExecutableNode node = context.getNode(nodeId);
            LoopContext existing = node.getLoopContext();
            if (existing == null) {
                node.setLoopContext(LoopContext.member(loopId));
                continue;
            }
            if (existing.isSentinel() || existing.parentLoopId().equals(loopId)) {
                continue;
            }
            String owner = existing.parentLoopId();
            LoopBoundary ownerBoundary = context.getLoopBoundaries().get(owner);
            boolean nested =
                    body.contains(owner) || (ownerBoundary != null && ownerBoundary.contains(loopId));
            if (!nested) {
                context.warn(
                        BuildWarning.forNode(
                                WarningCode.LOOP_BODY_OVERLAP,
                                "Node '"
                                        + nodeId
                                        + "' is in the bodies of loops '"
                                        + owner
                                        + "' and '"
                                        + loopId
                                        + "'; keeping '"
                                        + owner
                                        + "'",
                                nodeId));
            }
        }
    }

    // END sentinels of previously expanded loops bound this body.
    private static boolean isEndSentinel(ExecutableNode node) {
        return node.isLoopSentinel() && node.getLoopContext().sentinel() == LoopContext.Sentinel.END;
    }

    // An inner loop expanded earlier belongs to this body up to its END sentinel.
    private static Set<String> withInnerEnds(ConstructionContext context, Set<String> bodySet) {
        Set<String> inside = new LinkedHashSet<>(bodySet);
        for (String nodeId : bodySet) {
            LoopBoundary inner = context.getLoopBoundaries().get(nodeId);
            if (inner != null) {
                inside.add(inner.endSentinelId());
            }
        }
        return inside;
    }

    private static List<String> findBodyTerminals(
            List<String> body,
            Set<String> inside,
            Map<String, List<String>> adjacency,
            String loopId) {
        List<String> terminals = new ArrayList<>();
        for (String nodeId : body) {
            List<String> targets = adjacency.getOrDefault(nodeId, List.of());
            boolean returnsToLoop = targets.contains(loopId);
            boolean leavesBody =
                    targets.stream().allMatch(t -> t.equals(loopId) || !inside.contains(t));
            if (returnsToLoop || leavesBody) {
                terminals.add(nodeId);
            }
        }
        if (terminals.isEmpty()) {
            terminals.add(body.get(body.size() - 1));
        }
        return terminals;
    }

    private static void rewire(
            ConstructionContext context,
            String loopId,
            String startId,
            String endId,
            List<String> entries,
            Set<String> bodySet,
            List<String> terminals) {
        List<ExecutableEdge> rewired = new ArrayList<>();
        List<String> exitTargets = new ArrayList<>();
        for (ExecutableEdge edge : context.getEdges()) {
            boolean loopToBody =
                    edge.source().equals(loopId)
                            && edge.handleType() == HandleType.LOOP
                            && entries.contains(edge.target());
            boolean bodyToLoop = edge.target().equals(loopId) && bodySet.contains(edge.source());
            if (loopToBody || bodyToLoop) {
                continue;
            }
            if (edge.source().equals(loopId)
                    && !edge.target().equals(loopId)
                    && !bodySet.contains(edge.target())
                    && !exitTargets.contains(edge.target())) {
                exitTargets.add(edge.target());
            }
            rewired.add(edge);
        }

        rewired.add(ExecutableEdge.synthetic(loopId, startId, HandleType.LOOP));
        for (String entry : entries) {
            rewired.add(ExecutableEdge.synthetic(startId, entry, HandleType.SOURCE));
        }
        for (String terminal : terminals) {
            rewired.add(ExecutableEdge.synthetic(terminal, endId, HandleType.SOURCE));
        }
        rewired.add(ExecutableEdge.synthetic(endId, loopId, HandleType.LOOP));
        context.replaceEdges(rewired);

        for (String entry : entries) {
            context.unlink(loopId, entry);
            context.link(startId, entry);
        }
        for (String member : bodySet) {
            context.unlink(member, loopId);
        }
        context.link(loopId, startId);
        for (String terminal : terminals) {
            context.link(terminal, endId);
        }
        for (String exit : exitTargets) {
            context.link(endId, exit);
        }
    }

    private static ExecutableNode sentinel(
            String id, ExecutableNode loop, LoopContext.Sentinel marker, int depth) {
        String suffix = marker == LoopContext.Sentinel.START ? " - Start" : " - End";
        String label = loop.getName() != null ? loop.getName() : loop.getId();
        return ExecutableNode.builder(id)
                .type(NodeCategory.LOOP_SENTINEL_TYPE)
                .name(label + suffix)
                .config(Map.of("loopNodeId", loop.getId(), "sentinel", marker.name()))
                .position(loop.getPosition())
                .loopContext(new LoopContext(loop.getId(), marker))
                .depth(depth)
                .build();
    }

    static LoopConfig loopConfig(ExecutableNode loop) {
        Map<String, Object> config = loop.getConfig();
        return switch (LoopType.fromNodeType(loop.getType())) {
            case FOR -> new LoopConfig.Count(count(config.get("count")));
            case FOR_EACH -> {
                Object source = config.get("sourceArray");
                if (!(source instanceof String)) {
                    source = config.get("arrayPath");
                }
                yield new LoopConfig.SourceArray(source instanceof String s ? s : null);
            }
            case WHILE, DO_WHILE -> {
                Object condition = config.get("condition");
                yield new LoopConfig.Condition(condition instanceof String s ? s : null);
            }
        };
    }

    private static int count(Object raw) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                logger.fine("Non-numeric loop count '" + text + "', using " + DEFAULT_COUNT);
            }
        }
        return DEFAULT_COUNT;
    }

    private static int maxIterations(ExecutableNode loop) {
        Object raw = loop.getConfig().get("maxIterations");
        return raw instanceof Number number
                ? number.intValue()
                : LoopBoundary.DEFAULT_MAX_ITERATIONS;
    }

    private static String itemVariable(ExecutableNode loop) {
        Object raw = loop.getConfig().get("itemVariable");
        return raw instanceof String name && !name.isBlank() ? name : loop.getId() + "_item";
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    /// Returns whether a node is a body member of some loop.
    ///
    /// @param context construction context, not null
    /// @param nodeId node id, not null
    /// @return true if any loop boundary lists the node in its body
    public static boolean isInsideLoop(ConstructionContext context, String nodeId) {
        return getLoopDepth(context, nodeId) > 0;
    }

    /// Returns the loop that owns a node.
    ///
    /// @param context construction context, not null
    /// @param nodeId node id, not null
    /// @return owning loop id (for sentinels, the loop they belong to), or empty
    public static Optional<String> getContainingLoop(ConstructionContext context, String nodeId) {
        ExecutableNode node = context.getNode(nodeId);
        if (node == null || node.getLoopContext() == null) {
            return Optional.empty();
        }
        return Optional.of(node.getLoopContext().parentLoopId());
    }

    /// Returns how many loop bodies contain a node.
    ///
    /// @param context construction context, not null
    /// @param nodeId node id, not null
    /// @return nesting depth, 0 outside any loop
    public static int getLoopDepth(ConstructionContext context, String nodeId) {
        int depth = 0;
        for (LoopBoundary boundary : context.getLoopBoundaries().values()) {
            if (boundary.contains(nodeId)) {
                depth++;
            }
        }
        return depth;
    }

    /// Returns whether an id names a loop START or END sentinel.
    ///
    /// @param nodeId node id, may be null
    /// @return true for ids ending in `__loop_start` or `__loop_end`
    public static boolean isLoopSentinel(String nodeId) {
        return nodeId != null && (nodeId.endsWith(START_SUFFIX) || nodeId.endsWith(END_SUFFIX));
    }

    /// Returns the loop node id a sentinel id was derived from.
    ///
    /// @param sentinelId sentinel id, may be null
    /// @return loop node id, or empty if the id is not a sentinel id
    public static Optional<String> getLoopNodeIdFromSentinel(String sentinelId) {
        if (sentinelId == null) {
            return Optional.empty();
        }
        if (sentinelId.endsWith(START_SUFFIX)) {
            return Optional.of(sentinelId.substring(0, sentinelId.length() - START_SUFFIX.length()));
        }
        if (sentinelId.endsWith(END_SUFFIX)) {
            return Optional.of(sentinelId.substring(0, sentinelId.length() - END_SUFFIX.length()));
        }
        return Optional.empty();
    }
}
