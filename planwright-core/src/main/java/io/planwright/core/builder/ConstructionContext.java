package io.planwright.core.builder;

import io.planwright.core.plan.ExecutableEdge;
import io.planwright.core.plan.ExecutableNode;
import io.planwright.core.plan.LoopBoundary;
import io.planwright.core.plan.ParallelBoundary;
import io.planwright.core.workflow.WorkflowDefinition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Mutable carrier threaded through the construction stages of one build.
///
/// Holds the read-only inputs (definition, options, reachability) and the growing build
/// state: executable nodes, edges, loop and parallel boundaries, warnings. Stages are
/// static methods that read and extend this context; none of them keeps state of its own.
///
/// ### Contracts
/// - `definition`, `options` and `reachability` are final and non-null
/// - node ids are unique; {@link #addNode} rejects duplicates
/// - the edge list is replaced wholesale through {@link #replaceEdges}, never edited
///   while being iterated
///
/// @implNote **Not thread-safe.** Scoped to a single {@link WorkflowBuilder#build} call;
/// its contents are moved into the {@link io.planwright.core.plan.ExecutionPlan}.
///
/// @see WorkflowBuilder for the stage order
public final class ConstructionContext {

    private static final Logger logger = Logger.getLogger(ConstructionContext.class.getName());

    private final WorkflowDefinition definition;
    private final BuildOptions options;
    private final ReachabilityResult reachability;
    private final Map<String, ExecutableNode> nodes = new LinkedHashMap<>();
    private List<ExecutableEdge> edges = new ArrayList<>();
    private final Map<String, LoopBoundary> loopBoundaries = new LinkedHashMap<>();
    private final Map<String, ParallelBoundary> parallelBoundaries = new LinkedHashMap<>();
    private final List<BuildWarning> warnings = new ArrayList<>();

    /// Creates an empty context.
    ///
    /// @param definition the definition being compiled, not null
    /// @param options build options, not null
    /// @param reachability result of the path stage, not null
    public ConstructionContext(
            WorkflowDefinition definition, BuildOptions options, ReachabilityResult reachability) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.reachability = Objects.requireNonNull(reachability, "reachability must not be null");
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    public BuildOptions getOptions() {
        return options;
    }

    public ReachabilityResult getReachability() {
        return reachability;
    }

    // -----------------------------------------------------------------------
    // Nodes
    // -----------------------------------------------------------------------

    /// Returns the materialized nodes in insertion order.
    ///
    /// @return unmodifiable live view, never null
    public Map<String, ExecutableNode> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    /// Returns a node by id.
    ///
    /// @param nodeId node id, may be null
    /// @return the node, or null if not materialized
    public ExecutableNode getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public boolean hasNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    /// Adds a node.
    ///
    /// @param node node to add, not null
    /// @throws IllegalStateException if a node with the same id exists
    public void addNode(ExecutableNode node) {
        if (nodes.putIfAbsent(node.getId(), node) != null) {
            throw new IllegalStateException("Duplicate executable node: " + node.getId());
        }
    }

    /// Records that `target` depends on `source`. No-op if either node is missing or the
    /// two are the same node.
    ///
    /// @param source node that must complete first
    /// @param target node that waits
    public void link(String source, String target) {
        ExecutableNode from = nodes.get(source);
        ExecutableNode to = nodes.get(target);
        if (from == null || to == null || from == to) {
            return;
        }
        from.addDependent(target);
        to.addDependency(source);
    }

    /// Removes the dependency of `target` on `source`, in both directions.
    ///
    /// @param source upstream node id
    /// @param target downstream node id
    public void unlink(String source, String target) {
        ExecutableNode from = nodes.get(source);
        ExecutableNode to = nodes.get(target);
        if (from != null) {
            from.removeDependent(target);
        }
        if (to != null) {
            to.removeDependency(source);
        }
    }

    // -----------------------------------------------------------------------
    // Edges
    // -----------------------------------------------------------------------

    /// Returns the current edge list.
    ///
    /// @return unmodifiable view, never null
    public List<ExecutableEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public void addEdge(ExecutableEdge edge) {
        edges.add(Objects.requireNonNull(edge, "edge must not be null"));
    }

    /// Swaps in a new edge list.
    ///
    /// @param replacement complete new edge list, not null
    public void replaceEdges(List<ExecutableEdge> replacement) {
        this.edges = new ArrayList<>(replacement);
    }

    // -----------------------------------------------------------------------
    // Boundaries
    // -----------------------------------------------------------------------

    public Map<String, LoopBoundary> getLoopBoundaries() {
        return Collections.unmodifiableMap(loopBoundaries);
    }

    public void addLoopBoundary(LoopBoundary boundary) {
        loopBoundaries.put(boundary.loopNodeId(), boundary);
    }

    public Map<String, ParallelBoundary> getParallelBoundaries() {
        return Collections.unmodifiableMap(parallelBoundaries);
    }

    public void addParallelBoundary(ParallelBoundary boundary) {
        parallelBoundaries.put(boundary.parallelNodeId(), boundary);
    }

    // -----------------------------------------------------------------------
    // Warnings
    // -----------------------------------------------------------------------

    public List<BuildWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /// Records a non-fatal problem.
    ///
    /// @param warning the warning, not null
    public void warn(BuildWarning warning) {
        warnings.add(Objects.requireNonNull(warning, "warning must not be null"));
        logger.warning("[" + warning.code() + "] " + warning.message());
    }
}
