package io.planwright.core.plan;

import io.planwright.core.builder.BuildWarning;
import io.planwright.core.builder.EdgeConstructor;
import io.planwright.core.workflow.WorkflowDefinition;
import io.planwright.core.workflow.WorkflowSettings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Compiled, DAG-shaped workflow ready for a runtime to schedule.
///
/// Nodes carry resolved dependencies, handle semantics and loop/parallel membership;
/// `executionLevels` batch them so that every node's dependencies sit in earlier levels
/// (except for nodes caught in a reported cycle, which share the final level).
///
/// ### Contracts
/// - **Invariant**: every id in any dependency list, edge end, start node or level names
///   a node in `nodes`
/// - **Invariant**: `executionLevels` partition the node ids
/// - **Invariant**: `startNodes` begins with `entryPoint`
///
/// @implNote Immutable once built: collections are unmodifiable and every
/// {@link ExecutableNode} is frozen. Safe to share across threads.
///
/// @see io.planwright.core.builder.WorkflowBuilder for construction
public final class ExecutionPlan {

    private final WorkflowDefinition definition;
    private final Map<String, ExecutableNode> nodes;
    private final List<ExecutableEdge> edges;
    private final List<String> startNodes;
    private final List<List<String>> executionLevels;
    private final Map<String, LoopBoundary> loopBoundaries;
    private final Map<String, ParallelBoundary> parallelBoundaries;
    private final List<BuildWarning> warnings;
    private final String entryPoint;
    private final List<String> outputNodeIds;
    private final int maxConcurrentNodes;

    private ExecutionPlan(Builder builder) {
        this.definition = Objects.requireNonNull(builder.definition, "Definition required");
        this.entryPoint = Objects.requireNonNull(builder.entryPoint, "Entry point required");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.nodes.values().forEach(ExecutableNode::freeze);
        this.edges = List.copyOf(builder.edges);
        this.startNodes = List.copyOf(builder.startNodes);
        List<List<String>> levels = new ArrayList<>();
        for (List<String> level : builder.executionLevels) {
            levels.add(List.copyOf(level));
        }
        this.executionLevels = Collections.unmodifiableList(levels);
        this.loopBoundaries = Collections.unmodifiableMap(new LinkedHashMap<>(builder.loopBoundaries));
        this.parallelBoundaries =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.parallelBoundaries));
        this.warnings = List.copyOf(builder.warnings);
        this.outputNodeIds = List.copyOf(builder.outputNodeIds);
        this.maxConcurrentNodes =
                builder.maxConcurrentNodes > 0
                        ? builder.maxConcurrentNodes
                        : WorkflowSettings.DEFAULT_MAX_CONCURRENT_NODES;
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    /// Returns all executable nodes, sentinels included, in construction order.
    ///
    /// @return unmodifiable ordered map, never null
    public Map<String, ExecutableNode> getNodes() {
        return nodes;
    }

    public List<ExecutableEdge> getEdges() {
        return edges;
    }

    /// Returns the nodes without dependencies, entry point first.
    ///
    /// @return unmodifiable list, never null
    public List<String> getStartNodes() {
        return startNodes;
    }

    /// Returns the execution levels. Each level may be dispatched concurrently once all
    /// previous levels completed.
    ///
    /// @return unmodifiable list of unmodifiable levels, never null
    public List<List<String>> getExecutionLevels() {
        return executionLevels;
    }

    public Map<String, LoopBoundary> getLoopBoundaries() {
        return loopBoundaries;
    }

    public Map<String, ParallelBoundary> getParallelBoundaries() {
        return parallelBoundaries;
    }

    public List<BuildWarning> getWarnings() {
        return warnings;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    /// Returns the nodes the runtime reads the workflow result from: nodes of type
    /// `output` plus terminal nodes that are not loop sentinels.
    ///
    /// @return unmodifiable list, never null
    public List<String> getOutputNodeIds() {
        return outputNodeIds;
    }

    public int getMaxConcurrentNodes() {
        return maxConcurrentNodes;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    public Optional<ExecutableNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<ExecutableEdge> getOutgoingEdges(String nodeId) {
        return EdgeConstructor.getOutgoingEdges(edges, nodeId);
    }

    public List<ExecutableEdge> getIncomingEdges(String nodeId) {
        return EdgeConstructor.getIncomingEdges(edges, nodeId);
    }

    public Optional<ExecutableEdge> getErrorEdge(String nodeId) {
        return EdgeConstructor.getErrorEdge(edges, nodeId);
    }

    /// Returns the condition edge of a node for a branch value.
    ///
    /// @param nodeId conditional node id, not null
    /// @param value branch value such as `true`, `false` or a case name, not null
    /// @return matching edge, or empty
    public Optional<ExecutableEdge> getConditionEdge(String nodeId, String value) {
        return EdgeConstructor.getConditionEdge(edges, nodeId, value);
    }

    public Optional<ExecutableEdge> getDefaultEdge(String nodeId) {
        return EdgeConstructor.getDefaultEdge(edges, nodeId);
    }

    public Optional<LoopBoundary> getLoopBoundary(String loopNodeId) {
        return Optional.ofNullable(loopBoundaries.get(loopNodeId));
    }

    /// Returns whether a node is a body member of any loop.
    ///
    /// @param nodeId node id, not null
    /// @return true if some loop boundary lists the node in its body
    public boolean isInsideLoop(String nodeId) {
        return loopBoundaries.values().stream().anyMatch(b -> b.contains(nodeId));
    }

    /// Creates a new plan builder.
    ///
    /// @return new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ExecutionPlan}. Nodes handed over are frozen by {@link #build()}.
    public static final class Builder {
        private WorkflowDefinition definition;
        private Map<String, ExecutableNode> nodes = Map.of();
        private List<ExecutableEdge> edges = List.of();
        private List<String> startNodes = List.of();
        private List<List<String>> executionLevels = List.of();
        private Map<String, LoopBoundary> loopBoundaries = Map.of();
        private Map<String, ParallelBoundary> parallelBoundaries = Map.of();
        private List<BuildWarning> warnings = List.of();
        private String entryPoint;
        private List<String> outputNodeIds = List.of();
        private int maxConcurrentNodes;

        private Builder() {}

        public Builder definition(WorkflowDefinition definition) {
            this.definition = definition;
            return this;
        }

        public Builder nodes(Map<String, ExecutableNode> nodes) {
            this.nodes = Objects.requireNonNull(nodes, "nodes");
            return this;
        }

        public Builder edges(List<ExecutableEdge> edges) {
            this.edges = Objects.requireNonNull(edges, "edges");
            return this;
        }

        public Builder startNodes(List<String> startNodes) {
            this.startNodes = Objects.requireNonNull(startNodes, "startNodes");
            return this;
        }

        public Builder executionLevels(List<List<String>> executionLevels) {
            this.executionLevels = Objects.requireNonNull(executionLevels, "executionLevels");
            return this;
        }

        public Builder loopBoundaries(Map<String, LoopBoundary> loopBoundaries) {
            this.loopBoundaries = Objects.requireNonNull(loopBoundaries, "loopBoundaries");
            return this;
        }

        public Builder parallelBoundaries(Map<String, ParallelBoundary> parallelBoundaries) {
            this.parallelBoundaries =
                    Objects.requireNonNull(parallelBoundaries, "parallelBoundaries");
            return this;
        }

        public Builder warnings(List<BuildWarning> warnings) {
            this.warnings = Objects.requireNonNull(warnings, "warnings");
            return this;
        }

        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder outputNodeIds(List<String> outputNodeIds) {
            this.outputNodeIds = Objects.requireNonNull(outputNodeIds, "outputNodeIds");
            return this;
        }

        public Builder maxConcurrentNodes(int maxConcurrentNodes) {
            this.maxConcurrentNodes = maxConcurrentNodes;
            return this;
        }

        /// Builds the plan and freezes its nodes.
        ///
        /// @return new immutable plan, never null
        /// @throws NullPointerException if definition or entry point is missing
        public ExecutionPlan build() {
            return new ExecutionPlan(this);
        }
    }

    @Override
    public String toString() {
        return "ExecutionPlan{entryPoint='"
                + entryPoint
                + "', nodes="
                + nodes.size()
                + ", edges="
                + edges.size()
                + ", levels="
                + executionLevels.size()
                + ", warnings="
                + warnings.size()
                + "}";
    }
}
