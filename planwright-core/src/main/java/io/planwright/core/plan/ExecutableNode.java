package io.planwright.core.plan;

import io.planwright.core.workflow.NodePosition;
import io.planwright.core.workflow.node.NodeCategory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A workflow node resolved for execution: dependency lists, handle semantics and
/// structural context (loop / parallel membership).
///
/// ### Lifecycle
/// Created by the node constructor (or, for loop sentinels, by the loop constructor),
/// mutated in place by later construction stages, then frozen when the execution plan
/// is assembled. After {@link #freeze()} every mutator throws `IllegalStateException`.
///
/// ### Contracts
/// - **Invariant**: `dependencies` and `dependents` hold no duplicates
/// - **Invariant**: {@link #isTerminal()} is true iff `dependents` is empty
///
/// @implNote **Not thread-safe** while mutable. Once frozen, safe to share.
///
/// @see ExecutionPlan for the frozen container
public final class ExecutableNode {

    private final String id;
    private final String type;
    private final String name;
    private final Map<String, Object> config;
    private final NodePosition position;
    private final boolean errorPort;
    private final List<String> dependencies = new ArrayList<>();
    private final List<String> dependents = new ArrayList<>();
    private HandleType handleType = HandleType.SOURCE;
    private LoopContext loopContext;
    private ParallelContext parallelContext;
    private int depth;
    private boolean frozen;

    private ExecutableNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID required");
        this.type = Objects.requireNonNull(builder.type, "Node type required");
        this.name = builder.name;
        this.config =
                builder.config != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.config))
                        : Map.of();
        this.position = builder.position != null ? builder.position : NodePosition.ORIGIN;
        this.errorPort = builder.errorPort;
        this.loopContext = builder.loopContext;
        this.depth = builder.depth;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /// Returns the category derived from the node type.
    ///
    /// @return node category, never null
    public NodeCategory getCategory() {
        return NodeCategory.of(type);
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public NodePosition getPosition() {
        return position;
    }

    /// Returns the ids of nodes that must complete before this one.
    ///
    /// @return unmodifiable view, never null
    public List<String> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /// Returns the ids of nodes that wait on this one.
    ///
    /// @return unmodifiable view, never null
    public List<String> getDependents() {
        return Collections.unmodifiableList(dependents);
    }

    /// Returns the dominant classification of this node's outgoing edges.
    ///
    /// @return handle type, {@link HandleType#SOURCE} until edges are resolved
    public HandleType getHandleType() {
        return handleType;
    }

    /// Returns the loop membership or sentinel marker.
    ///
    /// @return loop context, or null outside any loop
    public LoopContext getLoopContext() {
        return loopContext;
    }

    /// Returns the parallel branch membership.
    ///
    /// @return parallel context, or null outside any parallel branch
    public ParallelContext getParallelContext() {
        return parallelContext;
    }

    /// Returns whether failures of this node can be routed along an error edge.
    ///
    /// @return true for llm/http/integration/agent nodes and nodes that opt in
    public boolean hasErrorPort() {
        return errorPort;
    }

    /// Returns whether no node depends on this one.
    ///
    /// @return true iff `dependents` is empty
    public boolean isTerminal() {
        return dependents.isEmpty();
    }

    /// Returns the shortest hop distance from the entry point.
    ///
    /// @return depth, 0 for the entry point
    public int getDepth() {
        return depth;
    }

    /// Returns whether this node is a synthetic loop START or END node.
    ///
    /// @return true for loop sentinels
    public boolean isLoopSentinel() {
        return loopContext != null && loopContext.isSentinel();
    }

    public boolean isFrozen() {
        return frozen;
    }

    // -----------------------------------------------------------------------
    // Mutators (construction only)
    // -----------------------------------------------------------------------

    /// Adds a dependency unless already present.
    ///
    /// @param nodeId id of the node this one waits on, not null
    public void addDependency(String nodeId) {
        checkMutable();
        if (!dependencies.contains(nodeId)) {
            dependencies.add(nodeId);
        }
    }

    /// Removes a dependency if present.
    ///
    /// @param nodeId id to remove, not null
    public void removeDependency(String nodeId) {
        checkMutable();
        dependencies.remove(nodeId);
    }

    /// Adds a dependent unless already present.
    ///
    /// @param nodeId id of the node waiting on this one, not null
    public void addDependent(String nodeId) {
        checkMutable();
        if (!dependents.contains(nodeId)) {
            dependents.add(nodeId);
        }
    }

    /// Removes a dependent if present.
    ///
    /// @param nodeId id to remove, not null
    public void removeDependent(String nodeId) {
        checkMutable();
        dependents.remove(nodeId);
    }

    public void setHandleType(HandleType handleType) {
        checkMutable();
        this.handleType = Objects.requireNonNull(handleType, "handleType");
    }

    public void setLoopContext(LoopContext loopContext) {
        checkMutable();
        this.loopContext = loopContext;
    }

    public void setParallelContext(ParallelContext parallelContext) {
        checkMutable();
        this.parallelContext = parallelContext;
    }

    public void setDepth(int depth) {
        checkMutable();
        this.depth = depth;
    }

    /// Makes this node read-only. Idempotent.
    public void freeze() {
        frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Node '" + id + "' is frozen");
        }
    }

    /// Creates a builder for a node with the given id.
    ///
    /// @param id unique node id, not null
    /// @return new builder, never null
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /// Builder for {@link ExecutableNode}. Dependency lists start empty.
    public static final class Builder {
        private final String id;
        private String type;
        private String name;
        private Map<String, Object> config;
        private NodePosition position;
        private boolean errorPort;
        private LoopContext loopContext;
        private int depth;

        private Builder(String id) {
            this.id = id;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder position(NodePosition position) {
            this.position = position;
            return this;
        }

        public Builder errorPort(boolean errorPort) {
            this.errorPort = errorPort;
            return this;
        }

        public Builder loopContext(LoopContext loopContext) {
            this.loopContext = loopContext;
            return this;
        }

        public Builder depth(int depth) {
            this.depth = depth;
            return this;
        }

        /// Builds the node.
        ///
        /// @return new mutable node, never null
        /// @throws NullPointerException if id or type is null
        public ExecutableNode build() {
            return new ExecutableNode(this);
        }
    }

    @Override
    public String toString() {
        return "ExecutableNode{id='" + id + "', type='" + type + "'}";
    }
}
