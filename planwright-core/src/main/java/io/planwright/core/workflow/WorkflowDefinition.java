package io.planwright.core.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Declarative workflow graph as authored in the editor: nodes, edges and an entry point.
///
/// A definition is raw input. It is not validated on construction so that a malformed
/// document can still be handed to {@link io.planwright.core.builder.WorkflowBuilder},
/// which reports structural problems as
/// {@link io.planwright.core.exception.WorkflowValidationException}s (or, through
/// `validateWorkflow`, as a structured result) instead of failing deep inside JSON binding.
///
/// ### Structure
/// - **Nodes**: ordered map of node id to {@link WorkflowNode}; iteration order is the
///   authoring order and drives every deterministic traversal in the builder
/// - **Edges**: ordered list of {@link WorkflowEdge}s
/// - **Entry point**: id of the node execution starts from
/// - **Settings**: optional runtime hints such as the concurrency cap
///
/// @implNote Immutable after construction. `nodes` and `edges` are null only when the
/// source document omitted them; otherwise they are unmodifiable copies.
///
/// @see io.planwright.core.builder.WorkflowBuilder for compilation into an execution plan
public final class WorkflowDefinition {

    private final String name;
    private final Map<String, WorkflowNode> nodes;
    private final List<WorkflowEdge> edges;
    private final String entryPoint;
    private final WorkflowSettings settings;

    private WorkflowDefinition(Builder builder) {
        this.name = builder.name;
        this.nodes = builder.nodes != null ? Collections.unmodifiableMap(builder.nodes) : null;
        this.edges = builder.edges != null ? Collections.unmodifiableList(builder.edges) : null;
        this.entryPoint = builder.entryPoint;
        this.settings = builder.settings != null ? builder.settings : WorkflowSettings.DEFAULT;
    }

    /// Returns the display name of the workflow.
    ///
    /// @return workflow name, may be null
    public String getName() {
        return name;
    }

    /// Returns all nodes keyed by id, in authoring order.
    ///
    /// @return unmodifiable ordered map, or null if the document had no node map
    public Map<String, WorkflowNode> getNodes() {
        return nodes;
    }

    /// Returns all edges in authoring order.
    ///
    /// @return unmodifiable list, or null if the document had no edge list
    public List<WorkflowEdge> getEdges() {
        return edges;
    }

    /// Returns the id of the node execution starts from.
    ///
    /// @return entry point node id, may be null
    public String getEntryPoint() {
        return entryPoint;
    }

    /// Returns the runtime settings.
    ///
    /// @return settings, never null (defaults when absent)
    public WorkflowSettings getSettings() {
        return settings;
    }

    /// Creates a new definition builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link WorkflowDefinition}.
    ///
    /// Copies collections and keeps their order. Nothing is required:
    /// validation is the builder pipeline's job.
    public static final class Builder {
        private String name;
        private LinkedHashMap<String, WorkflowNode> nodes;
        private ArrayList<WorkflowEdge> edges;
        private String entryPoint;
        private WorkflowSettings settings;

        private Builder() {}

        /// Sets the display name.
        ///
        /// @param name workflow name, may be null
        /// @return this builder for chaining
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /// Sets the node map, preserving its iteration order.
        ///
        /// @param nodes node id to node, may be null
        /// @return this builder for chaining
        public Builder nodes(Map<String, WorkflowNode> nodes) {
            this.nodes = nodes != null ? new LinkedHashMap<>(nodes) : null;
            return this;
        }

        /// Adds a single node, creating the node map on first use.
        ///
        /// @param id node id, not null
        /// @param node node definition, not null
        /// @return this builder for chaining
        public Builder node(String id, WorkflowNode node) {
            if (nodes == null) {
                nodes = new LinkedHashMap<>();
            }
            nodes.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(node, "node"));
            return this;
        }

        /// Sets the edge list.
        ///
        /// @param edges ordered edges, may be null
        /// @return this builder for chaining
        public Builder edges(List<WorkflowEdge> edges) {
            this.edges = edges != null ? new ArrayList<>(edges) : null;
            return this;
        }

        /// Appends a single edge, creating the edge list on first use.
        ///
        /// @param edge edge definition, not null
        /// @return this builder for chaining
        public Builder edge(WorkflowEdge edge) {
            if (edges == null) {
                edges = new ArrayList<>();
            }
            edges.add(Objects.requireNonNull(edge, "edge"));
            return this;
        }

        /// Sets the entry point node id.
        ///
        /// @param entryPoint id of the first node, may be null
        /// @return this builder for chaining
        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        /// Sets runtime settings.
        ///
        /// @param settings settings, may be null for defaults
        /// @return this builder for chaining
        public Builder settings(WorkflowSettings settings) {
            this.settings = settings;
            return this;
        }

        /// Builds the definition.
        ///
        /// @return new definition, never null
        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{name='"
                + name
                + "', entryPoint='"
                + entryPoint
                + "', nodes="
                + (nodes != null ? nodes.size() : 0)
                + ", edges="
                + (edges != null ? edges.size() : 0)
                + "}";
    }
}
