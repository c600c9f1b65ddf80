package io.planwright.core.builder;

import java.util.Objects;

/// Non-fatal problem found while building an execution plan.
///
/// Warnings never stop a build; they are collected in order of discovery and returned
/// with the plan.
///
/// @param code warning category, not null
/// @param message human-readable description, not null
/// @param nodeId node the warning refers to, may be null
/// @param edgeId edge the warning refers to, may be null
public record BuildWarning(WarningCode code, String message, String nodeId, String edgeId) {

    public BuildWarning {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    /// Creates a warning attached to a node.
    ///
    /// @param code warning category, not null
    /// @param message description, not null
    /// @param nodeId node id, may be null
    /// @return new warning, never null
    public static BuildWarning forNode(WarningCode code, String message, String nodeId) {
        return new BuildWarning(code, message, nodeId, null);
    }

    /// Creates a warning attached to an edge.
    ///
    /// @param code warning category, not null
    /// @param message description, not null
    /// @param edgeId edge id, may be null
    /// @return new warning, never null
    public static BuildWarning forEdge(WarningCode code, String message, String edgeId) {
        return new BuildWarning(code, message, null, edgeId);
    }
}
