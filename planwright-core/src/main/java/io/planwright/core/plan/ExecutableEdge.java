package io.planwright.core.plan;

import java.util.Objects;

/// A directed edge of the execution plan, classified by handle type.
///
/// Edges copied from the definition keep their `sourceHandle` and are (re)classified by
/// the edge constructor. Edges inserted while rewiring loops are `synthetic`: their
/// handle type is fixed at creation and never reclassified.
///
/// @param id edge id, not null
/// @param source source node id, not null
/// @param target target node id, not null
/// @param handleType activation classification, not null
/// @param sourceHandle port name on the source node, may be null
/// @param targetHandle port name on the target node, may be null
/// @param conditionValue branch value for condition edges, may be null
/// @param routerPath route name for router edges, may be null
/// @param synthetic true if the edge was inserted by loop rewiring
public record ExecutableEdge(
        String id,
        String source,
        String target,
        HandleType handleType,
        String sourceHandle,
        String targetHandle,
        String conditionValue,
        String routerPath,
        boolean synthetic) {

    public ExecutableEdge {
        Objects.requireNonNull(id, "Edge ID required");
        Objects.requireNonNull(source, "Edge source required");
        Objects.requireNonNull(target, "Edge target required");
        Objects.requireNonNull(handleType, "Edge handle type required");
    }

    /// Creates a synthetic edge with a deterministic `source->target` id.
    ///
    /// @param source source node id, not null
    /// @param target target node id, not null
    /// @param handleType fixed classification, not null
    /// @return new synthetic edge, never null
    public static ExecutableEdge synthetic(String source, String target, HandleType handleType) {
        return new ExecutableEdge(
                source + "->" + target, source, target, handleType, null, null, null, null, true);
    }

    /// Returns a copy with a new classification and extracted branch data.
    ///
    /// @param type new handle type, not null
    /// @param condition condition value, may be null
    /// @param route router path, may be null
    /// @return new edge, never null
    public ExecutableEdge withClassification(HandleType type, String condition, String route) {
        return new ExecutableEdge(
                id, source, target, type, sourceHandle, targetHandle, condition, route, synthetic);
    }
}
