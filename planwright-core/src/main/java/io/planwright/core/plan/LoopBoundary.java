package io.planwright.core.plan;

import io.planwright.core.workflow.node.LoopType;
import java.util.List;
import java.util.Objects;

/// Structural description of one loop: its sentinels, body and iteration control.
///
/// @param loopNodeId id of the loop node, not null
/// @param startSentinelId id of the synthetic START node, not null
/// @param endSentinelId id of the synthetic END node, not null
/// @param bodyNodeIds body members in discovery order, deduplicated, not null
/// @param loopType loop flavour, not null
/// @param loopConfig iteration control matching `loopType`, not null
/// @param maxIterations hard iteration cap for the runtime
/// @param iterationVariable context variable holding the zero-based index, not null
/// @param itemVariable context variable holding the current item, not null
public record LoopBoundary(
        String loopNodeId,
        String startSentinelId,
        String endSentinelId,
        List<String> bodyNodeIds,
        LoopType loopType,
        LoopConfig loopConfig,
        int maxIterations,
        String iterationVariable,
        String itemVariable) {

    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    public LoopBoundary {
        Objects.requireNonNull(loopNodeId, "loopNodeId");
        Objects.requireNonNull(startSentinelId, "startSentinelId");
        Objects.requireNonNull(endSentinelId, "endSentinelId");
        Objects.requireNonNull(loopType, "loopType");
        Objects.requireNonNull(loopConfig, "loopConfig");
        Objects.requireNonNull(iterationVariable, "iterationVariable");
        Objects.requireNonNull(itemVariable, "itemVariable");
        bodyNodeIds = bodyNodeIds != null ? List.copyOf(bodyNodeIds) : List.of();
    }

    /// Returns a copy with a different body.
    ///
    /// @param bodyNodeIds new body members, not null
    /// @return new boundary, never null
    public LoopBoundary withBodyNodeIds(List<String> bodyNodeIds) {
        return new LoopBoundary(
                loopNodeId,
                startSentinelId,
                endSentinelId,
                bodyNodeIds,
                loopType,
                loopConfig,
                maxIterations,
                iterationVariable,
                itemVariable);
    }

    /// Returns whether the node is a body member of this loop.
    ///
    /// @param nodeId node id, not null
    /// @return true if listed in `bodyNodeIds`
    public boolean contains(String nodeId) {
        return bodyNodeIds.contains(nodeId);
    }
}
