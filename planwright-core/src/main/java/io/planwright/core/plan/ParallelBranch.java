package io.planwright.core.plan;

import java.util.List;
import java.util.Objects;

/// One branch of a parallel block.
///
/// @param index zero-based position, matching the order of the parallel node's outgoing edges
/// @param nodeIds branch members in visit order, not null
/// @param startNodeId first node of the branch, not null
/// @param endNodeId node where the branch hands control back, not null
public record ParallelBranch(int index, List<String> nodeIds, String startNodeId, String endNodeId) {

    public ParallelBranch {
        Objects.requireNonNull(startNodeId, "startNodeId");
        Objects.requireNonNull(endNodeId, "endNodeId");
        nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
    }
}
