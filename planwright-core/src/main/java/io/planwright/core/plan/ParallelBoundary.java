package io.planwright.core.plan;

import io.planwright.core.workflow.node.ParallelAggregation;
import java.util.List;
import java.util.Objects;

/// Structural description of a parallel fan-out.
///
/// @param parallelNodeId id of the parallel node, not null
/// @param branches ordered branches, one per outgoing edge, not null
/// @param aggregation how branch results are combined, not null
public record ParallelBoundary(
        String parallelNodeId, List<ParallelBranch> branches, ParallelAggregation aggregation) {

    public ParallelBoundary {
        Objects.requireNonNull(parallelNodeId, "parallelNodeId");
        Objects.requireNonNull(aggregation, "aggregation");
        branches = branches != null ? List.copyOf(branches) : List.of();
    }

    /// Returns the number of branches.
    ///
    /// @return branch count
    public int branchCount() {
        return branches.size();
    }
}
