package io.planwright.core.plan;

import java.util.Objects;

/// Marks a node as a member of one branch of a parallel block.
///
/// @param parentParallelId id of the parallel node that fans out, not null
/// @param branchIndex zero-based branch index in the parallel boundary
public record ParallelContext(String parentParallelId, int branchIndex) {

    public ParallelContext {
        Objects.requireNonNull(parentParallelId, "parentParallelId");
        if (branchIndex < 0) {
            throw new IllegalArgumentException("branchIndex must be >= 0");
        }
    }
}
