package io.planwright.core.builder;

import java.util.Objects;
import java.util.Set;

/// Partition of a definition's node ids into those reachable from the entry point and
/// the rest.
///
/// ### Contracts
/// - **Invariant**: the two sets are disjoint and together hold every node id
/// - **Invariant**: `entryPointId` is in `reachableNodeIds`
///
/// @param reachableNodeIds reachable ids in BFS discovery order, not null
/// @param unreachableNodeIds remaining ids in definition order, not null
/// @param entryPointId the entry point the traversal started from, not null
public record ReachabilityResult(
        Set<String> reachableNodeIds, Set<String> unreachableNodeIds, String entryPointId) {

    public ReachabilityResult {
        Objects.requireNonNull(entryPointId, "entryPointId");
        reachableNodeIds = GraphTraversal.orderedCopy(reachableNodeIds);
        unreachableNodeIds = GraphTraversal.orderedCopy(unreachableNodeIds);
    }

    /// Returns whether the node was reached from the entry point.
    ///
    /// @param nodeId node id, may be null
    /// @return true if reachable
    public boolean isReachable(String nodeId) {
        return reachableNodeIds.contains(nodeId);
    }
}
