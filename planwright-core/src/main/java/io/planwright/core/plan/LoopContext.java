package io.planwright.core.plan;

import java.util.Objects;

/// Marks a node as belonging to a loop body, or as one of a loop's sentinels.
///
/// @param parentLoopId id of the owning loop node, not null
/// @param sentinel START or END for synthetic sentinel nodes, null for body nodes
public record LoopContext(String parentLoopId, Sentinel sentinel) {

    public LoopContext {
        Objects.requireNonNull(parentLoopId, "parentLoopId");
    }

    /// Creates a body-member context.
    ///
    /// @param parentLoopId owning loop, not null
    /// @return context without a sentinel marker
    public static LoopContext member(String parentLoopId) {
        return new LoopContext(parentLoopId, null);
    }

    /// Returns whether this context marks a sentinel node.
    ///
    /// @return true for START and END sentinels
    public boolean isSentinel() {
        return sentinel != null;
    }

    /// Which end of the loop body a sentinel marks.
    public enum Sentinel {
        START,
        END
    }
}
