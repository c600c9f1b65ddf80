package io.planwright.core.workflow;

/// Per-node failure directive (`onError` in the editor document).
///
/// Only the `goto` strategy matters to plan construction: it gives the node an error
/// port, and the runtime routes failures to `targetNodeId` or the node's error edge.
///
/// @param strategy strategy name such as `fail`, `continue`, `goto`, may be null
/// @param targetNodeId node to jump to for `goto`, may be null
public record ErrorHandling(String strategy, String targetNodeId) {

    public static final String GOTO = "goto";

    /// Returns whether the strategy is `goto` (case-insensitive).
    ///
    /// @return true for a goto directive
    public boolean isGoto() {
        return GOTO.equalsIgnoreCase(strategy);
    }
}
