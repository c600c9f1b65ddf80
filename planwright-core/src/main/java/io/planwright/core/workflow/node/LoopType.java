package io.planwright.core.workflow.node;

/// Iteration semantics of a loop boundary.
///
/// Derived from the loop node's type string: `loop` and `for` map to {@link #FOR},
/// `forEach`, `while` and `doWhile` map to themselves, anything else falls back to
/// {@link #FOR}.
public enum LoopType {
    FOR("for"),
    FOR_EACH("forEach"),
    WHILE("while"),
    DO_WHILE("doWhile");

    private final String value;

    LoopType(String value) {
        this.value = value;
    }

    /// Returns the wire name (`for`, `forEach`, `while`, `doWhile`).
    ///
    /// @return wire name, never null
    public String value() {
        return value;
    }

    /// Derives the loop type from a node type string.
    ///
    /// @param nodeType loop node type, may be null
    /// @return loop type, never null
    public static LoopType fromNodeType(String nodeType) {
        if (nodeType == null) {
            return FOR;
        }
        for (LoopType type : values()) {
            if (type.value.equals(nodeType)) {
                return type;
            }
        }
        return FOR;
    }
}
