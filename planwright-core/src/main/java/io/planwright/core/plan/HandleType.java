package io.planwright.core.plan;

/// Semantic classification of an edge's activation condition.
///
/// ### Dominance
/// A node's own handle type is the most dominant type among its outgoing edges, in the
/// order router > condition > loop > error > source. The runtime uses it to decide how
/// to pick the next edge(s) after the node completes.
public enum HandleType {
    SOURCE("source", 0),
    ERROR("error", 1),
    LOOP("loop", 2),
    CONDITION("condition", 3),
    ROUTER("router", 4);

    private final String value;
    private final int dominance;

    HandleType(String value, int dominance) {
        this.value = value;
        this.dominance = dominance;
    }

    /// Returns the wire name (`source`, `error`, `condition`, `router`, `loop`).
    ///
    /// @return lower-case name, never null
    public String value() {
        return value;
    }

    /// Returns whether this type takes precedence over `other` when picking a node's
    /// dominant handle type.
    ///
    /// @param other type to compare against, not null
    /// @return true if this type dominates
    public boolean dominates(HandleType other) {
        return dominance > other.dominance;
    }

    /// Parses a wire name.
    ///
    /// @param value lower-case name, not null
    /// @return matching handle type
    /// @throws IllegalArgumentException if the name is unknown
    public static HandleType fromValue(String value) {
        for (HandleType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown handle type: " + value);
    }
}
