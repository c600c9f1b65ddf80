package io.planwright.core.workflow.node;

import java.util.Optional;

/// How the runtime joins the branches of a parallel block.
///
/// - {@link #ALL}: wait for every branch
/// - {@link #FIRST}: continue with the first branch to succeed
/// - {@link #RACE}: continue with the first branch to finish, success or not
public enum ParallelAggregation {
    ALL("all"),
    FIRST("first"),
    RACE("race");

    private final String value;

    ParallelAggregation(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /// Parses a configured aggregation value.
    ///
    /// @param raw value from `config.aggregation`, may be null or a non-string
    /// @return the aggregation, or empty if `raw` is not one of `all`, `first`, `race`
    public static Optional<ParallelAggregation> parse(Object raw) {
        if (!(raw instanceof String text)) {
            return Optional.empty();
        }
        for (ParallelAggregation aggregation : values()) {
            if (aggregation.value.equalsIgnoreCase(text)) {
                return Optional.of(aggregation);
            }
        }
        return Optional.empty();
    }
}
