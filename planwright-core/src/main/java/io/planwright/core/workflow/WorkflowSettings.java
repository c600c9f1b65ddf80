package io.planwright.core.workflow;

/// Runtime hints attached to a definition.
///
/// @param maxConcurrentNodes upper bound on nodes the runtime dispatches at once,
///        null for the default of {@value #DEFAULT_MAX_CONCURRENT_NODES}
public record WorkflowSettings(Integer maxConcurrentNodes) {

    public static final int DEFAULT_MAX_CONCURRENT_NODES = 10;

    public static final WorkflowSettings DEFAULT = new WorkflowSettings(null);

    public WorkflowSettings {
        if (maxConcurrentNodes != null && maxConcurrentNodes < 1) {
            throw new IllegalArgumentException("maxConcurrentNodes must be >= 1");
        }
    }

    /// Returns the configured concurrency cap or the default.
    ///
    /// @return positive concurrency cap
    public int effectiveMaxConcurrentNodes() {
        return maxConcurrentNodes != null ? maxConcurrentNodes : DEFAULT_MAX_CONCURRENT_NODES;
    }
}
