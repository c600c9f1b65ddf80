package io.planwright.core.builder;

/// Pipeline stages reported to {@link BuildListener#onStageComplete}, in execution order.
public enum BuildStage {
    PATHS,
    NODES,
    LOOPS,
    EDGES,
    LEVELS
}
