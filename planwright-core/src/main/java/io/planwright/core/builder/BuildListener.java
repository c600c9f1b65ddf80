package io.planwright.core.builder;

/// Listener for plan construction progress.
///
/// All methods have default no-op implementations, so listeners override only what
/// they need. Callbacks run synchronously on the thread calling
/// {@link WorkflowBuilder#build}.
///
/// ### Callback Lifecycle
/// ```
/// onStageComplete(PATHS, ctx)
/// onStageComplete(NODES, ctx)     // parallel expansion included
/// onStageComplete(LOOPS, ctx)
/// onStageComplete(EDGES, ctx)
/// onStageComplete(LEVELS, ctx)
/// onWarning(warning)              // once per warning, after the last stage
/// ```
///
/// @implNote The context passed to {@link #onStageComplete} is live build state. Read it,
/// do not mutate it.
public interface BuildListener {

    /// Called after a pipeline stage finished.
    ///
    /// @param stage the completed stage, not null
    /// @param context the construction context as left by the stage, not null
    default void onStageComplete(BuildStage stage, ConstructionContext context) {}

    /// Called once for each warning attached to the finished plan.
    ///
    /// @param warning the warning, not null
    default void onWarning(BuildWarning warning) {}

    /// No-op listener instance that ignores all events.
    BuildListener NOOP = new BuildListener() {};
}
