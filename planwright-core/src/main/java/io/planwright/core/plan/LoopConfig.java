package io.planwright.core.plan;

/// Iteration control for a loop boundary, one variant per loop type.
///
/// - `for` → {@link Count}
/// - `forEach` → {@link SourceArray}
/// - `while` / `doWhile` → {@link Condition}
///
/// @see LoopBoundary#loopConfig()
public sealed interface LoopConfig
        permits LoopConfig.Count, LoopConfig.SourceArray, LoopConfig.Condition {

    /// Fixed number of iterations.
    ///
    /// @param count configured iteration count, as declared (validation is a warning concern)
    record Count(int count) implements LoopConfig {}

    /// Iterate over the items of an array resolved at runtime.
    ///
    /// @param sourceArray path or expression naming the array, may be null if undeclared
    record SourceArray(String sourceArray) implements LoopConfig {}

    /// Iterate while an expression holds.
    ///
    /// @param condition expression evaluated by the runtime, may be null if undeclared
    record Condition(String condition) implements LoopConfig {}
}
