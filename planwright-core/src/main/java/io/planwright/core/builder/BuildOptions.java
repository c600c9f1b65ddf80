package io.planwright.core.builder;

import java.util.Properties;

/// Options controlling a single {@link WorkflowBuilder#build} call.
///
/// ### Contracts
/// - **Precondition**: `maxLoopDepth` and `maxParallelBranches` are positive
/// - **Postcondition**: All fields immutable after construction
///
/// @param includeUnreachable materialize nodes not reachable from the entry point
/// @param validateConfigs run per-node config checks that produce warnings
/// @param maxLoopDepth deepest allowed loop nesting for any node
/// @param maxParallelBranches most branches a single parallel node may fan out to
public record BuildOptions(
        boolean includeUnreachable,
        boolean validateConfigs,
        int maxLoopDepth,
        int maxParallelBranches) {

    public static final String PREFIX = "planwright.build.";
    public static final String INCLUDE_UNREACHABLE = PREFIX + "include-unreachable";
    public static final String VALIDATE_CONFIGS = PREFIX + "validate-configs";
    public static final String MAX_LOOP_DEPTH = PREFIX + "max-loop-depth";
    public static final String MAX_PARALLEL_BRANCHES = PREFIX + "max-parallel-branches";

    public static final int DEFAULT_MAX_LOOP_DEPTH = 10;
    public static final int DEFAULT_MAX_PARALLEL_BRANCHES = 50;

    /// Compact constructor with validation.
    public BuildOptions {
        if (maxLoopDepth < 1) {
            throw new IllegalArgumentException("maxLoopDepth must be >= 1");
        }
        if (maxParallelBranches < 1) {
            throw new IllegalArgumentException("maxParallelBranches must be >= 1");
        }
    }

    /// Returns the default options.
    ///
    /// Defaults:
    /// - includeUnreachable: false
    /// - validateConfigs: true
    /// - maxLoopDepth: 10
    /// - maxParallelBranches: 50
    ///
    /// @return default options, never null
    public static BuildOptions defaults() {
        return new BuildOptions(false, true, DEFAULT_MAX_LOOP_DEPTH, DEFAULT_MAX_PARALLEL_BRANCHES);
    }

    /// Reads options from properties, falling back to defaults for absent keys.
    ///
    /// Recognized keys:
    /// - `planwright.build.include-unreachable`
    /// - `planwright.build.validate-configs`
    /// - `planwright.build.max-loop-depth`
    /// - `planwright.build.max-parallel-branches`
    ///
    /// @param properties source properties, not null
    /// @return parsed options, never null
    /// @throws IllegalArgumentException if a value is not a boolean or positive integer
    public static BuildOptions fromProperties(Properties properties) {
        BuildOptions defaults = defaults();
        return new BuildOptions(
                readBoolean(properties, INCLUDE_UNREACHABLE, defaults.includeUnreachable),
                readBoolean(properties, VALIDATE_CONFIGS, defaults.validateConfigs),
                readInt(properties, MAX_LOOP_DEPTH, defaults.maxLoopDepth),
                readInt(properties, MAX_PARALLEL_BRANCHES, defaults.maxParallelBranches));
    }

    private static boolean readBoolean(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
    }

    private static int readInt(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    /// Returns a copy that materializes unreachable nodes.
    ///
    /// @param include new value
    /// @return new options, never null
    public BuildOptions withIncludeUnreachable(boolean include) {
        return new BuildOptions(include, validateConfigs, maxLoopDepth, maxParallelBranches);
    }

    /// Returns a copy with config validation switched on or off.
    ///
    /// @param validate new value
    /// @return new options, never null
    public BuildOptions withValidateConfigs(boolean validate) {
        return new BuildOptions(includeUnreachable, validate, maxLoopDepth, maxParallelBranches);
    }

    /// Returns a copy with a new loop nesting limit.
    ///
    /// @param depth new limit, positive
    /// @return new options, never null
    public BuildOptions withMaxLoopDepth(int depth) {
        return new BuildOptions(includeUnreachable, validateConfigs, depth, maxParallelBranches);
    }

    /// Returns a copy with a new parallel branch limit.
    ///
    /// @param branches new limit, positive
    /// @return new options, never null
    public BuildOptions withMaxParallelBranches(int branches) {
        return new BuildOptions(includeUnreachable, validateConfigs, maxLoopDepth, branches);
    }

    /// Creates a builder initialized with the defaults.
    ///
    /// @return new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link BuildOptions}.
    public static final class Builder {
        private boolean includeUnreachable;
        private boolean validateConfigs = true;
        private int maxLoopDepth = DEFAULT_MAX_LOOP_DEPTH;
        private int maxParallelBranches = DEFAULT_MAX_PARALLEL_BRANCHES;

        private Builder() {}

        public Builder includeUnreachable(boolean includeUnreachable) {
            this.includeUnreachable = includeUnreachable;
            return this;
        }

        public Builder validateConfigs(boolean validateConfigs) {
            this.validateConfigs = validateConfigs;
            return this;
        }

        public Builder maxLoopDepth(int maxLoopDepth) {
            this.maxLoopDepth = maxLoopDepth;
            return this;
        }

        public Builder maxParallelBranches(int maxParallelBranches) {
            this.maxParallelBranches = maxParallelBranches;
            return this;
        }

        /// Builds the options.
        ///
        /// @return new options, never null
        /// @throws IllegalArgumentException if a limit is not positive
        public BuildOptions build() {
            return new BuildOptions(
                    includeUnreachable, validateConfigs, maxLoopDepth, maxParallelBranches);
        }
    }
}
