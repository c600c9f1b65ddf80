package io.planwright.core.builder;

import java.util.List;

/// Outcome of {@link WorkflowBuilder#validateWorkflow}.
///
/// @param valid true if the definition compiles
/// @param errors fatal problems, empty when valid
/// @param warnings non-fatal problems, including unreachable and unconnected nodes
public record ValidationResult(boolean valid, List<String> errors, List<BuildWarning> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
