package io.planwright.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `WorkflowDefinition.Builder`.
///
/// Sets `withPrefix = ""` so JSON field names (`name`, `nodes`, `edges`, `entryPoint`,
/// `settings`) map directly to builder methods.
///
/// @see WorkflowDefinitionMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowDefinitionBuilderMixin {}
