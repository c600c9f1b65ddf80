package io.planwright.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.planwright.core.workflow.WorkflowDefinition;

/// Jackson mixin that binds `WorkflowDefinition` deserialization to its builder.
///
/// Applied via `PlanwrightJacksonModule.setupModule()`. The builder keeps node and edge
/// order as it appears in the document, which the plan builder relies on for
/// deterministic output.
///
/// @apiNote The companion mixin {@link WorkflowDefinitionBuilderMixin} must also be
/// registered so Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see io.planwright.serialization.PlanwrightJacksonModule
@JsonDeserialize(builder = WorkflowDefinition.Builder.class)
public abstract class WorkflowDefinitionMixin {}
