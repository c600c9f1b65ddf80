package io.planwright.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.planwright.core.plan.ExecutionPlan;
import io.planwright.core.workflow.ErrorHandling;
import io.planwright.core.workflow.WorkflowDefinition;
import io.planwright.serialization.mixin.ErrorHandlingMixin;
import io.planwright.serialization.mixin.WorkflowDefinitionBuilderMixin;
import io.planwright.serialization.mixin.WorkflowDefinitionMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Planwright serialization configuration in
/// one place.
///
/// **Custom serializer**:
/// - `ExecutionPlan`: `ExecutionPlanSerializer`, handle types, loop types and aggregations
///   written in their lower-case wire form
///
/// **Mixins**:
/// - `WorkflowDefinition` + `WorkflowDefinition.Builder` (builder-based deserialization)
/// - `ErrorHandling` (hides the derived `goto` flag)
///
/// The definition's records (`WorkflowNode`, `WorkflowEdge`, `NodePosition`,
/// `WorkflowSettings`) bind through their canonical constructors and need no registration.
///
/// @see WorkflowSerializer for the convenience factory API
public class PlanwrightJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3164250958273514981L;

    public PlanwrightJacksonModule() {
        super("PlanwrightJacksonModule");

        addSerializer(ExecutionPlan.class, new ExecutionPlanSerializer());
    }

    /// Applies mixin annotations to the definition types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(WorkflowDefinition.class, WorkflowDefinitionMixin.class);
        context.setMixInAnnotations(
                WorkflowDefinition.Builder.class, WorkflowDefinitionBuilderMixin.class);

        context.setMixInAnnotations(ErrorHandling.class, ErrorHandlingMixin.class);
    }
}
