package io.planwright.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.planwright.core.plan.ExecutionPlan;
import io.planwright.core.workflow.WorkflowDefinition;
import java.io.IOException;
import java.io.InputStream;

/// Reads and writes workflow definitions and execution plans as JSON.
///
/// Definitions round-trip. Plans are write-only: a plan is always rebuilt from its
/// definition, never parsed back.
///
/// ### Usage
/// {@snippet :
/// WorkflowDefinition definition = WorkflowSerializer.fromJson(json);
/// ExecutionPlan plan = new WorkflowBuilder().build(definition);
/// String planJson = WorkflowSerializer.planToJson(plan);
/// }
///
/// @implNote Thread-safe. A new `ObjectMapper` is created per call via `createMapper()`.
/// For high-throughput scenarios, cache the mapper.
///
/// @see PlanwrightJacksonModule for the registered type handlers
public final class WorkflowSerializer {

    private WorkflowSerializer() {}

    /// Serializes a definition to pretty-printed JSON.
    ///
    /// @param definition the definition to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(WorkflowDefinition definition) {
        try {
            return createMapper().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow definition: " + e.getMessage(), e);
        }
    }

    /// Deserializes a definition from JSON.
    ///
    /// Structural checks (entry point, node map, edge list) are left to the builder, so a
    /// document missing them still parses.
    ///
    /// @param json JSON string, not null
    /// @return deserialized definition, never null
    /// @throws IllegalArgumentException if the JSON is malformed or has the wrong shape
    public static WorkflowDefinition fromJson(String json) {
        try {
            return createMapper().readValue(json, WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow definition: " + e.getMessage(), e);
        }
    }

    /// Deserializes a definition from a JSON stream. The stream is not closed.
    ///
    /// @param in JSON input, not null
    /// @return deserialized definition, never null
    /// @throws IllegalArgumentException if the JSON cannot be read or has the wrong shape
    public static WorkflowDefinition fromJson(InputStream in) {
        try {
            return createMapper().readValue(in, WorkflowDefinition.class);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow definition: " + e.getMessage(), e);
        }
    }

    /// Serializes an execution plan to pretty-printed JSON.
    ///
    /// @param plan the plan to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String planToJson(ExecutionPlan plan) {
        try {
            return createMapper().writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize execution plan: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for definitions and plans.
    ///
    /// Registers:
    /// - `PlanwrightJacksonModule` for the definition builder and the plan writer
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled, so editor-only fields are skipped
    /// - null properties omitted on write
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new PlanwrightJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);
    }
}
