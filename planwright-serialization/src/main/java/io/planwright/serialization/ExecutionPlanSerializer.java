package io.planwright.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.planwright.core.builder.BuildWarning;
import io.planwright.core.plan.ExecutableEdge;
import io.planwright.core.plan.ExecutableNode;
import io.planwright.core.plan.ExecutionPlan;
import io.planwright.core.plan.LoopBoundary;
import io.planwright.core.plan.LoopConfig;
import io.planwright.core.plan.LoopContext;
import io.planwright.core.plan.ParallelBoundary;
import io.planwright.core.plan.ParallelBranch;
import io.planwright.core.plan.ParallelContext;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Writes an `ExecutionPlan` as a JSON object.
///
/// ```
/// Field               Content
/// --------------------+----------------------------------------------------------
/// entryPoint          | entry node id
/// maxConcurrentNodes  | concurrency cap for the runtime
/// startNodes          | ids, entry point first
/// executionLevels     | array of id arrays
/// outputNodeIds       | ids
/// nodes               | id -> node (handleType, dependencies, dependents, contexts)
///                     | loopContext.sentinel is START or END on sentinel nodes
/// edges               | array; handleType lower-case, branch data when present
/// loopBoundaries      | id -> boundary; loopConfig carries a "kind" discriminator
/// parallelBoundaries  | id -> boundary with branches
/// warnings            | array of {code, message, nodeId?, edgeId?}
/// ```
///
/// The source definition is not embedded.
///
/// @implNote Package-private. Registered by {@link PlanwrightJacksonModule}.
class ExecutionPlanSerializer extends StdSerializer<ExecutionPlan> {

    @Serial private static final long serialVersionUID = 7431128896150279402L;

    ExecutionPlanSerializer() {
        super(ExecutionPlan.class);
    }

    @Override
    public void serialize(ExecutionPlan plan, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("entryPoint", plan.getEntryPoint());
        gen.writeNumberField("maxConcurrentNodes", plan.getMaxConcurrentNodes());
        writeStrings(gen, "startNodes", plan.getStartNodes());

        gen.writeArrayFieldStart("executionLevels");
        for (List<String> level : plan.getExecutionLevels()) {
            gen.writeStartArray();
            for (String nodeId : level) {
                gen.writeString(nodeId);
            }
            gen.writeEndArray();
        }
        gen.writeEndArray();
        writeStrings(gen, "outputNodeIds", plan.getOutputNodeIds());

        gen.writeObjectFieldStart("nodes");
        for (ExecutableNode node : plan.getNodes().values()) {
            gen.writeFieldName(node.getId());
            writeNode(node, gen, provider);
        }
        gen.writeEndObject();

        gen.writeArrayFieldStart("edges");
        for (ExecutableEdge edge : plan.getEdges()) {
            writeEdge(edge, gen);
        }
        gen.writeEndArray();

        gen.writeObjectFieldStart("loopBoundaries");
        for (LoopBoundary boundary : plan.getLoopBoundaries().values()) {
            gen.writeFieldName(boundary.loopNodeId());
            writeLoopBoundary(boundary, gen);
        }
        gen.writeEndObject();

        gen.writeObjectFieldStart("parallelBoundaries");
        for (ParallelBoundary boundary : plan.getParallelBoundaries().values()) {
            gen.writeFieldName(boundary.parallelNodeId());
            writeParallelBoundary(boundary, gen);
        }
        gen.writeEndObject();

        gen.writeArrayFieldStart("warnings");
        for (BuildWarning warning : plan.getWarnings()) {
            gen.writeStartObject();
            gen.writeStringField("code", warning.code().name());
            gen.writeStringField("message", warning.message());
            writeIfNotNull(gen, "nodeId", warning.nodeId());
            writeIfNotNull(gen, "edgeId", warning.edgeId());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private void writeNode(ExecutableNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        gen.writeStringField("type", node.getType());
        writeIfNotNull(gen, "name", node.getName());
        if (!node.getConfig().isEmpty()) {
            provider.defaultSerializeField("config", node.getConfig(), gen);
        }
        gen.writeObjectFieldStart("position");
        gen.writeNumberField("x", node.getPosition().x());
        gen.writeNumberField("y", node.getPosition().y());
        gen.writeEndObject();
        gen.writeStringField("handleType", node.getHandleType().value());
        gen.writeBooleanField("errorPort", node.hasErrorPort());
        gen.writeNumberField("depth", node.getDepth());
        writeStrings(gen, "dependencies", node.getDependencies());
        writeStrings(gen, "dependents", node.getDependents());

        LoopContext loopContext = node.getLoopContext();
        if (loopContext != null) {
            gen.writeObjectFieldStart("loopContext");
            gen.writeStringField("parentLoopId", loopContext.parentLoopId());
            if (loopContext.isSentinel()) {
                gen.writeStringField("sentinel", loopContext.sentinel().name());
            }
            gen.writeEndObject();
        }
        ParallelContext parallelContext = node.getParallelContext();
        if (parallelContext != null) {
            gen.writeObjectFieldStart("parallelContext");
            gen.writeStringField("parentParallelId", parallelContext.parentParallelId());
            gen.writeNumberField("branchIndex", parallelContext.branchIndex());
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }

    private void writeEdge(ExecutableEdge edge, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", edge.id());
        gen.writeStringField("source", edge.source());
        gen.writeStringField("target", edge.target());
        gen.writeStringField("handleType", edge.handleType().value());
        writeIfNotNull(gen, "sourceHandle", edge.sourceHandle());
        writeIfNotNull(gen, "targetHandle", edge.targetHandle());
        writeIfNotNull(gen, "conditionValue", edge.conditionValue());
        writeIfNotNull(gen, "routerPath", edge.routerPath());
        if (edge.synthetic()) {
            gen.writeBooleanField("synthetic", true);
        }
        gen.writeEndObject();
    }

    private void writeLoopBoundary(LoopBoundary boundary, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("loopNodeId", boundary.loopNodeId());
        gen.writeStringField("startSentinelId", boundary.startSentinelId());
        gen.writeStringField("endSentinelId", boundary.endSentinelId());
        writeStrings(gen, "bodyNodeIds", boundary.bodyNodeIds());
        gen.writeStringField("loopType", boundary.loopType().value());
        writeLoopConfig(boundary.loopConfig(), gen);
        gen.writeNumberField("maxIterations", boundary.maxIterations());
        gen.writeStringField("iterationVariable", boundary.iterationVariable());
        gen.writeStringField("itemVariable", boundary.itemVariable());
        gen.writeEndObject();
    }

    private void writeLoopConfig(LoopConfig config, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart("loopConfig");
        if (config instanceof LoopConfig.Count count) {
            gen.writeStringField("kind", "count");
            gen.writeNumberField("count", count.count());
        } else if (config instanceof LoopConfig.SourceArray array) {
            gen.writeStringField("kind", "sourceArray");
            writeIfNotNull(gen, "sourceArray", array.sourceArray());
        } else if (config instanceof LoopConfig.Condition condition) {
            gen.writeStringField("kind", "condition");
            writeIfNotNull(gen, "condition", condition.condition());
        } else {
            throw new IOException("Unknown loop config: " + config);
        }
        gen.writeEndObject();
    }

    private void writeParallelBoundary(ParallelBoundary boundary, JsonGenerator gen)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("parallelNodeId", boundary.parallelNodeId());
        gen.writeStringField("aggregation", boundary.aggregation().value());
        gen.writeArrayFieldStart("branches");
        for (ParallelBranch branch : boundary.branches()) {
            gen.writeStartObject();
            gen.writeNumberField("index", branch.index());
            writeStrings(gen, "nodeIds", branch.nodeIds());
            gen.writeStringField("startNodeId", branch.startNodeId());
            gen.writeStringField("endNodeId", branch.endNodeId());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private void writeStrings(JsonGenerator gen, String field, List<String> values)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (String value : values) {
            gen.writeString(value);
        }
        gen.writeEndArray();
    }

    private void writeIfNotNull(JsonGenerator gen, String field, String value) throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
