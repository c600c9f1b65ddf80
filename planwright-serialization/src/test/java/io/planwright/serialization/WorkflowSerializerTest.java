package io.planwright.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.planwright.core.builder.WorkflowBuilder;
import io.planwright.core.exception.WorkflowValidationException;
import io.planwright.core.plan.ExecutionPlan;
import io.planwright.core.workflow.ErrorHandling;
import io.planwright.core.workflow.NodePosition;
import io.planwright.core.workflow.WorkflowDefinition;
import io.planwright.core.workflow.WorkflowEdge;
import io.planwright.core.workflow.WorkflowNode;
import io.planwright.core.workflow.WorkflowSettings;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowSerializerTest {

    private static WorkflowDefinition fixture(String name) throws IOException {
        try (InputStream in =
                WorkflowSerializerTest.class.getResourceAsStream("/definitions/" + name)) {
            return WorkflowSerializer.fromJson(in);
        }
    }

    private static JsonNode tree(String json) throws IOException {
        return WorkflowSerializer.createMapper().readTree(json);
    }

    @Nested
    class Definitions {

        @Test
        void shouldReadFixtureInDocumentOrder() throws IOException {
            WorkflowDefinition definition = fixture("support-triage.json");

            assertThat(definition.getName()).isEqualTo("Support triage");
            assertThat(definition.getEntryPoint()).isEqualTo("start");
            assertThat(definition.getNodes().keySet())
                    .containsExactly(
                            "start", "classify", "router", "billing", "tech", "answer",
                            "fallback", "reply");
            assertThat(definition.getEdges())
                    .extracting(WorkflowEdge::id)
                    .containsExactly("e1", "e2", "e3", "e4", "e5", "e6", "e7", "e8", "e9");
            assertThat(definition.getSettings().effectiveMaxConcurrentNodes()).isEqualTo(5);
        }

        @Test
        void shouldReadNodeFields() throws IOException {
            WorkflowDefinition definition = fixture("support-triage.json");

            WorkflowNode classify = definition.getNodes().get("classify");
            assertThat(classify.type()).isEqualTo("llm");
            assertThat(classify.config()).containsEntry("model", "small");
            assertThat(classify.position()).isEqualTo(new NodePosition(200, 0));
            assertThat(classify.onError()).isEqualTo(new ErrorHandling("goto", "fallback"));
            assertThat(classify.onError().isGoto()).isTrue();
            assertThat(definition.getNodes().get("tech").config()).containsEntry("maxIterations", 20);
            assertThat(definition.getNodes().get("answer").config()).isEmpty();
        }

        @Test
        void shouldReadEdgeHandles() throws IOException {
            WorkflowDefinition definition = fixture("support-triage.json");

            assertThat(definition.getEdges().get(3))
                    .isEqualTo(new WorkflowEdge("e4", "router", "billing", "route-billing", null));
            assertThat(definition.getEdges().get(6).targetHandle()).isEqualTo("next");
        }

        @Test
        void shouldLeaveMissingEdgeListForTheBuilder() throws IOException {
            WorkflowDefinition definition = fixture("no-edges.json");

            assertThat(definition.getEdges()).isNull();
            assertThat(definition.getSettings()).isEqualTo(WorkflowSettings.DEFAULT);
            assertThatThrownBy(() -> new WorkflowBuilder().build(definition))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessage("Workflow has no edge list");
        }

        @Test
        void shouldRoundTripDefinition() {
            List<WorkflowEdge> edges = new ArrayList<>();
            edges.add(new WorkflowEdge("e1", "in", "call"));
            edges.add(new WorkflowEdge("e2", "call", "out", null, "input"));
            edges.add(new WorkflowEdge("e3", "call", "out", "error"));
            WorkflowDefinition original =
                    WorkflowDefinition.builder()
                            .name("round trip")
                            .entryPoint("in")
                            .node("in", new WorkflowNode("input", "In"))
                            .node(
                                    "call",
                                    new WorkflowNode(
                                            "http",
                                            "Call",
                                            Map.of("url", "https://example.org", "retries", 2),
                                            new NodePosition(10.5, -3),
                                            new ErrorHandling("continue", null)))
                            .node("out", new WorkflowNode("output", "Out"))
                            .edges(edges)
                            .settings(new WorkflowSettings(3))
                            .build();

            WorkflowDefinition restored = WorkflowSerializer.fromJson(WorkflowSerializer.toJson(original));

            assertThat(restored.getName()).isEqualTo("round trip");
            assertThat(restored.getEntryPoint()).isEqualTo("in");
            assertThat(restored.getNodes()).isEqualTo(original.getNodes());
            assertThat(restored.getEdges()).isEqualTo(original.getEdges());
            assertThat(restored.getSettings()).isEqualTo(original.getSettings());
        }

        @Test
        void shouldWriteOnlyDeclaredErrorHandlingFields() throws IOException {
            WorkflowDefinition definition = fixture("support-triage.json");

            JsonNode onError = tree(WorkflowSerializer.toJson(definition)).at("/nodes/classify/onError");

            assertThat(onError.has("strategy")).isTrue();
            assertThat(onError.has("targetNodeId")).isTrue();
            assertThat(onError.has("goto")).isFalse();
        }

        @Test
        void shouldOmitNullFields() throws IOException {
            WorkflowDefinition definition = fixture("support-triage.json");

            JsonNode firstEdge = tree(WorkflowSerializer.toJson(definition)).at("/edges/0");

            assertThat(firstEdge.has("sourceHandle")).isFalse();
            assertThat(firstEdge.get("target").asText()).isEqualTo("classify");
        }

        @Test
        void shouldWrapMalformedJson() {
            assertThatThrownBy(() -> WorkflowSerializer.fromJson("{\"nodes\": [}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize workflow definition");
        }

        @Test
        void shouldRejectWrongShape() {
            assertThatThrownBy(() -> WorkflowSerializer.fromJson("{\"edges\": {\"a\": 1}}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize workflow definition");
        }
    }

    @Nested
    class Plans {

        private JsonNode planTree() throws IOException {
            ExecutionPlan plan = new WorkflowBuilder().build(fixture("support-triage.json"));
            return tree(WorkflowSerializer.planToJson(plan));
        }

        @Test
        void shouldWriteSchedule() throws IOException {
            JsonNode plan = planTree();

            assertThat(plan.get("entryPoint").asText()).isEqualTo("start");
            assertThat(plan.get("maxConcurrentNodes").asInt()).isEqualTo(5);
            assertThat(plan.get("startNodes").get(0).asText()).isEqualTo("start");
            assertThat(plan.get("executionLevels")).hasSize(8);
            assertThat(plan.at("/executionLevels/2").toString())
                    .isEqualTo("[\"router\",\"fallback\"]");
            assertThat(plan.at("/executionLevels/7/0").asText()).isEqualTo("reply");
            assertThat(plan.get("outputNodeIds").toString()).isEqualTo("[\"fallback\",\"reply\"]");
            assertThat(plan.get("warnings")).isEmpty();
        }

        @Test
        void shouldWriteHandleTypesLowerCase() throws IOException {
            JsonNode plan = planTree();

            assertThat(plan.at("/nodes/classify/handleType").asText()).isEqualTo("error");
            assertThat(plan.at("/nodes/router/handleType").asText()).isEqualTo("router");
            assertThat(plan.at("/nodes/tech/handleType").asText()).isEqualTo("loop");
            assertThat(plan.at("/nodes/start/handleType").asText()).isEqualTo("source");
        }

        @Test
        void shouldWriteEdgeBranchData() throws IOException {
            JsonNode edges = planTree().get("edges");

            JsonNode billing = null;
            int synthetic = 0;
            for (JsonNode edge : edges) {
                if (edge.get("id").asText().equals("e4")) {
                    billing = edge;
                }
                if (edge.path("synthetic").asBoolean(false)) {
                    synthetic++;
                }
            }
            assertThat(billing).isNotNull();
            assertThat(billing.get("handleType").asText()).isEqualTo("router");
            assertThat(billing.get("routerPath").asText()).isEqualTo("billing");
            assertThat(synthetic).isEqualTo(4);
        }

        @Test
        void shouldWriteLoopBoundaryAndSentinels() throws IOException {
            JsonNode plan = planTree();

            JsonNode boundary = plan.at("/loopBoundaries/tech");
            assertThat(boundary.get("loopType").asText()).isEqualTo("forEach");
            assertThat(boundary.at("/loopConfig/kind").asText()).isEqualTo("sourceArray");
            assertThat(boundary.at("/loopConfig/sourceArray").asText()).isEqualTo("classify.lines");
            assertThat(boundary.get("maxIterations").asInt()).isEqualTo(20);
            assertThat(boundary.get("itemVariable").asText()).isEqualTo("line");
            assertThat(boundary.get("bodyNodeIds").toString()).isEqualTo("[\"answer\"]");

            JsonNode start = plan.at("/nodes/tech__loop_start");
            assertThat(start.get("type").asText()).isEqualTo("loop-sentinel");
            assertThat(start.at("/loopContext/sentinel").asText()).isEqualTo("START");
            assertThat(plan.at("/nodes/tech__loop_end/loopContext/sentinel").asText())
                    .isEqualTo("END");
            assertThat(plan.at("/nodes/answer/loopContext/parentLoopId").asText()).isEqualTo("tech");
            assertThat(plan.at("/nodes/answer/loopContext").has("sentinel")).isFalse();
        }

        @Test
        void shouldWriteParallelBoundaries() {
            WorkflowDefinition definition =
                    WorkflowDefinition.builder()
                            .name("fan out")
                            .entryPoint("P")
                            .node("P", new WorkflowNode("parallel", "Fan", Map.of("aggregation", "race")))
                            .node("A", new WorkflowNode("llm", "A"))
                            .node("B", new WorkflowNode("llm", "B"))
                            .edge(new WorkflowEdge("p-a", "P", "A"))
                            .edge(new WorkflowEdge("p-b", "P", "B"))
                            .build();

            String json = WorkflowSerializer.planToJson(new WorkflowBuilder().build(definition));

            assertThat(json).contains("\"aggregation\" : \"race\"");
            assertThat(json).contains("\"parentParallelId\" : \"P\"");
        }
    }
}
