package io.planwright.core.builder;

import static io.planwright.core.builder.TestWorkflows.edge;
import static io.planwright.core.builder.TestWorkflows.gotoNode;
import static io.planwright.core.builder.TestWorkflows.node;
import static io.planwright.core.builder.TestWorkflows.nodesBuilt;
import static io.planwright.core.builder.TestWorkflows.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.planwright.core.plan.ExecutableEdge;
import io.planwright.core.plan.ExecutableNode;
import io.planwright.core.plan.HandleType;
import io.planwright.core.plan.ParallelBoundary;
import io.planwright.core.plan.ParallelBranch;
import io.planwright.core.workflow.WorkflowDefinition;
import io.planwright.core.workflow.WorkflowEdge;
import io.planwright.core.workflow.node.ParallelAggregation;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("NodeConstructor")
class NodeConstructorTest {

    @Nested
    @DisplayName("node materialization")
    class Materialization {

        private final WorkflowDefinition definition =
                workflow("a")
                        .node("a", node("input"))
                        .node("b", node("llm"))
                        .node("c", node("http"))
                        .node("d", node("output"))
                        .node("island", node("llm"))
                        .edge(edge("a", "b"))
                        .edge(edge("a", "c"))
                        .edge(edge("b", "d"))
                        .edge(edge("c", "d"))
                        .edge(edge("island", "d"))
                        .build();

        @Test
        @DisplayName("materializes reachable nodes in definition order")
        void shouldMaterializeReachableNodesInDefinitionOrder() {
            ConstructionContext context = nodesBuilt(definition);

            assertThat(context.getNodes().keySet()).containsExactly("a", "b", "c", "d");
        }

        @Test
        @DisplayName("includes unreachable nodes when requested")
        void shouldIncludeUnreachableNodesWhenRequested() {
            ConstructionContext context =
                    nodesBuilt(definition, BuildOptions.defaults().withIncludeUnreachable(true));

            assertThat(context.getNodes().keySet()).containsExactly("a", "b", "c", "d", "island");
            assertThat(context.getNode("island").getDepth())
                    .isEqualTo(NodeConstructor.UNREACHABLE_DEPTH);
            assertThat(context.getNode("d").getDependencies()).containsExactly("b", "c", "island");
        }

        @Test
        @DisplayName("links only materialized nodes")
        void shouldRestrictDependenciesToMaterializedNodes() {
            ConstructionContext context = nodesBuilt(definition);

            ExecutableNode output = context.getNode("d");
            assertThat(output.getDependencies()).containsExactly("b", "c");
            assertThat(output.isTerminal()).isTrue();
            assertThat(context.getNode("a").getDependents()).containsExactly("b", "c");
            assertThat(context.getNode("a").isTerminal()).isFalse();
        }

        @Test
        @DisplayName("assigns the shortest depth")
        void shouldAssignShortestDepth() {
            ConstructionContext context = nodesBuilt(definition);

            assertThat(context.getNode("a").getDepth()).isZero();
            assertThat(context.getNode("b").getDepth()).isEqualTo(1);
            assertThat(context.getNode("d").getDepth()).isEqualTo(2);
        }

        @Test
        @DisplayName("seeds classified edges")
        void shouldSeedClassifiedEdges() {
            WorkflowDefinition branching =
                    workflow("in")
                            .node("in", node("input"))
                            .node("cond", node("conditional"))
                            .node("yes", node("output"))
                            .edge(edge("in", "cond"))
                            .edge(edge("cond", "yes", "true"))
                            .build();

            ConstructionContext context = nodesBuilt(branching);

            assertThat(context.getEdges())
                    .extracting(ExecutableEdge::handleType)
                    .containsExactly(HandleType.SOURCE, HandleType.CONDITION);
            assertThat(context.getEdges()).noneMatch(ExecutableEdge::synthetic);
        }

        @Test
        @DisplayName("never makes a node depend on itself")
        void shouldNotMakeNodeDependOnItself() {
            WorkflowDefinition selfLoop =
                    workflow("a").node("a", node("llm")).edge(edge("a", "a")).build();

            ConstructionContext context = nodesBuilt(selfLoop);

            assertThat(context.getNode("a").getDependencies()).isEmpty();
            assertThat(context.getEdges()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("error ports")
    class ErrorPorts {

        @Test
        @DisplayName("derives the error port from the node category")
        void shouldDeriveErrorPortFromCategory() {
            assertThat(NodeConstructor.hasErrorPort(node("llm"))).isTrue();
            assertThat(NodeConstructor.hasErrorPort(node("webhook"))).isTrue();
            assertThat(NodeConstructor.hasErrorPort(node("agentCall"))).isTrue();
            assertThat(NodeConstructor.hasErrorPort(node("transform"))).isFalse();
        }

        @Test
        @DisplayName("opens the error port for a goto strategy")
        void shouldHonorGotoStrategy() {
            assertThat(NodeConstructor.hasErrorPort(gotoNode("transform", "fallback"))).isTrue();
        }

        @Test
        @DisplayName("honors an explicit config flag")
        void shouldHonorExplicitConfigFlag() {
            assertThat(NodeConstructor.hasErrorPort(node("transform", Map.of("errorPort", true))))
                    .isTrue();
            assertThat(NodeConstructor.hasErrorPort(node("transform", Map.of("errorPort", "yes"))))
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("parallel expansion")
    class ParallelExpansion {

        private WorkflowDefinition fanOut(Map<String, Object> parallelConfig) {
            return workflow("in")
                    .node("in", node("input"))
                    .node("P", node("parallel", parallelConfig))
                    .node("A", node("llm"))
                    .node("B", node("http"))
                    .node("J", node("merge"))
                    .edge(edge("in", "P"))
                    .edge(edge("P", "A"))
                    .edge(edge("P", "B"))
                    .edge(edge("A", "J"))
                    .edge(edge("B", "J"))
                    .build();
        }

        @Test
        @DisplayName("creates one branch per outgoing edge")
        void shouldCreateOneBranchPerOutgoingEdge() {
            ConstructionContext context = nodesBuilt(fanOut(Map.of()));

            ParallelBoundary boundary = context.getParallelBoundaries().get("P");
            assertThat(boundary.branches()).hasSize(2);
            ParallelBranch first = boundary.branches().get(0);
            assertThat(first.index()).isZero();
            assertThat(first.nodeIds()).containsExactly("A", "J");
            assertThat(first.startNodeId()).isEqualTo("A");
            assertThat(first.endNodeId()).isEqualTo("J");
            assertThat(boundary.branches().get(1).nodeIds()).containsExactly("B", "J");
            assertThat(boundary.aggregation()).isEqualTo(ParallelAggregation.ALL);
            assertThat(context.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("keeps a branch for each of two edges to the same target")
        void shouldKeepBranchPerEdgeToSameTarget() {
            WorkflowDefinition twice =
                    workflow("P")
                            .node("P", node("parallel"))
                            .node("A", node("llm"))
                            .node("B", node("llm"))
                            .edge(new WorkflowEdge("p-a-1", "P", "A"))
                            .edge(new WorkflowEdge("p-a-2", "P", "A"))
                            .edge(new WorkflowEdge("p-b", "P", "B"))
                            .build();

            ConstructionContext context = nodesBuilt(twice);

            assertThat(context.getParallelBoundaries().get("P").branches())
                    .extracting(ParallelBranch::index, ParallelBranch::startNodeId)
                    .containsExactly(tuple(0, "A"), tuple(1, "A"), tuple(2, "B"));
            assertThat(context.getNode("A").getParallelContext().branchIndex()).isZero();
        }

        @Test
        @DisplayName("ends a branch that never leaves itself at its last visited node")
        void shouldEndCyclicBranchAtLastVisitedNode() {
            WorkflowDefinition cyclicBranch =
                    workflow("P")
                            .node("P", node("parallel"))
                            .node("A", node("llm"))
                            .node("C", node("llm"))
                            .node("B", node("http"))
                            .edge(edge("P", "A"))
                            .edge(edge("P", "B"))
                            .edge(edge("A", "C"))
                            .edge(edge("C", "A"))
                            .build();

            ConstructionContext context = nodesBuilt(cyclicBranch);

            ParallelBranch first = context.getParallelBoundaries().get("P").branches().get(0);
            assertThat(first.nodeIds()).containsExactly("A", "C");
            assertThat(first.endNodeId()).isEqualTo("C");
            assertThat(context.getParallelBoundaries().get("P").branches().get(1).endNodeId())
                    .isEqualTo("B");
        }

        @Test
        @DisplayName("keeps the first parallel context where branches meet")
        void shouldKeepFirstParallelContextAtReconvergence() {
            ConstructionContext context = nodesBuilt(fanOut(Map.of()));

            assertThat(context.getNode("A").getParallelContext().branchIndex()).isZero();
            assertThat(context.getNode("B").getParallelContext().branchIndex()).isEqualTo(1);
            assertThat(context.getNode("J").getParallelContext().branchIndex()).isZero();
            assertThat(context.getNode("P").getParallelContext()).isNull();
        }

        @Test
        @DisplayName("keeps the parallel node out of its branches")
        void shouldExcludeParallelNodeFromBranches() {
            WorkflowDefinition backEdge =
                    workflow("P")
                            .node("P", node("parallel"))
                            .node("A", node("llm"))
                            .node("B", node("llm"))
                            .edge(edge("P", "A"))
                            .edge(edge("P", "B"))
                            .edge(edge("A", "P"))
                            .build();

            ConstructionContext context = nodesBuilt(backEdge);

            assertThat(context.getParallelBoundaries().get("P").branches())
                    .flatExtracting(ParallelBranch::nodeIds)
                    .doesNotContain("P");
        }

        @Test
        @DisplayName("stops at a nested parallel node")
        void shouldNotEnterNestedParallelNode() {
            WorkflowDefinition nested =
                    workflow("P")
                            .node("P", node("parallel"))
                            .node("A", node("llm"))
                            .node("B", node("llm"))
                            .node("P2", node("parallel"))
                            .node("X", node("llm"))
                            .edge(edge("P", "A"))
                            .edge(edge("P", "B"))
                            .edge(edge("A", "P2"))
                            .edge(edge("P2", "X"))
                            .build();

            ConstructionContext context = nodesBuilt(nested);

            ParallelBranch first = context.getParallelBoundaries().get("P").branches().get(0);
            assertThat(first.nodeIds()).containsExactly("A");
            assertThat(first.endNodeId()).isEqualTo("A");
        }

        @Test
        @DisplayName("reads the aggregation mode")
        void shouldReadAggregation() {
            ConstructionContext context = nodesBuilt(fanOut(Map.of("aggregation", "race")));

            assertThat(context.getParallelBoundaries().get("P").aggregation())
                    .isEqualTo(ParallelAggregation.RACE);
        }

        @Test
        @DisplayName("warns on an unknown aggregation mode")
        void shouldWarnOnUnknownAggregation() {
            ConstructionContext context = nodesBuilt(fanOut(Map.of("aggregation", "majority")));

            assertThat(context.getParallelBoundaries().get("P").aggregation())
                    .isEqualTo(ParallelAggregation.ALL);
            assertThat(context.getWarnings())
                    .extracting(BuildWarning::code)
                    .containsExactly(WarningCode.PARALLEL_INVALID_AGGREGATION);
        }

        @Test
        @DisplayName("warns on an invalid branch config")
        void shouldWarnOnInvalidBranchConfig() {
            ConstructionContext context = nodesBuilt(fanOut(Map.of("branches", List.of())));

            assertThat(context.getWarnings())
                    .extracting(BuildWarning::code)
                    .containsExactly(WarningCode.PARALLEL_INVALID_BRANCH_CONFIG);
        }

        @Test
        @DisplayName("warns but builds a single branch")
        void shouldWarnButBuildSingleBranch() {
            WorkflowDefinition single =
                    workflow("P")
                            .node("P", node("parallel"))
                            .node("A", node("llm"))
                            .edge(edge("P", "A"))
                            .build();

            ConstructionContext context = nodesBuilt(single);

            assertThat(context.getParallelBoundaries().get("P").branchCount()).isEqualTo(1);
            assertThat(context.getWarnings())
                    .extracting(BuildWarning::code)
                    .containsExactly(WarningCode.PARALLEL_FEW_BRANCHES);
        }

        @Test
        @DisplayName("warns and builds no boundary without branches")
        void shouldWarnWithoutBoundaryWhenNoBranches() {
            WorkflowDefinition empty =
                    workflow("in")
                            .node("in", node("input"))
                            .node("P", node("parallel"))
                            .edge(edge("in", "P"))
                            .build();

            ConstructionContext context = nodesBuilt(empty);

            assertThat(context.getParallelBoundaries()).isEmpty();
            assertThat(context.getWarnings())
                    .extracting(BuildWarning::code)
                    .containsExactly(WarningCode.PARALLEL_NO_BRANCHES);
        }
    }
}
