package io.planwright.core.workflow.node;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NodeCategoryTest {

    @Nested
    class Categories {

        @ParameterizedTest
        @CsvSource({
            "llm, LLM",
            "imageGeneration, LLM",
            "webhook, HTTP",
            "database, INTEGRATION",
            "agentCall, AGENT",
            "switch, LOGIC",
            "router, LOGIC",
            "forEach, LOOP",
            "FOREACH, LOOP",
            "parallel, PARALLEL",
            "loop-sentinel, SENTINEL",
            "transform, STANDARD"
        })
        void shouldResolveCategory(String type, NodeCategory expected) {
            assertThat(NodeCategory.of(type)).isEqualTo(expected);
        }

        @Test
        void shouldTreatNullAsStandard() {
            assertThat(NodeCategory.of(null)).isEqualTo(NodeCategory.STANDARD);
        }

        @Test
        void shouldExposeErrorPortsOnlyForFallibleCategories() {
            assertThat(NodeCategory.LLM.hasErrorPort()).isTrue();
            assertThat(NodeCategory.HTTP.hasErrorPort()).isTrue();
            assertThat(NodeCategory.LOGIC.hasErrorPort()).isFalse();
            assertThat(NodeCategory.STANDARD.hasErrorPort()).isFalse();
        }

        @Test
        void shouldDistinguishConditionalsFromRouters() {
            assertThat(NodeCategory.isConditional("If")).isTrue();
            assertThat(NodeCategory.isConditional("switch")).isFalse();
            assertThat(NodeCategory.isRouter("router")).isTrue();
            assertThat(NodeCategory.isRouter("conditional")).isFalse();
        }
    }

    @Nested
    class LoopTypes {

        @Test
        void shouldMapLoopNodeTypes() {
            assertThat(LoopType.fromNodeType("loop")).isEqualTo(LoopType.FOR);
            assertThat(LoopType.fromNodeType("for")).isEqualTo(LoopType.FOR);
            assertThat(LoopType.fromNodeType("forEach")).isEqualTo(LoopType.FOR_EACH);
            assertThat(LoopType.fromNodeType("while")).isEqualTo(LoopType.WHILE);
            assertThat(LoopType.fromNodeType("doWhile")).isEqualTo(LoopType.DO_WHILE);
            assertThat(LoopType.fromNodeType(null)).isEqualTo(LoopType.FOR);
        }
    }

    @Nested
    class Aggregations {

        @Test
        void shouldParseKnownValuesIgnoringCase() {
            assertThat(ParallelAggregation.parse("Race")).contains(ParallelAggregation.RACE);
            assertThat(ParallelAggregation.parse("all")).contains(ParallelAggregation.ALL);
        }

        @Test
        void shouldRejectUnknownOrNonStringValues() {
            assertThat(ParallelAggregation.parse("majority")).isEmpty();
            assertThat(ParallelAggregation.parse(3)).isEmpty();
            assertThat(ParallelAggregation.parse(null)).isEmpty();
        }
    }
}
