package io.planwright.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.planwright.core.workflow.node.NodeCategory;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutableNodeTest {

    private static ExecutableNode llm(String id) {
        return ExecutableNode.builder(id).type("llm").name(id).errorPort(true).build();
    }

    @Nested
    class Construction {

        @Test
        void shouldApplyDefaults() {
            ExecutableNode node = ExecutableNode.builder("a").type("transform").build();

            assertThat(node.getConfig()).isEmpty();
            assertThat(node.getDependencies()).isEmpty();
            assertThat(node.getDependents()).isEmpty();
            assertThat(node.getHandleType()).isEqualTo(HandleType.SOURCE);
            assertThat(node.getLoopContext()).isNull();
            assertThat(node.getParallelContext()).isNull();
            assertThat(node.hasErrorPort()).isFalse();
            assertThat(node.isTerminal()).isTrue();
            assertThat(node.isFrozen()).isFalse();
        }

        @Test
        void shouldRequireType() {
            assertThatThrownBy(() -> ExecutableNode.builder("a").build())
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        void shouldResolveCategory() {
            assertThat(llm("a").getCategory()).isEqualTo(NodeCategory.LLM);
        }

        @Test
        void shouldRecognizeSentinels() {
            ExecutableNode start =
                    ExecutableNode.builder("L__loop_start")
                            .type(NodeCategory.LOOP_SENTINEL_TYPE)
                            .config(Map.of("loopNodeId", "L", "sentinel", "start"))
                            .loopContext(new LoopContext("L", LoopContext.Sentinel.START))
                            .build();

            assertThat(start.isLoopSentinel()).isTrue();
            assertThat(start.getCategory()).isEqualTo(NodeCategory.SENTINEL);
        }
    }

    @Nested
    class Dependencies {

        @Test
        void shouldIgnoreDuplicateDependencies() {
            ExecutableNode node = llm("b");

            node.addDependency("a");
            node.addDependency("a");
            node.addDependent("c");
            node.addDependent("c");

            assertThat(node.getDependencies()).containsExactly("a");
            assertThat(node.getDependents()).containsExactly("c");
            assertThat(node.isTerminal()).isFalse();
        }

        @Test
        void shouldRemoveDependencies() {
            ExecutableNode node = llm("b");
            node.addDependency("a");
            node.addDependent("c");

            node.removeDependency("a");
            node.removeDependent("c");
            node.removeDependent("missing");

            assertThat(node.getDependencies()).isEmpty();
            assertThat(node.isTerminal()).isTrue();
        }

        @Test
        void shouldExposeReadOnlyLists() {
            ExecutableNode node = llm("b");

            assertThatThrownBy(() -> node.getDependencies().add("x"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    class Freezing {

        @Test
        void shouldRejectMutationAfterFreeze() {
            ExecutableNode node = llm("b");
            node.freeze();

            assertThatThrownBy(() -> node.addDependency("a"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Node 'b' is frozen");
            assertThatThrownBy(() -> node.setHandleType(HandleType.ERROR))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> node.setDepth(3)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void shouldAllowRepeatedFreeze() {
            ExecutableNode node = llm("b");

            node.freeze();
            node.freeze();

            assertThat(node.isFrozen()).isTrue();
        }
    }
}
