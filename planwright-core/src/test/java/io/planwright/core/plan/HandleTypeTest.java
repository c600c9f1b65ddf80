package io.planwright.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class HandleTypeTest {

    @Test
    void shouldOrderDominance() {
        assertThat(HandleType.ROUTER.dominates(HandleType.CONDITION)).isTrue();
        assertThat(HandleType.CONDITION.dominates(HandleType.LOOP)).isTrue();
        assertThat(HandleType.LOOP.dominates(HandleType.ERROR)).isTrue();
        assertThat(HandleType.ERROR.dominates(HandleType.SOURCE)).isTrue();
        assertThat(HandleType.SOURCE.dominates(HandleType.SOURCE)).isFalse();
        assertThat(HandleType.ERROR.dominates(HandleType.ROUTER)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(HandleType.class)
    void shouldParseOwnValue(HandleType type) {
        assertThat(HandleType.fromValue(type.value())).isEqualTo(type);
        assertThat(type.value()).isEqualTo(type.name().toLowerCase());
    }

    @Test
    void shouldRejectUnknownValue() {
        assertThatThrownBy(() -> HandleType.fromValue("fallthrough"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fallthrough");
    }
}
