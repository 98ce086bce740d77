package com.hasivu.domain.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryStatus 상태 전이")
class RetryStatusTest {

    @DisplayName("SCHEDULED는 PROCESSING 또는 CANCELLED로만 전이할 수 있다.")
    @Test
    void scheduledTransitions() {
        assertThat(RetryStatus.SCHEDULED.canTransitionTo(RetryStatus.PROCESSING)).isTrue();
        assertThat(RetryStatus.SCHEDULED.canTransitionTo(RetryStatus.CANCELLED)).isTrue();
        assertThat(RetryStatus.SCHEDULED.canTransitionTo(RetryStatus.COMPLETED)).isFalse();
        assertThat(RetryStatus.SCHEDULED.canTransitionTo(RetryStatus.FAILED)).isFalse();
        assertThat(RetryStatus.SCHEDULED.canTransitionTo(RetryStatus.SCHEDULED)).isFalse();
    }

    @DisplayName("PROCESSING은 COMPLETED 또는 FAILED로만 전이할 수 있다.")
    @Test
    void processingTransitions() {
        assertThat(RetryStatus.PROCESSING.canTransitionTo(RetryStatus.COMPLETED)).isTrue();
        assertThat(RetryStatus.PROCESSING.canTransitionTo(RetryStatus.FAILED)).isTrue();
        assertThat(RetryStatus.PROCESSING.canTransitionTo(RetryStatus.CANCELLED)).isFalse();
        assertThat(RetryStatus.PROCESSING.canTransitionTo(RetryStatus.SCHEDULED)).isFalse();
    }

    @DisplayName("종결 상태에서는 어떤 상태로도 전이할 수 없다.")
    @Test
    void terminalStatesHaveNoTransitions() {
        for (RetryStatus terminal : List.of(RetryStatus.COMPLETED, RetryStatus.FAILED, RetryStatus.CANCELLED)) {
            assertThat(terminal.isTerminal()).isTrue();
            for (RetryStatus next : RetryStatus.values()) {
                assertThat(terminal.canTransitionTo(next)).isFalse();
            }
        }
        assertThat(RetryStatus.SCHEDULED.isTerminal()).isFalse();
        assertThat(RetryStatus.PROCESSING.isTerminal()).isFalse();
    }

    @DisplayName("null로는 전이할 수 없다.")
    @Test
    void rejectsNullTarget() {
        assertThat(RetryStatus.SCHEDULED.canTransitionTo(null)).isFalse();
    }
}
