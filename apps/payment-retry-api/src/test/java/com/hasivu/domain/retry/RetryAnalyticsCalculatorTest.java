package com.hasivu.domain.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryAnalyticsCalculator")
class RetryAnalyticsCalculatorTest {

    private final RetryAnalyticsCalculator calculator = new RetryAnalyticsCalculator(RetryProperties.defaults());

    @DisplayName("재시도가 없으면 모든 값이 0이다.")
    @Test
    void emptyHistory() {
        RetryAnalytics result = calculator.calculate(List.of());

        assertThat(result.totalRetries()).isZero();
        assertThat(result.successRate()).isZero();
        assertThat(result.commonFailureReasons()).isEmpty();
    }

    @DisplayName("성공률은 완료 건수 비율을 반올림한 값이다.")
    @Test
    void successRate() {
        // arrange
        List<RetryAttempt> attempts = List.of(
            RetryTestFixture.attempt(1L, 1, RetryStatus.COMPLETED),
            RetryTestFixture.attempt(2L, 2, RetryStatus.FAILED, "timeout"),
            RetryTestFixture.attempt(3L, 3, RetryStatus.CANCELLED, "Cancelled by user")
        );

        // act
        RetryAnalytics result = calculator.calculate(attempts);

        // assert
        assertThat(result.totalRetries()).isEqualTo(3);
        assertThat(result.successfulRetries()).isEqualTo(1);
        assertThat(result.failedRetries()).isEqualTo(1);
        assertThat(result.successRate()).isEqualTo(33);
    }

    @DisplayName("실패 사유는 건수 내림차순이며, 동률이면 먼저 나온 사유가 앞에 온다.")
    @Test
    void failureReasonHistogram() {
        // arrange
        List<RetryAttempt> attempts = List.of(
            RetryTestFixture.failed(1L, "declined"),
            RetryTestFixture.failed(2L, "timeout"),
            RetryTestFixture.failed(3L, "timeout"),
            RetryTestFixture.failed(4L, null),
            RetryTestFixture.failed(5L, "insufficient funds"),
            RetryTestFixture.failed(6L, "declined")
        );

        // act
        RetryAnalytics result = calculator.calculate(attempts);

        // assert
        assertThat(result.commonFailureReasons())
            .extracting(RetryAnalytics.FailureReason::reason)
            .containsExactly("declined", "timeout", "Unknown", "insufficient funds");
        assertThat(result.commonFailureReasons().get(0).count()).isEqualTo(2);
        assertThat(result.commonFailureReasons().get(0).percentage()).isEqualTo(33);
        assertThat(result.commonFailureReasons().get(2).percentage()).isEqualTo(17);
    }

    @DisplayName("실패 사유는 상위 5개만 노출된다.")
    @Test
    void topFiveReasons() {
        List<RetryAttempt> attempts = List.of(
            RetryTestFixture.failed(1L, "a"),
            RetryTestFixture.failed(2L, "b"),
            RetryTestFixture.failed(3L, "c"),
            RetryTestFixture.failed(4L, "d"),
            RetryTestFixture.failed(5L, "e"),
            RetryTestFixture.failed(6L, "f")
        );

        RetryAnalytics result = calculator.calculate(attempts);

        assertThat(result.commonFailureReasons()).hasSize(5);
        assertThat(result.commonFailureReasons()).extracting(RetryAnalytics.FailureReason::reason)
            .containsExactly("a", "b", "c", "d", "e");
    }
}
