package com.hasivu.domain.retry;

import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("RetryAttempt")
class RetryAttemptTest {

    @DisplayName("재시도 생성")
    @Nested
    class Create {
        @DisplayName("SCHEDULED 상태로 생성된다.")
        @Test
        void createsScheduledAttempt() {
            // act
            RetryAttempt attempt = RetryAttempt.scheduled(
                RetryTestFixture.PAYMENT_ID, 1, RetryTestFixture.REASON, RetryMethod.MANUAL, RetryTestFixture.NOW);

            // assert
            assertThat(attempt.getStatus()).isEqualTo(RetryStatus.SCHEDULED);
            assertThat(attempt.getAttemptNumber()).isEqualTo(1);
            assertThat(attempt.getMethod()).isEqualTo(RetryMethod.MANUAL);
            assertThat(attempt.getRetryAt()).isEqualTo(RetryTestFixture.NOW);
            assertThat(attempt.getFailureReason()).isNull();
            assertThat(attempt.isScheduled()).isTrue();
        }

        @DisplayName("시도 번호가 1 미만이면 BAD_REQUEST 예외가 발생한다.")
        @Test
        void rejectsZeroAttemptNumber() {
            CoreException result = assertThrows(CoreException.class, () -> RetryAttempt.scheduled(
                RetryTestFixture.PAYMENT_ID, 0, RetryTestFixture.REASON, RetryMethod.MANUAL, RetryTestFixture.NOW));

            assertThat(result.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
        }

        @DisplayName("사유가 비어 있거나 500자를 넘으면 BAD_REQUEST 예외가 발생한다.")
        @Test
        void rejectsInvalidReason() {
            CoreException blank = assertThrows(CoreException.class, () -> RetryAttempt.scheduled(
                RetryTestFixture.PAYMENT_ID, 1, " ", RetryMethod.MANUAL, RetryTestFixture.NOW));
            CoreException tooLong = assertThrows(CoreException.class, () -> RetryAttempt.scheduled(
                RetryTestFixture.PAYMENT_ID, 1, "a".repeat(501), RetryMethod.MANUAL, RetryTestFixture.NOW));

            assertThat(blank.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
            assertThat(tooLong.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
        }
    }

    @DisplayName("실패 사유는 1000자로 잘린다.")
    @Test
    void truncatesFailureReason() {
        assertThat(RetryAttempt.truncateFailureReason("x".repeat(1500))).hasSize(1000);
        assertThat(RetryAttempt.truncateFailureReason("timeout")).isEqualTo("timeout");
        assertThat(RetryAttempt.truncateFailureReason(null)).isNull();
    }
}
