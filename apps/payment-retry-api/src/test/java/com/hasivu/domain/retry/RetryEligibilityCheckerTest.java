package com.hasivu.domain.retry;

import com.hasivu.domain.payment.PaymentRepository;
import com.hasivu.domain.payment.PaymentStatus;
import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RetryEligibilityChecker 테스트.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RetryEligibilityChecker")
class RetryEligibilityCheckerTest {

    private static final Long PAYMENT_ID = RetryTestFixture.PAYMENT_ID;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private RetryAttemptRepository retryAttemptRepository;

    private RetryEligibilityChecker checker;

    @BeforeEach
    void setUp() {
        checker = new RetryEligibilityChecker(paymentRepository, retryAttemptRepository, RetryProperties.defaults());
    }

    @DisplayName("재시도 불가")
    @Nested
    class WhenIneligible {
        @DisplayName("결제가 없으면 PAYMENT_NOT_FOUND이고 NOT_FOUND 예외로 변환된다.")
        @Test
        void paymentNotFound() {
            // arrange
            when(paymentRepository.findById(PAYMENT_ID)).thenReturn(Optional.empty());

            // act
            RetryEligibility result = checker.check(PAYMENT_ID);

            // assert
            assertThat(result.canRetry()).isFalse();
            RetryEligibility.Ineligible ineligible = (RetryEligibility.Ineligible) result;
            assertThat(ineligible.reason()).isEqualTo(RetryEligibility.Reason.PAYMENT_NOT_FOUND);
            CoreException exception = ineligible.toException();
            assertThat(exception.getErrorType()).isEqualTo(ErrorType.NOT_FOUND);
            assertThat(exception.getMessage()).isEqualTo("Payment not found");
        }

        @DisplayName("완료된 결제는 재시도할 수 없다.")
        @Test
        void paymentCompleted() {
            // arrange
            when(paymentRepository.findById(PAYMENT_ID))
                .thenReturn(Optional.of(RetryTestFixture.payment(PaymentStatus.COMPLETED)));

            // act
            RetryEligibility result = checker.check(PAYMENT_ID);

            // assert
            RetryEligibility.Ineligible ineligible = (RetryEligibility.Ineligible) result;
            assertThat(ineligible.reason()).isEqualTo(RetryEligibility.Reason.PAYMENT_COMPLETED);
            assertThat(ineligible.message()).isEqualTo("Payment already completed");
            assertThat(ineligible.toException().getErrorType()).isEqualTo(ErrorType.RETRY_NOT_ALLOWED);
            verify(retryAttemptRepository, never()).countActiveByPaymentId(PAYMENT_ID);
        }

        @DisplayName("취소된 결제는 재시도할 수 없다.")
        @Test
        void paymentCancelled() {
            // arrange
            when(paymentRepository.findById(PAYMENT_ID))
                .thenReturn(Optional.of(RetryTestFixture.payment(PaymentStatus.CANCELLED)));

            // act
            RetryEligibility.Ineligible result = (RetryEligibility.Ineligible) checker.check(PAYMENT_ID);

            // assert
            assertThat(result.message()).isEqualTo("Payment was cancelled");
        }

        @DisplayName("취소되지 않은 재시도가 5건이면 최대 재시도 초과이다.")
        @Test
        void maxRetriesExceeded() {
            // arrange
            when(paymentRepository.findById(PAYMENT_ID))
                .thenReturn(Optional.of(RetryTestFixture.payment(PaymentStatus.FAILED)));
            when(retryAttemptRepository.countActiveByPaymentId(PAYMENT_ID)).thenReturn(5L);

            // act
            RetryEligibility.Ineligible result = (RetryEligibility.Ineligible) checker.check(PAYMENT_ID);

            // assert
            assertThat(result.reason()).isEqualTo(RetryEligibility.Reason.MAX_RETRIES_EXCEEDED);
            assertThat(result.message()).isEqualTo("Maximum retry attempts (5) exceeded. Current attempts: 5");
        }

        @DisplayName("이미 예약된 재시도가 있으면 재시도할 수 없다.")
        @Test
        void retryAlreadyScheduled() {
            // arrange
            when(paymentRepository.findById(PAYMENT_ID))
                .thenReturn(Optional.of(RetryTestFixture.payment(PaymentStatus.FAILED)));
            when(retryAttemptRepository.countActiveByPaymentId(PAYMENT_ID)).thenReturn(1L);
            when(retryAttemptRepository.existsByPaymentIdAndStatus(PAYMENT_ID, RetryStatus.SCHEDULED)).thenReturn(true);

            // act
            RetryEligibility.Ineligible result = (RetryEligibility.Ineligible) checker.check(PAYMENT_ID);

            // assert
            assertThat(result.reason()).isEqualTo(RetryEligibility.Reason.RETRY_ALREADY_SCHEDULED);
            assertThat(result.message()).isEqualTo("Payment retry already scheduled");
        }
    }

    @DisplayName("재시도 가능")
    @Nested
    class WhenEligible {
        @DisplayName("실패한 결제이고 예약된 재시도가 없으면 현재 시도 수와 함께 가능하다.")
        @Test
        void eligibleWithCurrentAttempts() {
            // arrange
            when(paymentRepository.findById(PAYMENT_ID))
                .thenReturn(Optional.of(RetryTestFixture.payment(PaymentStatus.FAILED)));
            when(retryAttemptRepository.countActiveByPaymentId(PAYMENT_ID)).thenReturn(2L);
            when(retryAttemptRepository.existsByPaymentIdAndStatus(PAYMENT_ID, RetryStatus.SCHEDULED)).thenReturn(false);

            // act
            RetryEligibility result = checker.check(PAYMENT_ID);

            // assert
            assertThat(result).isEqualTo(new RetryEligibility.Eligible(5, 2L));
        }

        @DisplayName("같은 상태에서 반복 호출하면 같은 결과를 돌려준다.")
        @Test
        void idempotent() {
            // arrange
            when(paymentRepository.findById(PAYMENT_ID))
                .thenReturn(Optional.of(RetryTestFixture.payment(PaymentStatus.PENDING)));
            when(retryAttemptRepository.countActiveByPaymentId(PAYMENT_ID)).thenReturn(0L);
            when(retryAttemptRepository.existsByPaymentIdAndStatus(PAYMENT_ID, RetryStatus.SCHEDULED)).thenReturn(false);

            // act
            RetryEligibility first = checker.check(PAYMENT_ID);
            RetryEligibility second = checker.check(PAYMENT_ID);

            // assert
            assertThat(first).isEqualTo(second);
            assertThat(first.canRetry()).isTrue();
        }
    }
}
