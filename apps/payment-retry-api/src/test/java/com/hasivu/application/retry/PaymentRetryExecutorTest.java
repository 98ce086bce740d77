package com.hasivu.application.retry;

import com.hasivu.domain.payment.Payment;
import com.hasivu.domain.payment.PaymentGateway;
import com.hasivu.domain.payment.PaymentOrderCommand;
import com.hasivu.domain.payment.PaymentOrderResult;
import com.hasivu.domain.payment.PaymentService;
import com.hasivu.domain.payment.PaymentStatus;
import com.hasivu.domain.retry.RetryAttempt;
import com.hasivu.domain.retry.RetryAttemptService;
import com.hasivu.domain.retry.RetryStatus;
import com.hasivu.domain.retry.RetryTestFixture;
import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PaymentRetryExecutor 테스트.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentRetryExecutor")
class PaymentRetryExecutorTest {

    private static final Long RETRY_ID = 1L;
    private static final Long PAYMENT_ID = RetryTestFixture.PAYMENT_ID;
    private static final Instant NOW = Instant.parse("2025-12-01T01:00:00Z");
    private static final RetryActor ACTOR = new RetryActor("admin-1", "admin@hasivu.com", "ADMIN");

    @Mock
    private RetryAttemptService retryAttemptService;

    @Mock
    private PaymentService paymentService;

    @Mock
    private PaymentGateway paymentGateway;

    private PaymentRetryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new PaymentRetryExecutor(
            retryAttemptService, paymentService, paymentGateway, Clock.fixed(NOW, ZoneId.of("Asia/Seoul")));
    }

    private void givenScheduledAttemptMovesToProcessing() {
        when(retryAttemptService.get(RETRY_ID)).thenReturn(RetryTestFixture.attempt(RETRY_ID, 1, RetryStatus.SCHEDULED));
        when(retryAttemptService.updateStatus(RETRY_ID, RetryStatus.PROCESSING, null))
            .thenReturn(RetryTestFixture.attempt(RETRY_ID, 1, RetryStatus.PROCESSING));
    }

    @DisplayName("게이트웨이 성공")
    @Nested
    class GatewaySuccess {
        @DisplayName("새 게이트웨이 주문을 결제에 반영하고 재시도를 COMPLETED로 바꾼다.")
        @Test
        void completesAttempt() {
            // arrange
            givenScheduledAttemptMovesToProcessing();
            Payment payment = RetryTestFixture.payment(PaymentStatus.FAILED);
            when(paymentService.findById(PAYMENT_ID)).thenReturn(payment);
            when(paymentGateway.createOrder(any(PaymentOrderCommand.class)))
                .thenReturn(new PaymentOrderResult.Success("order_N1"));
            when(paymentService.applyRetryOrder(PAYMENT_ID, "order_N1")).thenReturn(payment);
            when(retryAttemptService.updateStatus(RETRY_ID, RetryStatus.COMPLETED, null))
                .thenReturn(RetryTestFixture.attempt(RETRY_ID, 1, RetryStatus.COMPLETED));

            // act
            RetryExecutionInfo result = executor.execute(RETRY_ID, ACTOR);

            // assert
            assertThat(result.retryId()).isEqualTo(RETRY_ID);
            assertThat(result.paymentId()).isEqualTo(PAYMENT_ID);
            assertThat(result.gatewayOrderId()).isEqualTo("order_N1");
            assertThat(result.status()).isEqualTo(RetryStatus.COMPLETED);
            assertThat(result.amount()).isEqualByComparingTo(RetryTestFixture.AMOUNT);
            assertThat(result.currency()).isEqualTo("INR");
        }

        @DisplayName("최소 단위 금액, 영수증, 원 결제 메타데이터로 주문을 만든다.")
        @Test
        void buildsOrderCommand() {
            // arrange
            givenScheduledAttemptMovesToProcessing();
            Payment payment = RetryTestFixture.payment(PaymentStatus.FAILED);
            when(paymentService.findById(PAYMENT_ID)).thenReturn(payment);
            when(paymentGateway.createOrder(any(PaymentOrderCommand.class)))
                .thenReturn(new PaymentOrderResult.Success("order_N1"));
            when(paymentService.applyRetryOrder(PAYMENT_ID, "order_N1")).thenReturn(payment);
            when(retryAttemptService.updateStatus(RETRY_ID, RetryStatus.COMPLETED, null))
                .thenReturn(RetryTestFixture.attempt(RETRY_ID, 1, RetryStatus.COMPLETED));

            // act
            executor.execute(RETRY_ID, ACTOR);

            // assert
            ArgumentCaptor<PaymentOrderCommand> captor = ArgumentCaptor.forClass(PaymentOrderCommand.class);
            verify(paymentGateway).createOrder(captor.capture());
            PaymentOrderCommand command = captor.getValue();
            assertThat(command.amount()).isEqualTo(49999L);
            assertThat(command.currency()).isEqualTo("INR");
            assertThat(command.receipt()).isEqualTo("retry_" + PAYMENT_ID + "_" + NOW.toEpochMilli());
            assertThat(command.metadata())
                .containsEntry("originalPaymentId", String.valueOf(PAYMENT_ID))
                .containsEntry("retryId", String.valueOf(RETRY_ID))
                .containsEntry("retryAttempt", "1");
        }
    }

    @DisplayName("게이트웨이 실패")
    @Nested
    class GatewayFailure {
        @DisplayName("실패 메시지를 기록하고 재시도를 FAILED로 바꾼 뒤 GATEWAY_ERROR 예외를 던진다.")
        @Test
        void failsAttempt() {
            // arrange
            givenScheduledAttemptMovesToProcessing();
            when(paymentService.findById(PAYMENT_ID)).thenReturn(RetryTestFixture.payment(PaymentStatus.FAILED));
            when(paymentGateway.createOrder(any(PaymentOrderCommand.class)))
                .thenReturn(new PaymentOrderResult.Failure("TIMEOUT", "Read timed out", true));

            // act
            CoreException result = assertThrows(CoreException.class, () -> executor.execute(RETRY_ID, ACTOR));

            // assert
            assertThat(result.getErrorType()).isEqualTo(ErrorType.GATEWAY_ERROR);
            assertThat(result.getMessage()).isEqualTo("Read timed out");
            verify(retryAttemptService).updateStatus(RETRY_ID, RetryStatus.FAILED, "Read timed out");
            verify(paymentService, never()).applyRetryOrder(any(), any());
        }

        @DisplayName("결제 반영에 실패하면 재시도를 FAILED로 바꾸고 원래 예외를 전파한다.")
        @Test
        void failsWhenPaymentUpdateFails() {
            // arrange
            givenScheduledAttemptMovesToProcessing();
            when(paymentService.findById(PAYMENT_ID)).thenReturn(RetryTestFixture.payment(PaymentStatus.FAILED));
            when(paymentGateway.createOrder(any(PaymentOrderCommand.class)))
                .thenReturn(new PaymentOrderResult.Success("order_N1"));
            when(paymentService.applyRetryOrder(PAYMENT_ID, "order_N1"))
                .thenThrow(new CoreException(ErrorType.INVALID_STATE, "Payment is already completed"));

            // act
            CoreException result = assertThrows(CoreException.class, () -> executor.execute(RETRY_ID, ACTOR));

            // assert
            assertThat(result.getErrorType()).isEqualTo(ErrorType.INVALID_STATE);
            verify(retryAttemptService).updateStatus(RETRY_ID, RetryStatus.FAILED, "Payment is already completed");
            verify(retryAttemptService, never()).updateStatus(RETRY_ID, RetryStatus.COMPLETED, null);
        }
    }

    @DisplayName("실행 거부")
    @Nested
    class Rejected {
        @DisplayName("SCHEDULED가 아닌 재시도는 INVALID_STATE 예외가 발생하고 게이트웨이를 호출하지 않는다.")
        @Test
        void notScheduled() {
            // arrange
            RetryAttempt processing = RetryTestFixture.attempt(RETRY_ID, 1, RetryStatus.PROCESSING);
            when(retryAttemptService.get(RETRY_ID)).thenReturn(processing);

            // act
            CoreException result = assertThrows(CoreException.class, () -> executor.execute(RETRY_ID, ACTOR));

            // assert
            assertThat(result.getErrorType()).isEqualTo(ErrorType.INVALID_STATE);
            assertThat(result.getMessage()).isEqualTo("Retry attempt is not in scheduled status");
            verify(paymentGateway, never()).createOrder(any());
        }

        @DisplayName("PROCESSING 전이에서 다른 실행에 밀리면 게이트웨이를 호출하지 않는다.")
        @Test
        void lostProcessingRace() {
            // arrange
            when(retryAttemptService.get(RETRY_ID)).thenReturn(RetryTestFixture.attempt(RETRY_ID, 1, RetryStatus.SCHEDULED));
            when(retryAttemptService.updateStatus(RETRY_ID, RetryStatus.PROCESSING, null))
                .thenThrow(new CoreException(ErrorType.INVALID_STATE, "Retry attempt is no longer scheduled"));

            // act
            CoreException result = assertThrows(CoreException.class, () -> executor.execute(RETRY_ID, ACTOR));

            // assert
            assertThat(result.getErrorType()).isEqualTo(ErrorType.INVALID_STATE);
            verify(paymentGateway, never()).createOrder(any());
            verify(retryAttemptService, never()).updateStatus(eq(RETRY_ID), eq(RetryStatus.FAILED), any());
        }
    }
}
