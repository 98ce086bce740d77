package com.hasivu.application.retry;

import com.hasivu.domain.payment.Payment;
import com.hasivu.domain.payment.PaymentGateway;
import com.hasivu.domain.payment.PaymentOrderCommand;
import com.hasivu.domain.payment.PaymentOrderResult;
import com.hasivu.domain.payment.PaymentService;
import com.hasivu.domain.retry.RetryAttempt;
import com.hasivu.domain.retry.RetryAttemptService;
import com.hasivu.domain.retry.RetryStatus;
import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * 결제 재시도 실행기.
 * <p>
 * SCHEDULED 상태의 재시도 한 건을 게이트웨이에 실행합니다.
 * </p>
 * <p>
 * <b>실행 순서:</b>
 * <ol>
 *   <li>SCHEDULED → PROCESSING 조건부 전이 (게이트웨이 호출 전에 커밋)</li>
 *   <li>게이트웨이 주문 생성</li>
 *   <li>성공: 결제에 게이트웨이 주문 반영 후 COMPLETED</li>
 *   <li>실패: FAILED로 기록 후 예외 전파</li>
 * </ol>
 * </p>
 * <p>
 * <b>트랜잭션 전략:</b> 이 클래스는 트랜잭션을 열지 않습니다.
 * 각 상태 전이는 {@link RetryAttemptService}에서 개별 트랜잭션으로 커밋되므로
 * 게이트웨이 호출 동안 DB 커넥션과 락을 잡고 있지 않습니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentRetryExecutor {

    private final RetryAttemptService retryAttemptService;
    private final PaymentService paymentService;
    private final PaymentGateway paymentGateway;
    private final Clock clock;

    /**
     * 재시도를 실행합니다.
     *
     * @param attemptId 재시도 ID
     * @param actor 요청자
     * @return 실행 결과
     * @throws CoreException 재시도가 없거나(NOT_FOUND), SCHEDULED가 아니거나(INVALID_STATE),
     *                       게이트웨이가 실패한 경우(GATEWAY_ERROR)
     */
    public RetryExecutionInfo execute(Long attemptId, RetryActor actor) {
        RetryAttempt attempt = retryAttemptService.get(attemptId);
        if (!attempt.isScheduled()) {
            throw new CoreException(ErrorType.INVALID_STATE, "Retry attempt is not in scheduled status");
        }

        // 동시에 실행된 다른 호출이 먼저 전이했다면 여기서 INVALID_STATE
        retryAttemptService.updateStatus(attemptId, RetryStatus.PROCESSING, null);
        log.info("결제 재시도 실행 시작. (retryId: {}, paymentId: {}, attemptNumber: {}, actor: {})",
            attemptId, attempt.getPaymentId(), attempt.getAttemptNumber(), actor.id());

        Payment payment;
        PaymentOrderResult result;
        try {
            payment = paymentService.findById(attempt.getPaymentId());
            result = paymentGateway.createOrder(toOrderCommand(payment, attempt));
        } catch (RuntimeException e) {
            markFailed(attempt, e);
            throw e;
        }

        if (result instanceof PaymentOrderResult.Failure failure) {
            log.warn("결제 재시도 게이트웨이 실패. (retryId: {}, paymentId: {}, errorCode: {}, timeout: {})",
                attemptId, attempt.getPaymentId(), failure.errorCode(), failure.isTimeout());
            markFailed(attempt, failure.message());
            throw new CoreException(ErrorType.GATEWAY_ERROR, failure.message());
        }

        String gatewayOrderId = ((PaymentOrderResult.Success) result).gatewayOrderId();
        try {
            paymentService.applyRetryOrder(payment.getId(), gatewayOrderId);
            RetryAttempt completed = retryAttemptService.updateStatus(attemptId, RetryStatus.COMPLETED, null);
            log.info("결제 재시도 완료. (retryId: {}, paymentId: {}, gatewayOrderId: {})",
                attemptId, payment.getId(), gatewayOrderId);
            return new RetryExecutionInfo(
                completed.getId(),
                completed.getPaymentId(),
                completed.getAttemptNumber(),
                gatewayOrderId,
                completed.getStatus(),
                payment.getAmount(),
                payment.getCurrency()
            );
        } catch (RuntimeException e) {
            markFailed(attempt, e);
            throw e;
        }
    }

    private PaymentOrderCommand toOrderCommand(Payment payment, RetryAttempt attempt) {
        String receipt = String.format("retry_%d_%d", payment.getId(), clock.millis());
        Map<String, String> metadata = Map.of(
            "originalPaymentId", String.valueOf(payment.getId()),
            "retryId", String.valueOf(attempt.getId()),
            "retryAttempt", String.valueOf(attempt.getAttemptNumber())
        );
        return new PaymentOrderCommand(payment.amountInMinorUnits(), payment.getCurrency(), receipt, metadata);
    }

    private void markFailed(RetryAttempt attempt, RuntimeException cause) {
        String message = cause instanceof CoreException coreException && coreException.getCustomMessage() != null
            ? coreException.getCustomMessage()
            : cause.getMessage();
        markFailed(attempt, message != null ? message : cause.getClass().getSimpleName());
    }

    private void markFailed(RetryAttempt attempt, String failureReason) {
        try {
            retryAttemptService.updateStatus(attempt.getId(), RetryStatus.FAILED, failureReason);
        } catch (RuntimeException e) {
            // 원래 오류를 전파하기 위해 기록 실패는 로그로만 남김
            log.error("결제 재시도 실패 기록 중 오류 발생. (retryId: {}, paymentId: {})",
                attempt.getId(), attempt.getPaymentId(), e);
        }
    }
}
