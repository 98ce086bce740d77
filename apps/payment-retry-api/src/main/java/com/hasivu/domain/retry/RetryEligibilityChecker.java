package com.hasivu.domain.retry;

import com.hasivu.domain.payment.Payment;
import com.hasivu.domain.payment.PaymentRepository;
import com.hasivu.domain.payment.PaymentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 재시도 가능 여부 판정 도메인 서비스.
 * <p>
 * 결제 상태와 재시도 이력으로 새 재시도를 만들 수 있는지 판정합니다.
 * 규칙은 아래 순서로 평가하며 처음 일치하는 규칙이 결과가 됩니다.
 * <ol>
 *   <li>결제 없음</li>
 *   <li>결제 완료</li>
 *   <li>결제 취소</li>
 *   <li>취소되지 않은 재시도 수가 최대치 이상</li>
 *   <li>SCHEDULED 재시도가 이미 존재 (결제당 하나만 허용)</li>
 * </ol>
 * 읽기 전용이며 같은 상태에서 반복 호출하면 같은 결과를 돌려줍니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Component
@RequiredArgsConstructor
public class RetryEligibilityChecker {

    private final PaymentRepository paymentRepository;
    private final RetryAttemptRepository retryAttemptRepository;
    private final RetryProperties retryProperties;

    /**
     * 결제의 재시도 가능 여부를 판정합니다.
     *
     * @param paymentId 결제 ID
     * @return 판정 결과
     */
    @Transactional(readOnly = true)
    public RetryEligibility check(Long paymentId) {
        Optional<Payment> payment = paymentId == null ? Optional.empty() : paymentRepository.findById(paymentId);
        if (payment.isEmpty()) {
            return new RetryEligibility.Ineligible(RetryEligibility.Reason.PAYMENT_NOT_FOUND, "Payment not found");
        }

        PaymentStatus status = payment.get().getStatus();
        if (status == PaymentStatus.COMPLETED) {
            return new RetryEligibility.Ineligible(RetryEligibility.Reason.PAYMENT_COMPLETED, "Payment already completed");
        }
        if (status == PaymentStatus.CANCELLED) {
            return new RetryEligibility.Ineligible(RetryEligibility.Reason.PAYMENT_CANCELLED, "Payment was cancelled");
        }

        int maxAttempts = retryProperties.maxAttempts();
        long currentAttempts = retryAttemptRepository.countActiveByPaymentId(paymentId);
        if (currentAttempts >= maxAttempts) {
            return new RetryEligibility.Ineligible(
                RetryEligibility.Reason.MAX_RETRIES_EXCEEDED,
                String.format("Maximum retry attempts (%d) exceeded. Current attempts: %d", maxAttempts, currentAttempts)
            );
        }

        if (retryAttemptRepository.existsByPaymentIdAndStatus(paymentId, RetryStatus.SCHEDULED)) {
            return new RetryEligibility.Ineligible(
                RetryEligibility.Reason.RETRY_ALREADY_SCHEDULED, "Payment retry already scheduled");
        }

        return new RetryEligibility.Eligible(maxAttempts, currentAttempts);
    }
}
