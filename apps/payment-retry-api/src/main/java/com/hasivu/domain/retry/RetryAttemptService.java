package com.hasivu.domain.retry;

import com.hasivu.domain.payment.PaymentRepository;
import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * 결제 재시도 도메인 서비스.
 * <p>
 * 재시도의 생성, 조회, 상태 전이를 담당합니다. 각 메서드는 하나의 트랜잭션으로 커밋됩니다.
 * </p>
 * <p>
 * <b>동시성 제어:</b>
 * <ul>
 *   <li><b>생성:</b> 결제 행을 비관적 락으로 잡은 뒤 같은 트랜잭션 안에서 재시도 가능 여부를 다시 판정합니다.
 *   (payment_id, attempt_number) 유니크 제약이 마지막 방어선입니다.</li>
 *   <li><b>상태 전이:</b> "현재 상태가 기대 상태일 때만" 갱신하는 조건부 UPDATE를 사용하며,
 *   갱신된 행이 0건이면 다른 호출이 먼저 전이한 것으로 보고 INVALID_STATE를 던집니다.</li>
 * </ul>
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryAttemptService {

    private final RetryAttemptRepository retryAttemptRepository;
    private final PaymentRepository paymentRepository;
    private final RetryEligibilityChecker retryEligibilityChecker;
    private final Clock clock;

    /**
     * SCHEDULED 상태의 재시도를 생성합니다.
     *
     * @param paymentId 결제 ID
     * @param reason 재시도 사유
     * @param method 재시도 경로
     * @param scheduledFor 실행 예정 시각
     * @return 생성된 재시도
     * @throws CoreException 결제가 없거나(NOT_FOUND) 재시도가 허용되지 않는 경우(RETRY_NOT_ALLOWED)
     */
    @Transactional
    public RetryAttempt schedule(Long paymentId, String reason, RetryMethod method, LocalDateTime scheduledFor) {
        paymentRepository.findByIdForUpdate(paymentId)
            .orElseThrow(() -> new CoreException(ErrorType.NOT_FOUND, "Payment not found"));

        // 락을 잡은 상태에서 다시 판정하여 check-then-act 경쟁을 막는다
        RetryEligibility eligibility = retryEligibilityChecker.check(paymentId);
        if (eligibility instanceof RetryEligibility.Ineligible ineligible) {
            throw ineligible.toException();
        }

        int attemptNumber = Math.toIntExact(retryAttemptRepository.countByPaymentId(paymentId) + 1);
        RetryAttempt attempt = RetryAttempt.scheduled(paymentId, attemptNumber, reason, method, scheduledFor);

        try {
            RetryAttempt saved = retryAttemptRepository.save(attempt);
            log.info("결제 재시도 예약. (retryId: {}, paymentId: {}, attemptNumber: {}, method: {}, retryAt: {})",
                saved.getId(), paymentId, attemptNumber, method, scheduledFor);
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("결제 재시도 번호 충돌. (paymentId: {}, attemptNumber: {})", paymentId, attemptNumber);
            throw new CoreException(ErrorType.RETRY_NOT_ALLOWED, "Payment retry already scheduled", e);
        }
    }

    /**
     * 재시도를 조회합니다.
     *
     * @param attemptId 재시도 ID
     * @return 조회된 재시도
     * @throws CoreException 재시도를 찾을 수 없는 경우
     */
    @Transactional(readOnly = true)
    public RetryAttempt get(Long attemptId) {
        return retryAttemptRepository.findById(attemptId)
            .orElseThrow(() -> new CoreException(ErrorType.NOT_FOUND, "Retry attempt not found"));
    }

    /**
     * 결제의 재시도 목록을 최신 시도부터 조회합니다.
     *
     * @param paymentId 결제 ID
     * @return 재시도 목록
     */
    @Transactional(readOnly = true)
    public List<RetryAttempt> listByPayment(Long paymentId) {
        return retryAttemptRepository.findAllByPaymentId(paymentId);
    }

    @Transactional(readOnly = true)
    public List<RetryAttempt> listAll() {
        return retryAttemptRepository.findAll();
    }

    /**
     * 실행 시각이 지난 SCHEDULED 재시도를 조회합니다.
     *
     * @param now 기준 시각
     * @param manualCutoff MANUAL 재시도의 기준 시각
     * @param limit 최대 조회 건수
     * @return 실행 대상 재시도 목록 (실행 예정 시각 오름차순)
     */
    @Transactional(readOnly = true)
    public List<RetryAttempt> listDue(LocalDateTime now, LocalDateTime manualCutoff, int limit) {
        return retryAttemptRepository.findDueScheduled(now, manualCutoff, limit);
    }

    /**
     * 재시도 상태를 전이합니다.
     *
     * @param attemptId 재시도 ID
     * @param next 다음 상태
     * @param failureReason 실패 사유 (FAILED, CANCELLED에서만 사용, null 가능)
     * @return 전이 후 재시도
     * @throws CoreException 재시도가 없거나(NOT_FOUND) 허용되지 않는 전이인 경우(INVALID_STATE)
     */
    @Transactional
    public RetryAttempt updateStatus(Long attemptId, RetryStatus next, String failureReason) {
        RetryAttempt attempt = get(attemptId);
        RetryStatus current = attempt.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new CoreException(ErrorType.INVALID_STATE,
                String.format("Illegal retry status transition: %s -> %s", current, next));
        }

        String storedReason = (next == RetryStatus.FAILED || next == RetryStatus.CANCELLED)
            ? RetryAttempt.truncateFailureReason(failureReason)
            : null;
        int updated = retryAttemptRepository.updateStatus(
            attemptId, current, next, storedReason, ZonedDateTime.now(clock));
        if (updated == 0) {
            throw new CoreException(ErrorType.INVALID_STATE,
                String.format("Retry attempt is no longer %s", current.name().toLowerCase()));
        }

        log.info("결제 재시도 상태 전이. (retryId: {}, paymentId: {}, {} -> {})",
            attemptId, attempt.getPaymentId(), current, next);
        return get(attemptId);
    }
}
