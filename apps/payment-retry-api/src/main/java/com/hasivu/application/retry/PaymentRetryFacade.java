package com.hasivu.application.retry;

import com.hasivu.domain.payment.PaymentService;
import com.hasivu.domain.retry.RetryAnalytics;
import com.hasivu.domain.retry.RetryAnalyticsCalculator;
import com.hasivu.domain.retry.RetryAttempt;
import com.hasivu.domain.retry.RetryAttemptService;
import com.hasivu.domain.retry.RetryEligibility;
import com.hasivu.domain.retry.RetryEligibilityChecker;
import com.hasivu.domain.retry.RetryEvent;
import com.hasivu.domain.retry.RetryEventPublisher;
import com.hasivu.domain.retry.RetryMethod;
import com.hasivu.domain.retry.RetryProperties;
import com.hasivu.domain.retry.RetryStatus;
import com.hasivu.domain.retry.SmartRetryDelayCalculator;
import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 결제 재시도 파사드.
 * <p>
 * 수동 재시도, 자동 재시도 예약, 현황/통계 조회, 취소, 실행 예정 재시도 일괄 처리를 조율합니다.
 * </p>
 * <p>
 * 재시도 가능 여부를 먼저 판정하여 불가하면 아무것도 변경하지 않고 거절합니다.
 * 생성 시점에는 {@link RetryAttemptService#schedule}이 락을 잡고 다시 판정합니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentRetryFacade {

    static final String CANCELLED_BY_USER = "Cancelled by user";

    private final RetryEligibilityChecker retryEligibilityChecker;
    private final RetryAttemptService retryAttemptService;
    private final PaymentRetryExecutor paymentRetryExecutor;
    private final SmartRetryDelayCalculator smartRetryDelayCalculator;
    private final RetryAnalyticsCalculator retryAnalyticsCalculator;
    private final PaymentService paymentService;
    private final RetryEventPublisher retryEventPublisher;
    private final RetryProperties retryProperties;
    private final Clock clock;

    /**
     * 수동 재시도를 요청합니다.
     * <p>
     * 지연이 없으면 즉시 실행하고, 지연이 있으면 예약만 합니다.
     * </p>
     *
     * @param command 수동 재시도 명령
     * @param actor 요청자
     * @return 실행 또는 예약 결과
     * @throws CoreException 결제가 없거나(NOT_FOUND) 재시도가 허용되지 않거나(RETRY_NOT_ALLOWED)
     *                       즉시 실행이 실패한 경우
     */
    public ManualRetryResult manualRetry(ManualRetryCommand command, RetryActor actor) {
        Long paymentId = command.paymentId();
        ensureEligible(paymentId, actor);

        LocalDateTime now = LocalDateTime.now(clock);
        Integer delayMinutes = command.delayMinutes();
        LocalDateTime scheduledFor = delayMinutes == null ? now : now.plusMinutes(delayMinutes);

        log.info("수동 재시도 요청. (paymentId: {}, delayMinutes: {}, requestedMaxRetries: {}, actor: {})",
            paymentId, delayMinutes, command.maxRetries(), actor.id());
        RetryAttempt attempt = retryAttemptService.schedule(
            paymentId, command.retryReason(), RetryMethod.MANUAL, scheduledFor);
        RetryAttemptInfo attemptInfo = RetryAttemptInfo.from(attempt);

        if (delayMinutes != null) {
            if (command.notifyUser()) {
                retryEventPublisher.publish(new RetryEvent.RetryScheduled(
                    attempt.getId(), paymentId, attempt.getAttemptNumber(), scheduledFor, actor.id(), actor.email()));
            }
            return ManualRetryResult.scheduled(attemptInfo);
        }

        RetryExecutionInfo execution = paymentRetryExecutor.execute(attempt.getId(), actor);
        if (command.notifyUser()) {
            retryEventPublisher.publish(new RetryEvent.RetryExecuted(
                attempt.getId(), paymentId, attempt.getAttemptNumber(), execution.gatewayOrderId(),
                actor.id(), actor.email()));
        }
        return ManualRetryResult.executed(attemptInfo, execution);
    }

    /**
     * 자동 재시도를 예약합니다. 실행은 하지 않습니다.
     *
     * @param command 예약 명령
     * @param actor 요청자
     * @return 예약 결과
     * @throws CoreException 결제가 없거나(NOT_FOUND) 재시도가 허용되지 않거나(RETRY_NOT_ALLOWED)
     *                       DELAYED인데 지연이 없는 경우(BAD_REQUEST)
     */
    public RetryScheduleInfo scheduleRetry(ScheduleRetryCommand command, RetryActor actor) {
        Long paymentId = command.paymentId();
        RetryEligibility.Eligible eligible = ensureEligible(paymentId, actor);

        ScheduleType scheduleType = command.scheduleType() == null ? ScheduleType.SMART : command.scheduleType();
        int delayMinutes = switch (scheduleType) {
            case IMMEDIATE -> 0;
            case DELAYED -> {
                if (command.delayMinutes() == null) {
                    throw new CoreException(ErrorType.BAD_REQUEST, "delayMinutes is required for DELAYED schedule");
                }
                yield command.delayMinutes();
            }
            case SMART -> smartRetryDelayCalculator.delayMinutes(
                Math.toIntExact(eligible.currentAttempts() + 1), previousFailureReasons(paymentId));
        };

        LocalDateTime scheduledFor = LocalDateTime.now(clock).plusMinutes(delayMinutes);
        RetryAttempt attempt = retryAttemptService.schedule(
            paymentId, "Automatic retry (" + scheduleType.name().toLowerCase() + ")", RetryMethod.AUTOMATIC, scheduledFor);

        log.info("자동 재시도 예약. (retryId: {}, paymentId: {}, scheduleType: {}, delayMinutes: {}, requestedMaxAttempts: {}, actor: {})",
            attempt.getId(), paymentId, scheduleType, delayMinutes, command.maxAttempts(), actor.id());
        return new RetryScheduleInfo(attempt.getId(), paymentId, scheduleType, scheduledFor, delayMinutes);
    }

    /**
     * 결제의 재시도 현황을 조회합니다.
     *
     * @param paymentId 결제 ID
     * @return 재시도 목록과 결제 단위 통계
     * @throws CoreException 결제를 찾을 수 없는 경우
     */
    public RetryStatusInfo getRetryStatus(Long paymentId) {
        if (!paymentService.exists(paymentId)) {
            throw new CoreException(ErrorType.NOT_FOUND, "Payment not found");
        }
        List<RetryAttempt> attempts = retryAttemptService.listByPayment(paymentId);
        return new RetryStatusInfo(
            paymentId,
            attempts.stream().map(RetryAttemptInfo::from).toList(),
            retryAnalyticsCalculator.calculate(attempts)
        );
    }

    /**
     * 재시도 통계를 조회합니다.
     *
     * @param paymentId 결제 ID (null이면 전체)
     * @return 통계
     */
    public RetryAnalytics getAnalytics(Long paymentId) {
        List<RetryAttempt> attempts = paymentId == null
            ? retryAttemptService.listAll()
            : retryAttemptService.listByPayment(paymentId);
        return retryAnalyticsCalculator.calculate(attempts);
    }

    /**
     * 예약된 재시도를 취소합니다.
     *
     * @param retryId 재시도 ID
     * @param actor 요청자
     * @return 취소된 재시도
     * @throws CoreException 재시도가 없거나(NOT_FOUND) SCHEDULED가 아닌 경우(INVALID_STATE)
     */
    public RetryAttemptInfo cancel(Long retryId, RetryActor actor) {
        RetryAttempt attempt = retryAttemptService.get(retryId);
        if (!attempt.isScheduled()) {
            log.warn("예약 상태가 아닌 재시도 취소 요청. (retryId: {}, status: {}, actor: {})",
                retryId, attempt.getStatus(), actor.id());
            throw new CoreException(ErrorType.INVALID_STATE, "Can only cancel scheduled retries");
        }
        RetryAttempt cancelled = retryAttemptService.updateStatus(retryId, RetryStatus.CANCELLED, CANCELLED_BY_USER);
        log.info("결제 재시도 취소. (retryId: {}, paymentId: {}, actor: {})", retryId, cancelled.getPaymentId(), actor.id());
        return RetryAttemptInfo.from(cancelled);
    }

    /**
     * 실행 시각이 지난 SCHEDULED 재시도를 일괄 실행합니다.
     * <p>
     * 재시도마다 독립적으로 실행하며, 한 건의 실패가 나머지 처리를 막지 않습니다.
     * 즉시 실행 중인 수동 재시도를 가로채지 않도록 MANUAL 재시도는 유예 시간이 지난 것만 가져옵니다.
     * </p>
     *
     * @param actor 요청자
     * @return 처리 결과
     */
    public ProcessedRetries processDueRetries(RetryActor actor) {
        LocalDateTime now = LocalDateTime.now(clock);
        RetryProperties.Sweeper sweeper = retryProperties.sweeper();
        List<RetryAttempt> due = retryAttemptService.listDue(
            now, now.minusSeconds(sweeper.manualGraceSeconds()), sweeper.batchSize());
        if (due.isEmpty()) {
            return new ProcessedRetries(0, 0, 0);
        }

        int successful = 0;
        int failed = 0;
        for (RetryAttempt attempt : due) {
            try {
                paymentRetryExecutor.execute(attempt.getId(), actor);
                successful++;
            } catch (CoreException e) {
                failed++;
                log.warn("실행 예정 재시도 처리 실패. (retryId: {}, paymentId: {}, errorType: {}, message: {})",
                    attempt.getId(), attempt.getPaymentId(), e.getErrorType(), e.getMessage());
            } catch (Exception e) {
                failed++;
                log.error("실행 예정 재시도 처리 중 오류 발생. (retryId: {}, paymentId: {})",
                    attempt.getId(), attempt.getPaymentId(), e);
            }
        }

        log.info("실행 예정 재시도 처리 완료. (processed: {}, successful: {}, failed: {}, actor: {})",
            due.size(), successful, failed, actor.id());
        return new ProcessedRetries(due.size(), successful, failed);
    }

    private RetryEligibility.Eligible ensureEligible(Long paymentId, RetryActor actor) {
        RetryEligibility eligibility = retryEligibilityChecker.check(paymentId);
        if (eligibility instanceof RetryEligibility.Ineligible ineligible) {
            log.warn("결제 재시도 거절. (paymentId: {}, reason: {}, actor: {})",
                paymentId, ineligible.reason(), actor.id());
            throw ineligible.toException();
        }
        return (RetryEligibility.Eligible) eligibility;
    }

    // 오래된 실패부터 최신 실패 순
    private List<String> previousFailureReasons(Long paymentId) {
        List<String> reasons = new ArrayList<>(retryAttemptService.listByPayment(paymentId).stream()
            .filter(attempt -> attempt.getStatus() == RetryStatus.FAILED)
            .map(RetryAttempt::getFailureReason)
            .filter(Objects::nonNull)
            .toList());
        Collections.reverse(reasons);
        return reasons;
    }
}
