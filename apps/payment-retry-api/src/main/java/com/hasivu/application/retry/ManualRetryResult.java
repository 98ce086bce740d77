package com.hasivu.application.retry;

import java.time.LocalDateTime;

/**
 * 수동 재시도 결과.
 * <p>
 * 지연 없이 요청하면 즉시 실행된 결과({@link Outcome#EXECUTED})를,
 * 지연을 주면 예약된 결과({@link Outcome#SCHEDULED})를 담습니다.
 * </p>
 *
 * @param outcome 실행 여부
 * @param retryId 재시도 ID
 * @param paymentId 결제 ID
 * @param attemptNumber 시도 번호
 * @param scheduledFor 실행 예정 시각
 * @param execution 실행 결과 (예약된 경우 null)
 */
public record ManualRetryResult(
    Outcome outcome,
    Long retryId,
    Long paymentId,
    int attemptNumber,
    LocalDateTime scheduledFor,
    RetryExecutionInfo execution
) {
    public enum Outcome {
        EXECUTED,
        SCHEDULED
    }

    public static ManualRetryResult executed(RetryAttemptInfo attempt, RetryExecutionInfo execution) {
        return new ManualRetryResult(
            Outcome.EXECUTED, attempt.retryId(), attempt.paymentId(), attempt.attemptNumber(), attempt.retryAt(), execution);
    }

    public static ManualRetryResult scheduled(RetryAttemptInfo attempt) {
        return new ManualRetryResult(
            Outcome.SCHEDULED, attempt.retryId(), attempt.paymentId(), attempt.attemptNumber(), attempt.retryAt(), null);
    }
}
