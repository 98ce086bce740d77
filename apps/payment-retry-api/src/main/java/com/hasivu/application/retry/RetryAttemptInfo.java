package com.hasivu.application.retry;

import com.hasivu.domain.retry.RetryAttempt;
import com.hasivu.domain.retry.RetryMethod;
import com.hasivu.domain.retry.RetryStatus;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;

/**
 * 재시도 정보를 담는 레코드.
 */
public record RetryAttemptInfo(
    Long retryId,
    Long paymentId,
    int attemptNumber,
    LocalDateTime retryAt,
    String reason,
    RetryMethod method,
    RetryStatus status,
    String failureReason,
    ZonedDateTime createdAt,
    ZonedDateTime updatedAt
) {
    public static RetryAttemptInfo from(RetryAttempt attempt) {
        return new RetryAttemptInfo(
            attempt.getId(),
            attempt.getPaymentId(),
            attempt.getAttemptNumber(),
            attempt.getRetryAt(),
            attempt.getReason(),
            attempt.getMethod(),
            attempt.getStatus(),
            attempt.getFailureReason(),
            attempt.getCreatedAt(),
            attempt.getUpdatedAt()
        );
    }
}
