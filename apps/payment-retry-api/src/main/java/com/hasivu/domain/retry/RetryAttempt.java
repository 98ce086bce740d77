package com.hasivu.domain.retry;

import com.hasivu.domain.BaseEntity;
import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 결제 재시도 엔티티.
 * <p>
 * 특정 결제에 대해 예약되었거나 실행된 재시도 한 건을 나타냅니다.
 * 결제는 ID로만 참조합니다.
 * </p>
 * <p>
 * 상태 변경은 {@link RetryAttemptRepository#updateStatus}의 조건부 갱신으로만 이루어집니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Entity
@Table(
    name = "payment_retries",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_payment_retries_payment_attempt", columnNames = {"payment_id", "attempt_number"})
    },
    indexes = {
        @Index(name = "idx_payment_retries_payment_id", columnList = "payment_id"),
        @Index(name = "idx_payment_retries_status_retry_at", columnList = "status, retry_at")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class RetryAttempt extends BaseEntity {

    public static final int MAX_REASON_LENGTH = 500;
    public static final int MAX_FAILURE_REASON_LENGTH = 1000;

    @Column(name = "payment_id", nullable = false)
    private Long paymentId;

    @Column(name = "attempt_number", nullable = false)
    private Integer attemptNumber;

    @Column(name = "retry_at", nullable = false)
    private LocalDateTime retryAt;

    @Column(name = "retry_reason", nullable = false, length = MAX_REASON_LENGTH)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "retry_method", nullable = false, length = 20)
    private RetryMethod method;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RetryStatus status;

    @Column(name = "failure_reason", length = MAX_FAILURE_REASON_LENGTH)
    private String failureReason;

    /**
     * SCHEDULED 상태의 재시도를 생성합니다.
     *
     * @param paymentId 결제 ID
     * @param attemptNumber 시도 번호 (1부터 시작)
     * @param reason 재시도 사유
     * @param method 재시도 경로
     * @param retryAt 실행 예정 시각
     * @return 생성된 RetryAttempt 인스턴스
     * @throws CoreException 유효성 검증 실패 시
     */
    public static RetryAttempt scheduled(
        Long paymentId,
        int attemptNumber,
        String reason,
        RetryMethod method,
        LocalDateTime retryAt
    ) {
        if (paymentId == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "결제 ID는 필수입니다.");
        }
        if (attemptNumber < 1) {
            throw new CoreException(ErrorType.BAD_REQUEST, "시도 번호는 1 이상이어야 합니다.");
        }
        validateReason(reason);
        if (method == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "재시도 경로는 필수입니다.");
        }
        if (retryAt == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "실행 예정 시각은 필수입니다.");
        }

        RetryAttempt attempt = new RetryAttempt();
        attempt.paymentId = paymentId;
        attempt.attemptNumber = attemptNumber;
        attempt.reason = reason;
        attempt.method = method;
        attempt.retryAt = retryAt;
        attempt.status = RetryStatus.SCHEDULED;
        return attempt;
    }

    /**
     * 실패 사유를 컬럼 길이에 맞게 자릅니다.
     *
     * @param failureReason 실패 사유
     * @return 잘린 실패 사유 (null이면 null)
     */
    public static String truncateFailureReason(String failureReason) {
        if (failureReason == null || failureReason.length() <= MAX_FAILURE_REASON_LENGTH) {
            return failureReason;
        }
        return failureReason.substring(0, MAX_FAILURE_REASON_LENGTH);
    }

    public boolean isScheduled() {
        return status == RetryStatus.SCHEDULED;
    }

    public boolean isCancelled() {
        return status == RetryStatus.CANCELLED;
    }

    private static void validateReason(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "재시도 사유는 필수입니다.");
        }
        if (reason.length() > MAX_REASON_LENGTH) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("재시도 사유는 %d자 이하여야 합니다.", MAX_REASON_LENGTH));
        }
    }
}
