package com.hasivu.domain.retry;

import java.time.LocalDateTime;

/**
 * 결제 재시도 도메인 이벤트.
 * <p>
 * 사용자 알림 요청이 있는 재시도의 예약과 실행을 알립니다.
 * </p>
 */
public class RetryEvent {

    /**
     * 재시도 예약 이벤트.
     *
     * @param retryId 재시도 ID
     * @param paymentId 결제 ID
     * @param attemptNumber 시도 번호
     * @param scheduledFor 실행 예정 시각
     * @param requestedBy 요청자 ID
     * @param notifyEmail 알림 받을 이메일 (null 가능)
     */
    public record RetryScheduled(
        Long retryId,
        Long paymentId,
        int attemptNumber,
        LocalDateTime scheduledFor,
        String requestedBy,
        String notifyEmail
    ) {
        public RetryScheduled {
            if (retryId == null) {
                throw new IllegalArgumentException("retryId는 필수입니다.");
            }
            if (paymentId == null) {
                throw new IllegalArgumentException("paymentId는 필수입니다.");
            }
        }
    }

    /**
     * 재시도 실행 완료 이벤트.
     *
     * @param retryId 재시도 ID
     * @param paymentId 결제 ID
     * @param attemptNumber 시도 번호
     * @param gatewayOrderId 새로 발급된 게이트웨이 주문 ID
     * @param requestedBy 요청자 ID
     * @param notifyEmail 알림 받을 이메일 (null 가능)
     */
    public record RetryExecuted(
        Long retryId,
        Long paymentId,
        int attemptNumber,
        String gatewayOrderId,
        String requestedBy,
        String notifyEmail
    ) {
        public RetryExecuted {
            if (retryId == null) {
                throw new IllegalArgumentException("retryId는 필수입니다.");
            }
            if (paymentId == null) {
                throw new IllegalArgumentException("paymentId는 필수입니다.");
            }
        }
    }
}
