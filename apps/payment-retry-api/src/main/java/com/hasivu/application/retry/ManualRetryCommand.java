package com.hasivu.application.retry;

/**
 * 수동 재시도 명령.
 *
 * @param paymentId 결제 ID
 * @param retryReason 재시도 사유
 * @param delayMinutes 지연(분), null이면 즉시 실행
 * @param maxRetries 요청한 최대 재시도 수 (로그에만 남고 설정값이 한도를 결정)
 * @param notifyUser 알림 이벤트 발행 여부
 */
public record ManualRetryCommand(
    Long paymentId,
    String retryReason,
    Integer delayMinutes,
    int maxRetries,
    boolean notifyUser
) {
}
