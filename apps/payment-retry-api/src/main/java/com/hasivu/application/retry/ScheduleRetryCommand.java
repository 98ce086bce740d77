package com.hasivu.application.retry;

/**
 * 자동 재시도 예약 명령.
 *
 * @param paymentId 결제 ID
 * @param scheduleType 예약 방식
 * @param delayMinutes 지연(분), DELAYED에서 필수
 * @param maxAttempts 요청한 최대 시도 수 (로그에만 남고 설정값이 한도를 결정)
 */
public record ScheduleRetryCommand(
    Long paymentId,
    ScheduleType scheduleType,
    Integer delayMinutes,
    int maxAttempts
) {
}
