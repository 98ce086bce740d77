package com.hasivu.application.retry;

import java.time.LocalDateTime;

/**
 * 자동 재시도 예약 결과.
 */
public record RetryScheduleInfo(
    Long retryId,
    Long paymentId,
    ScheduleType scheduleType,
    LocalDateTime scheduledFor,
    int delayMinutes
) {
}
