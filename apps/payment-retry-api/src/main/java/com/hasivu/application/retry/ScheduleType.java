package com.hasivu.application.retry;

/**
 * 자동 재시도 예약 방식.
 */
public enum ScheduleType {
    /** 지연 없이 예약 */
    IMMEDIATE,
    /** 요청한 지연(분) 후 예약 */
    DELAYED,
    /** 시도 횟수와 실패 패턴으로 계산한 지연 후 예약 */
    SMART
}
