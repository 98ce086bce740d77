package com.hasivu.domain.retry;

/**
 * 재시도 생성 경로.
 */
public enum RetryMethod {
    /** 사용자가 직접 요청한 재시도 */
    MANUAL,
    /** 스케줄 유형(즉시/지연/스마트)에 따라 예약된 재시도 */
    AUTOMATIC
}
