package com.hasivu.domain.retry;

import java.util.List;

/**
 * 재시도 통계 스냅샷. 저장하지 않고 조회 시점에 계산합니다.
 *
 * @param totalRetries 전체 재시도 수
 * @param successfulRetries COMPLETED 재시도 수
 * @param failedRetries FAILED 재시도 수
 * @param successRate 성공률 (0~100, 반올림)
 * @param commonFailureReasons 빈도 상위 실패 사유
 */
public record RetryAnalytics(
    long totalRetries,
    long successfulRetries,
    long failedRetries,
    int successRate,
    List<FailureReason> commonFailureReasons
) {

    /**
     * 실패 사유별 집계.
     *
     * @param reason 실패 사유 (없으면 "Unknown")
     * @param count 건수
     * @param percentage 실패 건 대비 비율 (0~100, 반올림)
     */
    public record FailureReason(String reason, long count, int percentage) {
    }
}
