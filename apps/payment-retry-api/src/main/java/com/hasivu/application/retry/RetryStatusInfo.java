package com.hasivu.application.retry;

import com.hasivu.domain.retry.RetryAnalytics;

import java.util.List;

/**
 * 결제의 재시도 현황.
 *
 * @param paymentId 결제 ID
 * @param attempts 재시도 목록 (최신 시도부터)
 * @param analytics 결제 단위 통계
 */
public record RetryStatusInfo(
    Long paymentId,
    List<RetryAttemptInfo> attempts,
    RetryAnalytics analytics
) {
}
