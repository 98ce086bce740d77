package com.hasivu.domain.retry;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 재시도 통계 집계기.
 * <p>
 * 재시도 목록으로부터 성공률과 주요 실패 사유를 계산합니다. 상태를 변경하지 않습니다.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class RetryAnalyticsCalculator {

    static final String UNKNOWN_REASON = "Unknown";

    private final RetryProperties retryProperties;

    /**
     * 재시도 통계를 계산합니다.
     *
     * @param attempts 집계 대상 재시도 목록
     * @return 통계 스냅샷
     */
    public RetryAnalytics calculate(List<RetryAttempt> attempts) {
        long total = attempts.size();
        long successful = attempts.stream().filter(a -> a.getStatus() == RetryStatus.COMPLETED).count();
        List<RetryAttempt> failedAttempts = attempts.stream()
            .filter(a -> a.getStatus() == RetryStatus.FAILED)
            .toList();
        long failed = failedAttempts.size();

        // 동률이면 먼저 등장한 사유가 앞에 온다
        Map<String, Long> histogram = new LinkedHashMap<>();
        for (RetryAttempt attempt : failedAttempts) {
            String reason = attempt.getFailureReason() == null || attempt.getFailureReason().isBlank()
                ? UNKNOWN_REASON
                : attempt.getFailureReason();
            histogram.merge(reason, 1L, Long::sum);
        }

        List<RetryAnalytics.FailureReason> commonFailureReasons = histogram.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
            .limit(retryProperties.topFailureReasons())
            .map(entry -> new RetryAnalytics.FailureReason(
                entry.getKey(),
                entry.getValue(),
                percentage(entry.getValue(), failed)
            ))
            .toList();

        return new RetryAnalytics(total, successful, failed, percentage(successful, total), commonFailureReasons);
    }

    private static int percentage(long part, long whole) {
        if (whole == 0) {
            return 0;
        }
        return (int) Math.round(part * 100.0 / whole);
    }
}
