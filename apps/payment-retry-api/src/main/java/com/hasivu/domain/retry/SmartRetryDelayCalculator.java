package com.hasivu.domain.retry;

import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;

import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * 스마트 재시도 지연 계산기.
 * <p>
 * <b>계산식:</b> base × 2^(attemptCount − 1) × pattern × (1 + jitter)
 * <ul>
 *   <li><b>base:</b> 기본 지연 (기본 5분)</li>
 *   <li><b>pattern:</b> 최근 실패 3건 중 "network" 또는 "timeout"을 포함한 사유가 있으면 1.5, 아니면 1</li>
 *   <li><b>jitter:</b> [0, 0.3) 균등 분포</li>
 * </ul>
 * 결과는 상한(기본 120분)으로 자른 뒤 반올림하며 항상 1 이상입니다.
 * </p>
 * <p>
 * 지터 난수원은 생성자로 주입받습니다. 테스트에서는 시드를 고정한 {@link Random}을 넘깁니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
public class SmartRetryDelayCalculator {

    private static final List<String> TRANSIENT_FAILURE_KEYWORDS = List.of("network", "timeout");

    private final RetryProperties retryProperties;
    private final Random random;

    public SmartRetryDelayCalculator(RetryProperties retryProperties, Random random) {
        this.retryProperties = retryProperties;
        this.random = random;
    }

    /**
     * 다음 재시도까지의 지연(분)을 계산합니다.
     *
     * @param attemptCount 이번 재시도의 시도 횟수 (1 이상)
     * @param previousFailureReasons 이전 실패 사유 (오래된 것부터 최신 순)
     * @return 지연(분), [1, maxDelayMinutes]
     * @throws CoreException attemptCount가 1 미만인 경우
     */
    public int delayMinutes(int attemptCount, List<String> previousFailureReasons) {
        if (attemptCount < 1) {
            throw new CoreException(ErrorType.BAD_REQUEST, "attemptCount는 1 이상이어야 합니다.");
        }

        double exponential = Math.pow(2, attemptCount - 1);
        double pattern = hasTransientFailurePattern(previousFailureReasons) ? retryProperties.patternMultiplier() : 1.0;
        double jitter = random.nextDouble() * retryProperties.jitterRatio();

        double rawDelay = retryProperties.baseDelayMinutes() * exponential * pattern * (1 + jitter);
        long rounded = Math.round(Math.min(rawDelay, retryProperties.maxDelayMinutes()));
        return (int) Math.max(1L, rounded);
    }

    private boolean hasTransientFailurePattern(List<String> previousFailureReasons) {
        if (previousFailureReasons == null || previousFailureReasons.isEmpty()) {
            return false;
        }
        int from = Math.max(0, previousFailureReasons.size() - retryProperties.patternWindow());
        return previousFailureReasons.subList(from, previousFailureReasons.size()).stream()
            .filter(reason -> reason != null)
            .map(reason -> reason.toLowerCase(Locale.ROOT))
            .anyMatch(reason -> TRANSIENT_FAILURE_KEYWORDS.stream().anyMatch(reason::contains));
    }
}
