package com.hasivu.domain.retry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 결제 재시도 정책 설정.
 *
 * @param maxAttempts 결제당 취소되지 않은 재시도 최대 수
 * @param baseDelayMinutes 스마트 지연의 기본 지연(분)
 * @param maxDelayMinutes 스마트 지연 상한(분)
 * @param jitterRatio 지터 상한 비율, [0, jitterRatio) 범위에서 곱해집니다
 * @param patternMultiplier 네트워크/타임아웃 실패 패턴 감지 시 배수
 * @param patternWindow 패턴 감지에 사용하는 최근 실패 수
 * @param topFailureReasons 통계에 노출할 실패 사유 수
 * @param sweeper 실행 예정 재시도 스윕 설정
 */
@ConfigurationProperties(prefix = "payment.retry")
public record RetryProperties(
    @DefaultValue("5") int maxAttempts,
    @DefaultValue("5") int baseDelayMinutes,
    @DefaultValue("120") int maxDelayMinutes,
    @DefaultValue("0.3") double jitterRatio,
    @DefaultValue("1.5") double patternMultiplier,
    @DefaultValue("3") int patternWindow,
    @DefaultValue("5") int topFailureReasons,
    @DefaultValue Sweeper sweeper
) {

    public record Sweeper(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("60000") long fixedDelayMs,
        @DefaultValue("50") int batchSize,
        @DefaultValue("30") long manualGraceSeconds
    ) {
    }

    /**
     * 기본값으로 채운 설정을 반환합니다.
     *
     * @return 기본 설정
     */
    public static RetryProperties defaults() {
        return new RetryProperties(5, 5, 120, 0.3, 1.5, 3, 5, new Sweeper(true, 60000L, 50, 30L));
    }
}
