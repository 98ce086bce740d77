package com.hasivu.config;

import com.hasivu.domain.retry.RetryProperties;
import com.hasivu.domain.retry.SmartRetryDelayCalculator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;

/**
 * 결제 재시도 설정.
 */
@Configuration
public class RetryConfig {

    /**
     * 스마트 재시도 지연 계산기를 생성합니다.
     * <p>
     * 운영에서는 {@link SecureRandom}을 지터 난수원으로 사용합니다.
     * </p>
     *
     * @param retryProperties 재시도 정책 설정
     * @return SmartRetryDelayCalculator 인스턴스
     */
    @Bean
    public SmartRetryDelayCalculator smartRetryDelayCalculator(RetryProperties retryProperties) {
        return new SmartRetryDelayCalculator(retryProperties, new SecureRandom());
    }
}
