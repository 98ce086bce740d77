package com.hasivu.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시각 설정.
 * <p>
 * 현재 시각이 필요한 곳은 이 Clock을 주입받습니다. 테스트에서는 고정 Clock으로 교체합니다.
 * </p>
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
