package com.hasivu.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 비동기 이벤트 처리 설정.
 * <p>
 * {@code @Async} 이벤트 리스너(재시도 알림)가 이 풀에서 실행됩니다.
 * </p>
 */
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * 알림 이벤트 처리를 위한 Executor를 생성합니다.
     * <p>
     * 고정 크기 스레드 풀을 사용하여 동시에 실행 가능한 작업 수를 제한합니다.
     * </p>
     *
     * @return Executor 인스턴스
     */
    @Bean(name = "taskExecutor")
    public Executor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("retry-event-");
        executor.initialize();
        return executor;
    }
}
