package com.hasivu.infrastructure.retry;

import com.hasivu.domain.retry.RetryEvent;
import com.hasivu.domain.retry.RetryEventPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * RetryEventPublisher 인터페이스의 구현체.
 * <p>
 * Spring ApplicationEventPublisher를 사용하여 재시도 이벤트를 발행합니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Component
@RequiredArgsConstructor
public class RetryEventPublisherImpl implements RetryEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publish(RetryEvent.RetryScheduled event) {
        applicationEventPublisher.publishEvent(event);
    }

    @Override
    public void publish(RetryEvent.RetryExecuted event) {
        applicationEventPublisher.publishEvent(event);
    }
}
