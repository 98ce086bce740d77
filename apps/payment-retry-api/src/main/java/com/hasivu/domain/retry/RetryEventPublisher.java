package com.hasivu.domain.retry;

/**
 * 결제 재시도 이벤트 발행 인터페이스.
 * <p>
 * 구현은 인프라 레이어에서 제공됩니다.
 * </p>
 */
public interface RetryEventPublisher {

    void publish(RetryEvent.RetryScheduled event);

    void publish(RetryEvent.RetryExecuted event);
}
