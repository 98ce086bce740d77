package com.hasivu.interfaces.event.retry;

import com.hasivu.application.retry.RetryNotificationHandler;
import com.hasivu.domain.retry.RetryEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 결제 재시도 이벤트 리스너.
 * <p>
 * 이벤트를 받아 애플리케이션 핸들러를 호출하는 어댑터입니다.
 * 재시도 상태는 이벤트 발행 전에 이미 커밋되어 있으므로 일반 {@link EventListener}로 받습니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryEventListener {

    private final RetryNotificationHandler retryNotificationHandler;

    @Async
    @EventListener
    public void handleRetryScheduled(RetryEvent.RetryScheduled event) {
        try {
            retryNotificationHandler.handleRetryScheduled(event);
        } catch (Exception e) {
            log.error("재시도 예약 이벤트 처리 중 오류 발생. (retryId: {})", event.retryId(), e);
        }
    }

    @Async
    @EventListener
    public void handleRetryExecuted(RetryEvent.RetryExecuted event) {
        try {
            retryNotificationHandler.handleRetryExecuted(event);
        } catch (Exception e) {
            log.error("재시도 실행 이벤트 처리 중 오류 발생. (retryId: {})", event.retryId(), e);
        }
    }
}
