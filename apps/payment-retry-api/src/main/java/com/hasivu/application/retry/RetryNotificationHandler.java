package com.hasivu.application.retry;

import com.hasivu.domain.retry.RetryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 재시도 알림 핸들러.
 * <p>
 * 알림 채널은 외부 시스템이 담당하므로 여기서는 알림 대상과 내용을 기록합니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Slf4j
@Component
public class RetryNotificationHandler {

    public void handleRetryScheduled(RetryEvent.RetryScheduled event) {
        log.info("재시도 예약 알림. (retryId: {}, paymentId: {}, attemptNumber: {}, scheduledFor: {}, requestedBy: {}, notifyEmail: {})",
            event.retryId(), event.paymentId(), event.attemptNumber(), event.scheduledFor(),
            event.requestedBy(), event.notifyEmail());
    }

    public void handleRetryExecuted(RetryEvent.RetryExecuted event) {
        log.info("재시도 실행 알림. (retryId: {}, paymentId: {}, attemptNumber: {}, gatewayOrderId: {}, requestedBy: {}, notifyEmail: {})",
            event.retryId(), event.paymentId(), event.attemptNumber(), event.gatewayOrderId(),
            event.requestedBy(), event.notifyEmail());
    }
}
