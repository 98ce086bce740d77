package com.hasivu.infrastructure.scheduler;

import com.hasivu.application.retry.PaymentRetryFacade;
import com.hasivu.application.retry.ProcessedRetries;
import com.hasivu.application.retry.RetryActor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 실행 예정 재시도 스케줄러.
 * <p>
 * 실행 시각이 지난 SCHEDULED 재시도를 주기적으로 찾아 실행합니다.
 * 재시도별 처리와 실패 집계는 {@link PaymentRetryFacade#processDueRetries}에 위임합니다.
 * </p>
 * <p>
 * 여러 인스턴스에서 동시에 실행되어도 SCHEDULED → PROCESSING 조건부 전이에서
 * 한 인스턴스만 각 재시도를 가져갑니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "payment.retry.sweeper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledRetryScheduler {

    private final PaymentRetryFacade paymentRetryFacade;

    @Scheduled(fixedDelayString = "${payment.retry.sweeper.fixed-delay-ms:60000}")
    public void processDueRetries() {
        try {
            log.debug("실행 예정 재시도 스케줄러 시작");
            ProcessedRetries result = paymentRetryFacade.processDueRetries(RetryActor.system());
            if (result.processed() > 0) {
                log.info("실행 예정 재시도 스케줄러 완료. 성공: {}건, 실패: {}건", result.successful(), result.failed());
            }
        } catch (Exception e) {
            log.error("실행 예정 재시도 스케줄러 실행 중 오류 발생", e);
        }
    }
}
