package com.hasivu.infrastructure.scheduler;

import com.hasivu.application.retry.PaymentRetryFacade;
import com.hasivu.application.retry.ProcessedRetries;
import com.hasivu.application.retry.RetryActor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduledRetryScheduler")
class ScheduledRetrySchedulerTest {

    @Mock
    private PaymentRetryFacade paymentRetryFacade;

    @InjectMocks
    private ScheduledRetryScheduler scheduler;

    @DisplayName("시스템 사용자로 실행 예정 재시도를 처리한다.")
    @Test
    void processesAsSystem() {
        // arrange
        when(paymentRetryFacade.processDueRetries(RetryActor.system())).thenReturn(new ProcessedRetries(2, 1, 1));

        // act
        scheduler.processDueRetries();

        // assert
        verify(paymentRetryFacade).processDueRetries(RetryActor.system());
    }

    @DisplayName("처리 중 오류가 발생해도 스케줄러 밖으로 전파하지 않는다.")
    @Test
    void keepsRunningOnError() {
        // arrange
        when(paymentRetryFacade.processDueRetries(RetryActor.system()))
            .thenThrow(new IllegalStateException("database unavailable"));

        // act & assert
        assertThatCode(() -> scheduler.processDueRetries()).doesNotThrowAnyException();
    }
}
