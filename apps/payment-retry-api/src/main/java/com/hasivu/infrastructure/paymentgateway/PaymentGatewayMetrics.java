package com.hasivu.infrastructure.paymentgateway;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 결제 게이트웨이 메트릭.
 * <p>
 * 주문 생성 성공, 실패, 타임아웃, Fallback 횟수를 Prometheus 메트릭으로 기록합니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Component
@RequiredArgsConstructor
public class PaymentGatewayMetrics {

    private final MeterRegistry meterRegistry;

    public void recordSuccess(String clientName) {
        Counter.builder("payment.gateway.order.success")
            .description("게이트웨이 주문 생성 성공 횟수")
            .tag("client", clientName)
            .register(meterRegistry)
            .increment();
    }

    /**
     * 주문 생성 실패 횟수를 기록합니다.
     *
     * @param clientName 클라이언트 이름
     * @param errorCode 실패 분류 코드
     */
    public void recordFailure(String clientName, String errorCode) {
        Counter.builder("payment.gateway.order.failure")
            .description("게이트웨이 주문 생성 실패 횟수")
            .tag("client", clientName)
            .tag("error", errorCode)
            .register(meterRegistry)
            .increment();
    }

    public void recordTimeout(String clientName) {
        Counter.builder("payment.gateway.timeout")
            .description("게이트웨이 주문 생성 타임아웃 횟수")
            .tag("client", clientName)
            .register(meterRegistry)
            .increment();
    }

    public void recordFallback(String clientName) {
        Counter.builder("payment.gateway.fallback")
            .description("게이트웨이 주문 생성 Fallback 호출 횟수")
            .tag("client", clientName)
            .register(meterRegistry)
            .increment();
    }
}
