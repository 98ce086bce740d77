package com.hasivu.infrastructure.paymentgateway;

import com.hasivu.domain.payment.PaymentGateway;
import com.hasivu.domain.payment.PaymentOrderCommand;
import com.hasivu.domain.payment.PaymentOrderResult;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * PaymentGateway 인터페이스의 구현체.
 * <p>
 * FeignClient 호출과 예외를 도메인 결과({@link PaymentOrderResult})로 변환합니다.
 * 예외는 CircuitBreaker fallback에서 Failure로 바뀌므로 호출자에게 전파되지 않습니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGatewayImpl implements PaymentGateway {

    private static final String CLIENT_NAME = "paymentGatewayClient";

    private final PaymentGatewayClient paymentGatewayClient;
    private final PaymentGatewayMetrics metrics;

    /**
     * 게이트웨이에 결제 주문을 생성합니다.
     *
     * @param command 주문 생성 명령
     * @return 주문 생성 결과
     */
    @Override
    @CircuitBreaker(name = "pgCircuit", fallbackMethod = "fallback")
    public PaymentOrderResult createOrder(PaymentOrderCommand command) {
        PaymentGatewayDto.OrderResponse response = paymentGatewayClient.createOrder(toDto(command));
        return toDomainResult(response, command.receipt());
    }

    /**
     * Circuit Breaker fallback 메서드.
     * <p>
     * 게이트웨이 오류 응답, 타임아웃, 서킷 오픈을 모두 Failure로 변환합니다.
     * </p>
     *
     * @param command 주문 생성 명령
     * @param t 발생한 예외
     * @return 실패 결과
     */
    public PaymentOrderResult fallback(PaymentOrderCommand command, Throwable t) {
        boolean timeout = isTimeout(t);
        String errorCode = classify(t, timeout);
        log.warn("게이트웨이 주문 생성 fallback. (receipt: {}, errorCode: {}, exception: {})",
            command.receipt(), errorCode, t.getClass().getSimpleName(), t);

        metrics.recordFallback(CLIENT_NAME);
        metrics.recordFailure(CLIENT_NAME, errorCode);
        if (timeout) {
            metrics.recordTimeout(CLIENT_NAME);
        }
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new PaymentOrderResult.Failure(errorCode, message, timeout);
    }

    private PaymentGatewayDto.OrderRequest toDto(PaymentOrderCommand command) {
        return new PaymentGatewayDto.OrderRequest(
            command.amount(),
            command.currency(),
            command.receipt(),
            command.metadata()
        );
    }

    private PaymentOrderResult toDomainResult(PaymentGatewayDto.OrderResponse response, String receipt) {
        if (response != null && response.id() != null && !response.id().isBlank()) {
            log.info("게이트웨이 주문 생성 성공. (receipt: {}, gatewayOrderId: {}, status: {})",
                receipt, response.id(), response.status());
            metrics.recordSuccess(CLIENT_NAME);
            return new PaymentOrderResult.Success(response.id());
        }
        log.warn("게이트웨이 주문 생성 응답에 주문 ID가 없습니다. (receipt: {})", receipt);
        metrics.recordFailure(CLIENT_NAME, "EMPTY_RESPONSE");
        return new PaymentOrderResult.Failure("EMPTY_RESPONSE", "Gateway returned no order id", false);
    }

    private String classify(Throwable t, boolean timeout) {
        if (t instanceof CallNotPermittedException) {
            return "CIRCUIT_BREAKER_OPEN";
        }
        if (timeout) {
            return "TIMEOUT";
        }
        if (t instanceof FeignException feignException && feignException.status() > 0) {
            return "HTTP_" + feignException.status();
        }
        return "GATEWAY_UNAVAILABLE";
    }

    private boolean isTimeout(Throwable t) {
        Throwable current = t;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
