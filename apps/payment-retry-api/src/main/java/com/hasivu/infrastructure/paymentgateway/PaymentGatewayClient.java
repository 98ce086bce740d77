package com.hasivu.infrastructure.paymentgateway;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * 결제 게이트웨이 주문 API FeignClient.
 * <p>
 * CircuitBreaker는 {@link PaymentGatewayImpl}에서 적용합니다.
 * </p>
 * <p>
 * <b>Retry 정책:</b> 주문 생성에는 Feign 레벨 Retry를 두지 않습니다.
 * 실패한 재시도는 FAILED로 기록되고, 다음 재시도는 새 시도로 예약됩니다.
 * </p>
 */
@FeignClient(
    name = "paymentGatewayClient",
    url = "${payment-gateway.url}",
    configuration = PaymentGatewayClientConfig.class
)
public interface PaymentGatewayClient {

    /**
     * 결제 주문 생성.
     *
     * @param request 주문 생성 요청
     * @return 생성된 주문
     */
    @PostMapping("/v1/orders")
    PaymentGatewayDto.OrderResponse createOrder(@RequestBody PaymentGatewayDto.OrderRequest request);
}
