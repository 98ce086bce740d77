package com.hasivu.infrastructure.paymentgateway;

import feign.auth.BasicAuthRequestInterceptor;
import org.springframework.context.annotation.Bean;

/**
 * 결제 게이트웨이 FeignClient 전용 설정.
 * <p>
 * 전역 컴포넌트 스캔에 잡히지 않도록 {@code @Configuration}을 붙이지 않습니다.
 * 타임아웃은 {@code spring.cloud.openfeign.client.config.paymentGatewayClient}에서 설정합니다.
 * </p>
 */
public class PaymentGatewayClientConfig {

    @Bean
    public BasicAuthRequestInterceptor paymentGatewayBasicAuth(PaymentGatewayProperties properties) {
        return new BasicAuthRequestInterceptor(properties.keyId(), properties.keySecret());
    }
}
