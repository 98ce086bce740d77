package com.hasivu.infrastructure.paymentgateway;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 결제 게이트웨이 접속 설정.
 *
 * @param url 게이트웨이 기본 URL
 * @param keyId Basic 인증 키 ID
 * @param keySecret Basic 인증 비밀 키
 */
@ConfigurationProperties(prefix = "payment-gateway")
public record PaymentGatewayProperties(
    String url,
    String keyId,
    String keySecret
) {
}
