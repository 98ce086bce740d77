package com.hasivu.infrastructure.paymentgateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * 결제 게이트웨이 DTO.
 */
public class PaymentGatewayDto {

    /**
     * 주문 생성 요청 DTO.
     */
    public record OrderRequest(
        @JsonProperty("amount") Long amount,
        @JsonProperty("currency") String currency,
        @JsonProperty("receipt") String receipt,
        @JsonProperty("notes") Map<String, String> notes
    ) {
    }

    /**
     * 주문 생성 응답 DTO.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrderResponse(
        @JsonProperty("id") String id,
        @JsonProperty("entity") String entity,
        @JsonProperty("amount") Long amount,
        @JsonProperty("currency") String currency,
        @JsonProperty("receipt") String receipt,
        @JsonProperty("status") String status
    ) {
    }
}
