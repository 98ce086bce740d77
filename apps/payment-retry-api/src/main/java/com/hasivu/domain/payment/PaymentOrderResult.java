package com.hasivu.domain.payment;

/**
 * 결제 주문 생성 결과.
 *
 * @author Hasivu
 * @version 1.0
 */
public sealed interface PaymentOrderResult {
    /**
     * 주문 생성 성공.
     *
     * @param gatewayOrderId 게이트웨이 주문 ID
     */
    record Success(String gatewayOrderId) implements PaymentOrderResult {}

    /**
     * 주문 생성 실패.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param isTimeout 타임아웃 여부
     */
    record Failure(String errorCode, String message, boolean isTimeout) implements PaymentOrderResult {}
}
