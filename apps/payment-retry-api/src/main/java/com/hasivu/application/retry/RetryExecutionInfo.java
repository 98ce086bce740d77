package com.hasivu.application.retry;

import com.hasivu.domain.retry.RetryStatus;

import java.math.BigDecimal;

/**
 * 재시도 실행 결과.
 *
 * @param retryId 재시도 ID
 * @param paymentId 결제 ID
 * @param attemptNumber 시도 번호
 * @param gatewayOrderId 새로 발급된 게이트웨이 주문 ID
 * @param status 재시도 최종 상태
 * @param amount 결제 금액
 * @param currency 통화 코드
 */
public record RetryExecutionInfo(
    Long retryId,
    Long paymentId,
    int attemptNumber,
    String gatewayOrderId,
    RetryStatus status,
    BigDecimal amount,
    String currency
) {
}
