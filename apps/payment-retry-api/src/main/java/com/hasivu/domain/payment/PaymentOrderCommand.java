package com.hasivu.domain.payment;

import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;

import java.util.Map;

/**
 * 결제 주문 생성 명령.
 * <p>
 * 게이트웨이 주문 생성에 필요한 정보를 담는 도메인 모델입니다.
 * </p>
 *
 * @param amount 최소 통화 단위 금액
 * @param currency 통화 코드
 * @param receipt 영수증 식별자
 * @param metadata 원 결제와 재시도를 연결하는 메타데이터
 */
public record PaymentOrderCommand(
    long amount,
    String currency,
    String receipt,
    Map<String, String> metadata
) {
    public PaymentOrderCommand {
        if (amount <= 0) {
            throw new CoreException(ErrorType.BAD_REQUEST, "Order amount must be greater than zero");
        }
        if (currency == null || currency.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "currency는 필수입니다.");
        }
        if (receipt == null || receipt.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "receipt는 필수입니다.");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
