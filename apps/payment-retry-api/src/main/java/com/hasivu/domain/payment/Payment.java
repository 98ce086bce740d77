package com.hasivu.domain.payment;

import com.hasivu.domain.BaseEntity;
import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 결제 도메인 엔티티.
 * <p>
 * 주문 한 건에 대한 결제 시도를 나타냅니다. 결제 레코드의 소유자는 주문 도메인이며,
 * 재시도 도메인은 상태와 게이트웨이 주문 참조만 변경합니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_order_id", columnList = "ref_order_id"),
        @Index(name = "idx_payments_status", columnList = "status")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class Payment extends BaseEntity {

    @Column(name = "ref_order_id", nullable = false)
    private Long orderId;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "gateway_order_id")
    private String gatewayOrderId;

    /**
     * Payment를 생성합니다.
     *
     * @param orderId 주문 ID
     * @param amount 결제 금액
     * @param currency 통화 코드 (ISO-4217)
     * @param status 초기 상태
     * @return 생성된 Payment 인스턴스
     * @throws CoreException 유효성 검증 실패 시
     */
    public static Payment of(Long orderId, BigDecimal amount, String currency, PaymentStatus status) {
        validateOrderId(orderId);
        validateAmount(amount);
        validateCurrency(currency);
        if (status == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "결제 상태는 필수입니다.");
        }

        Payment payment = new Payment();
        payment.orderId = orderId;
        payment.amount = amount.setScale(2, RoundingMode.HALF_UP);
        payment.currency = currency.toUpperCase();
        payment.status = status;
        return payment;
    }

    /**
     * 재시도로 새로 발급된 게이트웨이 주문을 결제에 반영합니다.
     * <p>
     * 게이트웨이 주문 참조를 교체하고 결제를 PENDING 상태로 되돌려 확정 흐름을 다시 기다리게 합니다.
     * </p>
     *
     * @param gatewayOrderId 게이트웨이 주문 ID
     * @throws CoreException 종결 상태의 결제이거나 주문 ID가 비어 있는 경우
     */
    public void applyRetryOrder(String gatewayOrderId) {
        if (gatewayOrderId == null || gatewayOrderId.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "게이트웨이 주문 ID는 필수입니다.");
        }
        if (status.isTerminal()) {
            throw new CoreException(ErrorType.INVALID_STATE,
                String.format("Payment is already %s", status.name().toLowerCase()));
        }
        this.gatewayOrderId = gatewayOrderId;
        this.status = PaymentStatus.PENDING;
    }

    /**
     * 결제 금액을 통화의 최소 단위(예: paise, cent)로 변환합니다.
     *
     * @return 최소 단위 금액
     */
    public long amountInMinorUnits() {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static void validateOrderId(Long orderId) {
        if (orderId == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "주문 ID는 필수입니다.");
        }
    }

    private static void validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new CoreException(ErrorType.BAD_REQUEST, "결제 금액은 0보다 커야 합니다.");
        }
    }

    private static void validateCurrency(String currency) {
        if (currency == null || currency.length() != 3) {
            throw new CoreException(ErrorType.BAD_REQUEST, "통화 코드는 3자리여야 합니다.");
        }
    }
}
