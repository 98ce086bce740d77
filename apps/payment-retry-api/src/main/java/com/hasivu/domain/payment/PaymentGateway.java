package com.hasivu.domain.payment;

/**
 * 결제 게이트웨이 인터페이스.
 * <p>
 * 도메인 계층에 정의하여 DIP를 준수합니다.
 * 인프라 계층이 이 인터페이스를 구현합니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
public interface PaymentGateway {

    /**
     * 게이트웨이에 새 결제 주문을 생성합니다.
     * <p>
     * 구현체는 제한된 타임아웃 안에서 한 번만 호출해야 하며, 재시도하지 않습니다.
     * </p>
     *
     * @param command 결제 주문 생성 명령
     * @return 결제 주문 생성 결과
     */
    PaymentOrderResult createOrder(PaymentOrderCommand command);
}
