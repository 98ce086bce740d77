package com.hasivu.domain.payment;

import java.util.Optional;

/**
 * 결제 저장소 인터페이스.
 * <p>
 * Payment 엔티티의 영속성 계층 접근을 추상화합니다.
 * </p>
 */
public interface PaymentRepository {

    /**
     * 결제를 저장합니다.
     *
     * @param payment 저장할 결제
     * @return 저장된 결제
     */
    Payment save(Payment payment);

    /**
     * 결제 ID로 결제를 조회합니다.
     *
     * @param paymentId 조회할 결제 ID
     * @return 조회된 결제
     */
    Optional<Payment> findById(Long paymentId);

    /**
     * 결제 ID로 결제를 조회합니다. (비관적 락)
     * <p>
     * SELECT ... FOR UPDATE로 같은 결제에 대한 재시도 생성을 직렬화합니다.
     * 호출자는 트랜잭션 안에서 호출해야 합니다.
     * </p>
     *
     * @param paymentId 조회할 결제 ID
     * @return 조회된 결제
     */
    Optional<Payment> findByIdForUpdate(Long paymentId);

    /**
     * 결제 존재 여부를 확인합니다.
     *
     * @param paymentId 결제 ID
     * @return 존재 여부
     */
    boolean existsById(Long paymentId);
}
