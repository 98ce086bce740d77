package com.hasivu.infrastructure.payment;

import com.hasivu.domain.payment.Payment;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Payment 엔티티를 위한 Spring Data JPA 리포지토리.
 *
 * @author Hasivu
 * @version 1.0
 */
public interface PaymentJpaRepository extends JpaRepository<Payment, Long> {

    /**
     * 결제 ID로 결제를 조회합니다. (비관적 락)
     * <p>
     * <b>Lock 전략:</b>
     * <ul>
     *   <li><b>PESSIMISTIC_WRITE:</b> 같은 결제에 대한 재시도 생성과 게이트웨이 주문 반영을 직렬화</li>
     *   <li><b>Lock 범위:</b> PK 조회이므로 해당 행만 락</li>
     * </ul>
     * </p>
     *
     * @param id 결제 ID
     * @return 조회된 결제를 담은 Optional
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.id = :id")
    Optional<Payment> findByIdForUpdate(@Param("id") Long id);
}
