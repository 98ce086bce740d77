package com.hasivu.infrastructure.retry;

import com.hasivu.domain.retry.RetryAttempt;
import com.hasivu.domain.retry.RetryMethod;
import com.hasivu.domain.retry.RetryStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * RetryAttempt 엔티티를 위한 Spring Data JPA 리포지토리.
 *
 * @author Hasivu
 * @version 1.0
 */
public interface RetryAttemptJpaRepository extends JpaRepository<RetryAttempt, Long> {

    List<RetryAttempt> findAllByPaymentIdOrderByAttemptNumberDesc(Long paymentId);

    long countByPaymentId(Long paymentId);

    long countByPaymentIdAndStatusNot(Long paymentId, RetryStatus status);

    boolean existsByPaymentIdAndStatus(Long paymentId, RetryStatus status);

    /**
     * 실행 시각이 지난 재시도를 조회합니다.
     * <p>
     * MANUAL 재시도는 요청 스레드가 직접 실행하므로 {@code manualCutoff} 이전 시각인 것만 포함합니다.
     * </p>
     */
    @Query("SELECT r FROM RetryAttempt r"
        + " WHERE r.status = :status AND r.retryAt <= :now"
        + " AND (r.method <> :manual OR r.retryAt <= :manualCutoff)"
        + " ORDER BY r.retryAt ASC")
    List<RetryAttempt> findDue(
        @Param("status") RetryStatus status,
        @Param("now") LocalDateTime now,
        @Param("manual") RetryMethod manual,
        @Param("manualCutoff") LocalDateTime manualCutoff,
        Pageable pageable);

    /**
     * 현재 상태가 {@code expected}인 경우에만 상태를 갱신합니다.
     * <p>
     * 같은 재시도에 대한 동시 전이 중 하나만 1을 반환합니다.
     * 영속성 컨텍스트는 갱신 후 비워지므로 호출자는 다시 조회해야 합니다.
     * </p>
     *
     * @return 갱신된 행 수
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RetryAttempt r SET r.status = :next, r.failureReason = :failureReason, r.updatedAt = :updatedAt "
        + "WHERE r.id = :id AND r.status = :expected")
    int updateStatusIfCurrent(
        @Param("id") Long id,
        @Param("expected") RetryStatus expected,
        @Param("next") RetryStatus next,
        @Param("failureReason") String failureReason,
        @Param("updatedAt") ZonedDateTime updatedAt
    );
}
