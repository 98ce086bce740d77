package com.hasivu.domain.retry;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 결제 재시도 저장소 인터페이스.
 */
public interface RetryAttemptRepository {

    RetryAttempt save(RetryAttempt attempt);

    Optional<RetryAttempt> findById(Long attemptId);

    /**
     * 결제의 재시도 목록을 최신 시도부터 조회합니다.
     *
     * @param paymentId 결제 ID
     * @return 시도 번호 내림차순 목록
     */
    List<RetryAttempt> findAllByPaymentId(Long paymentId);

    List<RetryAttempt> findAll();

    /**
     * 결제의 전체 재시도 수 (상태 무관). 시도 번호 발급에 사용합니다.
     */
    long countByPaymentId(Long paymentId);

    /**
     * 결제의 취소되지 않은 재시도 수. 최대 재시도 한도 판단에 사용합니다.
     */
    long countActiveByPaymentId(Long paymentId);

    boolean existsByPaymentIdAndStatus(Long paymentId, RetryStatus status);

    /**
     * 실행 시각이 지난 SCHEDULED 재시도를 오래된 순으로 조회합니다.
     *
     * @param now 기준 시각
     * @param manualCutoff MANUAL 재시도의 기준 시각 (이 시각 이전에 예정된 것만 포함)
     * @param limit 최대 조회 건수
     * @return 실행 대상 재시도 목록
     */
    List<RetryAttempt> findDueScheduled(LocalDateTime now, LocalDateTime manualCutoff, int limit);

    /**
     * 현재 상태가 {@code expected}인 경우에만 상태를 갱신합니다.
     *
     * @param attemptId 재시도 ID
     * @param expected 기대하는 현재 상태
     * @param next 다음 상태
     * @param failureReason 실패 사유 (null 가능)
     * @param updatedAt 갱신 시각
     * @return 갱신된 행 수 (0이면 다른 호출이 먼저 상태를 바꾼 것)
     */
    int updateStatus(Long attemptId, RetryStatus expected, RetryStatus next, String failureReason, ZonedDateTime updatedAt);
}
