package com.hasivu.infrastructure.retry;

import com.hasivu.domain.retry.RetryAttempt;
import com.hasivu.domain.retry.RetryAttemptRepository;
import com.hasivu.domain.retry.RetryMethod;
import com.hasivu.domain.retry.RetryStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * RetryAttemptRepository의 JPA 구현체.
 *
 * @author Hasivu
 * @version 1.0
 */
@RequiredArgsConstructor
@Component
public class RetryAttemptRepositoryImpl implements RetryAttemptRepository {
    private final RetryAttemptJpaRepository retryAttemptJpaRepository;

    @Override
    public RetryAttempt save(RetryAttempt attempt) {
        // 유니크 제약 위반을 트랜잭션 안에서 바로 드러내기 위해 즉시 flush
        return retryAttemptJpaRepository.saveAndFlush(attempt);
    }

    @Override
    public Optional<RetryAttempt> findById(Long attemptId) {
        return retryAttemptJpaRepository.findById(attemptId);
    }

    @Override
    public List<RetryAttempt> findAllByPaymentId(Long paymentId) {
        return retryAttemptJpaRepository.findAllByPaymentIdOrderByAttemptNumberDesc(paymentId);
    }

    @Override
    public List<RetryAttempt> findAll() {
        return retryAttemptJpaRepository.findAll();
    }

    @Override
    public long countByPaymentId(Long paymentId) {
        return retryAttemptJpaRepository.countByPaymentId(paymentId);
    }

    @Override
    public long countActiveByPaymentId(Long paymentId) {
        return retryAttemptJpaRepository.countByPaymentIdAndStatusNot(paymentId, RetryStatus.CANCELLED);
    }

    @Override
    public boolean existsByPaymentIdAndStatus(Long paymentId, RetryStatus status) {
        return retryAttemptJpaRepository.existsByPaymentIdAndStatus(paymentId, status);
    }

    @Override
    public List<RetryAttempt> findDueScheduled(LocalDateTime now, LocalDateTime manualCutoff, int limit) {
        return retryAttemptJpaRepository.findDue(
            RetryStatus.SCHEDULED, now, RetryMethod.MANUAL, manualCutoff, PageRequest.of(0, limit));
    }

    @Override
    public int updateStatus(Long attemptId, RetryStatus expected, RetryStatus next, String failureReason, ZonedDateTime updatedAt) {
        return retryAttemptJpaRepository.updateStatusIfCurrent(attemptId, expected, next, failureReason, updatedAt);
    }
}
