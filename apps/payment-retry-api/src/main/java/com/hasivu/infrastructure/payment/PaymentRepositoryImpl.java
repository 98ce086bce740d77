package com.hasivu.infrastructure.payment;

import com.hasivu.domain.payment.Payment;
import com.hasivu.domain.payment.PaymentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * PaymentRepository의 JPA 구현체.
 *
 * @author Hasivu
 * @version 1.0
 */
@RequiredArgsConstructor
@Component
public class PaymentRepositoryImpl implements PaymentRepository {
    private final PaymentJpaRepository paymentJpaRepository;

    @Override
    public Payment save(Payment payment) {
        return paymentJpaRepository.save(payment);
    }

    @Override
    public Optional<Payment> findById(Long paymentId) {
        return paymentJpaRepository.findById(paymentId);
    }

    @Override
    public Optional<Payment> findByIdForUpdate(Long paymentId) {
        return paymentJpaRepository.findByIdForUpdate(paymentId);
    }

    @Override
    public boolean existsById(Long paymentId) {
        return paymentJpaRepository.existsById(paymentId);
    }
}
