package com.hasivu.domain.payment;

import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 결제 도메인 서비스.
 * <p>
 * 결제 레코드의 조회와 재시도 결과 반영을 담당합니다.
 * 상태 전이 규칙은 Payment 엔티티에 위임합니다.
 * </p>
 *
 * @author Hasivu
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentService {

    private final PaymentRepository paymentRepository;

    /**
     * 결제 ID로 결제를 조회합니다.
     *
     * @param paymentId 결제 ID
     * @return 조회된 Payment
     * @throws CoreException 결제를 찾을 수 없는 경우
     */
    @Transactional(readOnly = true)
    public Payment findById(Long paymentId) {
        return paymentRepository.findById(paymentId)
            .orElseThrow(() -> new CoreException(ErrorType.NOT_FOUND, "Payment not found"));
    }

    /**
     * 결제 존재 여부를 확인합니다.
     *
     * @param paymentId 결제 ID
     * @return 존재 여부
     */
    @Transactional(readOnly = true)
    public boolean exists(Long paymentId) {
        return paymentRepository.existsById(paymentId);
    }

    /**
     * 재시도로 발급된 게이트웨이 주문을 결제에 반영합니다.
     *
     * @param paymentId 결제 ID
     * @param gatewayOrderId 게이트웨이 주문 ID
     * @return 갱신된 Payment
     * @throws CoreException 결제를 찾을 수 없거나 종결 상태인 경우
     */
    @Transactional
    public Payment applyRetryOrder(Long paymentId, String gatewayOrderId) {
        Payment payment = paymentRepository.findByIdForUpdate(paymentId)
            .orElseThrow(() -> new CoreException(ErrorType.NOT_FOUND, "Payment not found"));
        payment.applyRetryOrder(gatewayOrderId); // Entity에 위임
        log.info("재시도 게이트웨이 주문 반영. (paymentId: {}, gatewayOrderId: {})", paymentId, gatewayOrderId);
        return paymentRepository.save(payment);
    }
}
