package com.hasivu.domain.payment;

/**
 * 결제 상태.
 */
public enum PaymentStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * 더 이상 상태가 바뀌지 않는 종결 상태인지 확인합니다.
     *
     * @return 종결 여부 (COMPLETED 또는 CANCELLED)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
