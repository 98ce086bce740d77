package com.hasivu.domain.retry;

import com.hasivu.support.error.CoreException;
import com.hasivu.support.error.ErrorType;

/**
 * 재시도 가능 여부 판정 결과.
 *
 * @author Hasivu
 * @version 1.0
 */
public sealed interface RetryEligibility {

    boolean canRetry();

    /**
     * 재시도 가능.
     *
     * @param maxRetries 최대 재시도 수
     * @param currentAttempts 취소되지 않은 현재 재시도 수
     */
    record Eligible(int maxRetries, long currentAttempts) implements RetryEligibility {
        @Override
        public boolean canRetry() {
            return true;
        }
    }

    /**
     * 재시도 불가.
     *
     * @param reason 불가 사유 유형
     * @param message 불가 사유 메시지
     */
    record Ineligible(Reason reason, String message) implements RetryEligibility {
        @Override
        public boolean canRetry() {
            return false;
        }

        /**
         * 판정 결과를 호출자에게 돌려줄 예외로 변환합니다.
         *
         * @return 결제가 없으면 NOT_FOUND, 그 외에는 RETRY_NOT_ALLOWED
         */
        public CoreException toException() {
            ErrorType errorType = reason == Reason.PAYMENT_NOT_FOUND
                ? ErrorType.NOT_FOUND
                : ErrorType.RETRY_NOT_ALLOWED;
            return new CoreException(errorType, message);
        }
    }

    enum Reason {
        PAYMENT_NOT_FOUND,
        PAYMENT_COMPLETED,
        PAYMENT_CANCELLED,
        MAX_RETRIES_EXCEEDED,
        RETRY_ALREADY_SCHEDULED
    }
}
