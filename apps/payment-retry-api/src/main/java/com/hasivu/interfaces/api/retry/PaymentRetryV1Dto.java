package com.hasivu.interfaces.api.retry;

import com.hasivu.application.retry.ManualRetryCommand;
import com.hasivu.application.retry.ManualRetryResult;
import com.hasivu.application.retry.ProcessedRetries;
import com.hasivu.application.retry.RetryAttemptInfo;
import com.hasivu.application.retry.RetryExecutionInfo;
import com.hasivu.application.retry.RetryScheduleInfo;
import com.hasivu.application.retry.RetryStatusInfo;
import com.hasivu.application.retry.ScheduleRetryCommand;
import com.hasivu.application.retry.ScheduleType;
import com.hasivu.domain.retry.RetryAnalytics;
import com.hasivu.domain.retry.RetryMethod;
import com.hasivu.domain.retry.RetryStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.List;

public final class PaymentRetryV1Dto {

    private static final int DEFAULT_MAX_RETRIES = 3;

    private PaymentRetryV1Dto() {
    }

    /**
     * 수동 재시도 요청 DTO.
     */
    public record ManualRetryRequest(
        @NotNull(message = "결제 ID는 필수입니다.")
        @Positive(message = "결제 ID는 양수여야 합니다.")
        Long paymentId,

        @NotBlank(message = "재시도 사유는 필수입니다.")
        @Size(max = 500, message = "재시도 사유는 500자 이하여야 합니다.")
        String retryReason,

        @Min(value = 1, message = "지연은 1분 이상이어야 합니다.")
        @Max(value = 1440, message = "지연은 1440분 이하여야 합니다.")
        Integer delayMinutes,

        @Min(value = 1, message = "최대 재시도 수는 1 이상이어야 합니다.")
        @Max(value = 5, message = "최대 재시도 수는 5 이하여야 합니다.")
        Integer maxRetries,

        Boolean notifyUser
    ) {
        public ManualRetryCommand toCommand() {
            return new ManualRetryCommand(
                paymentId,
                retryReason,
                delayMinutes,
                maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES,
                notifyUser == null || notifyUser
            );
        }
    }

    /**
     * 자동 재시도 예약 요청 DTO.
     */
    public record ScheduleRetryRequest(
        @NotNull(message = "결제 ID는 필수입니다.")
        @Positive(message = "결제 ID는 양수여야 합니다.")
        Long paymentId,

        ScheduleType scheduleType,

        @Min(value = 5, message = "지연은 5분 이상이어야 합니다.")
        @Max(value = 1440, message = "지연은 1440분 이하여야 합니다.")
        Integer delayMinutes,

        @Min(value = 1, message = "최대 시도 수는 1 이상이어야 합니다.")
        @Max(value = 5, message = "최대 시도 수는 5 이하여야 합니다.")
        Integer maxAttempts
    ) {
        public ScheduleRetryCommand toCommand() {
            return new ScheduleRetryCommand(
                paymentId,
                scheduleType != null ? scheduleType : ScheduleType.SMART,
                delayMinutes,
                maxAttempts != null ? maxAttempts : DEFAULT_MAX_RETRIES
            );
        }
    }

    /**
     * 재시도 응답 DTO.
     */
    public record RetryAttemptResponse(
        Long retryId,
        Long paymentId,
        int attemptNumber,
        LocalDateTime retryAt,
        String retryReason,
        RetryMethod retryMethod,
        RetryStatus status,
        String failureReason,
        ZonedDateTime createdAt,
        ZonedDateTime updatedAt
    ) {
        public static RetryAttemptResponse from(RetryAttemptInfo info) {
            return new RetryAttemptResponse(
                info.retryId(),
                info.paymentId(),
                info.attemptNumber(),
                info.retryAt(),
                info.reason(),
                info.method(),
                info.status(),
                info.failureReason(),
                info.createdAt(),
                info.updatedAt()
            );
        }
    }

    /**
     * 재시도 실행 결과 DTO.
     */
    public record ExecutionResponse(
        String gatewayOrderId,
        RetryStatus status,
        BigDecimal amount,
        String currency
    ) {
        public static ExecutionResponse from(RetryExecutionInfo info) {
            return new ExecutionResponse(info.gatewayOrderId(), info.status(), info.amount(), info.currency());
        }
    }

    /**
     * 수동 재시도 응답 DTO.
     */
    public record ManualRetryResponse(
        ManualRetryResult.Outcome outcome,
        Long retryId,
        Long paymentId,
        int attemptNumber,
        LocalDateTime scheduledFor,
        ExecutionResponse execution
    ) {
        public static ManualRetryResponse from(ManualRetryResult result) {
            return new ManualRetryResponse(
                result.outcome(),
                result.retryId(),
                result.paymentId(),
                result.attemptNumber(),
                result.scheduledFor(),
                result.execution() != null ? ExecutionResponse.from(result.execution()) : null
            );
        }
    }

    /**
     * 자동 재시도 예약 응답 DTO.
     */
    public record ScheduleRetryResponse(
        Long retryId,
        Long paymentId,
        ScheduleType scheduleType,
        LocalDateTime scheduledFor,
        int delayMinutes
    ) {
        public static ScheduleRetryResponse from(RetryScheduleInfo info) {
            return new ScheduleRetryResponse(
                info.retryId(), info.paymentId(), info.scheduleType(), info.scheduledFor(), info.delayMinutes());
        }
    }

    /**
     * 재시도 통계 응답 DTO.
     */
    public record AnalyticsResponse(
        long totalRetries,
        long successfulRetries,
        long failedRetries,
        int successRate,
        List<FailureReasonResponse> commonFailureReasons
    ) {
        public static AnalyticsResponse from(RetryAnalytics analytics) {
            return new AnalyticsResponse(
                analytics.totalRetries(),
                analytics.successfulRetries(),
                analytics.failedRetries(),
                analytics.successRate(),
                analytics.commonFailureReasons().stream()
                    .map(reason -> new FailureReasonResponse(reason.reason(), reason.count(), reason.percentage()))
                    .toList()
            );
        }
    }

    public record FailureReasonResponse(String reason, long count, int percentage) {
    }

    /**
     * 결제 재시도 현황 응답 DTO.
     */
    public record RetryStatusResponse(
        Long paymentId,
        List<RetryAttemptResponse> retries,
        AnalyticsResponse analytics
    ) {
        public static RetryStatusResponse from(RetryStatusInfo info) {
            return new RetryStatusResponse(
                info.paymentId(),
                info.attempts().stream().map(RetryAttemptResponse::from).toList(),
                AnalyticsResponse.from(info.analytics())
            );
        }
    }

    /**
     * 실행 예정 재시도 일괄 처리 응답 DTO.
     */
    public record ProcessedRetriesResponse(int processed, int successful, int failed) {
        public static ProcessedRetriesResponse from(ProcessedRetries result) {
            return new ProcessedRetriesResponse(result.processed(), result.successful(), result.failed());
        }
    }
}
