package com.hasivu.interfaces.api.retry;

import com.hasivu.application.retry.PaymentRetryFacade;
import com.hasivu.application.retry.RetryActor;
import com.hasivu.interfaces.api.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 결제 재시도 API v1 컨트롤러.
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/payments/retry")
public class PaymentRetryV1Controller {

    private final PaymentRetryFacade paymentRetryFacade;

    /**
     * 수동 재시도를 요청한다. 지연이 없으면 즉시 실행한다.
     *
     * @param userId X-USER-ID 헤더
     * @param email X-USER-EMAIL 헤더
     * @param role X-USER-ROLE 헤더
     * @param request 수동 재시도 요청
     * @return 실행 또는 예약 결과
     */
    @PostMapping
    public ApiResponse<PaymentRetryV1Dto.ManualRetryResponse> manualRetry(
        @RequestHeader("X-USER-ID") String userId,
        @RequestHeader(value = "X-USER-EMAIL", required = false) String email,
        @RequestHeader(value = "X-USER-ROLE", required = false) String role,
        @Valid @RequestBody PaymentRetryV1Dto.ManualRetryRequest request
    ) {
        return ApiResponse.success(PaymentRetryV1Dto.ManualRetryResponse.from(
            paymentRetryFacade.manualRetry(request.toCommand(), new RetryActor(userId, email, role))));
    }

    /**
     * 자동 재시도를 예약한다.
     */
    @PostMapping("/schedule")
    public ApiResponse<PaymentRetryV1Dto.ScheduleRetryResponse> scheduleRetry(
        @RequestHeader("X-USER-ID") String userId,
        @RequestHeader(value = "X-USER-EMAIL", required = false) String email,
        @RequestHeader(value = "X-USER-ROLE", required = false) String role,
        @Valid @RequestBody PaymentRetryV1Dto.ScheduleRetryRequest request
    ) {
        return ApiResponse.success(PaymentRetryV1Dto.ScheduleRetryResponse.from(
            paymentRetryFacade.scheduleRetry(request.toCommand(), new RetryActor(userId, email, role))));
    }

    /**
     * 결제의 재시도 현황을 조회한다.
     *
     * @param userId X-USER-ID 헤더
     * @param paymentId 결제 ID
     * @return 재시도 목록과 결제 단위 통계
     */
    @GetMapping("/{paymentId}")
    public ApiResponse<PaymentRetryV1Dto.RetryStatusResponse> getRetryStatus(
        @RequestHeader("X-USER-ID") String userId,
        @PathVariable Long paymentId
    ) {
        return ApiResponse.success(PaymentRetryV1Dto.RetryStatusResponse.from(
            paymentRetryFacade.getRetryStatus(paymentId)));
    }

    /**
     * 재시도 통계를 조회한다. paymentId가 없으면 전체 통계.
     */
    @GetMapping
    public ApiResponse<PaymentRetryV1Dto.AnalyticsResponse> getAnalytics(
        @RequestHeader("X-USER-ID") String userId,
        @RequestParam(required = false) Long paymentId
    ) {
        return ApiResponse.success(PaymentRetryV1Dto.AnalyticsResponse.from(
            paymentRetryFacade.getAnalytics(paymentId)));
    }

    /**
     * 예약된 재시도를 취소한다.
     *
     * @param userId X-USER-ID 헤더
     * @param email X-USER-EMAIL 헤더
     * @param role X-USER-ROLE 헤더
     * @param retryId 재시도 ID
     * @return 취소된 재시도
     */
    @DeleteMapping("/{retryId}")
    public ApiResponse<PaymentRetryV1Dto.RetryAttemptResponse> cancelRetry(
        @RequestHeader("X-USER-ID") String userId,
        @RequestHeader(value = "X-USER-EMAIL", required = false) String email,
        @RequestHeader(value = "X-USER-ROLE", required = false) String role,
        @PathVariable Long retryId
    ) {
        return ApiResponse.success(PaymentRetryV1Dto.RetryAttemptResponse.from(
            paymentRetryFacade.cancel(retryId, new RetryActor(userId, email, role))));
    }

    /**
     * 실행 시각이 지난 예약 재시도를 한 번 일괄 실행한다.
     */
    @PostMapping("/process-scheduled")
    public ApiResponse<PaymentRetryV1Dto.ProcessedRetriesResponse> processScheduled(
        @RequestHeader("X-USER-ID") String userId,
        @RequestHeader(value = "X-USER-EMAIL", required = false) String email,
        @RequestHeader(value = "X-USER-ROLE", required = false) String role
    ) {
        return ApiResponse.success(PaymentRetryV1Dto.ProcessedRetriesResponse.from(
            paymentRetryFacade.processDueRetries(new RetryActor(userId, email, role))));
    }
}
