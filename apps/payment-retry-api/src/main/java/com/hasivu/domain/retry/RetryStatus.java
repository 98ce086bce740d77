package com.hasivu.domain.retry;

import java.util.Map;
import java.util.Set;

/**
 * 결제 재시도 상태.
 * <p>
 * <b>허용되는 전이:</b>
 * <ul>
 *   <li>SCHEDULED → PROCESSING (실행 시작)</li>
 *   <li>SCHEDULED → CANCELLED (사용자 취소)</li>
 *   <li>PROCESSING → COMPLETED (게이트웨이 성공)</li>
 *   <li>PROCESSING → FAILED (게이트웨이 실패)</li>
 * </ul>
 * 그 외의 전이는 모두 거부됩니다.
 * </p>
 */
public enum RetryStatus {
    SCHEDULED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Map<RetryStatus, Set<RetryStatus>> TRANSITIONS = Map.of(
        SCHEDULED, Set.of(PROCESSING, CANCELLED),
        PROCESSING, Set.of(COMPLETED, FAILED),
        COMPLETED, Set.of(),
        FAILED, Set.of(),
        CANCELLED, Set.of()
    );

    /**
     * 지정한 상태로 전이할 수 있는지 확인합니다.
     *
     * @param next 다음 상태
     * @return 전이 가능 여부
     */
    public boolean canTransitionTo(RetryStatus next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }

    /**
     * 종결 상태인지 확인합니다.
     *
     * @return 종결 여부 (COMPLETED, FAILED, CANCELLED)
     */
    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
