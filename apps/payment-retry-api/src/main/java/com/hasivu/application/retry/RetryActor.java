package com.hasivu.application.retry;

/**
 * 재시도 요청을 보낸 인증된 사용자.
 * <p>
 * 인증은 외부에서 끝난 것으로 보고, 로그와 알림에만 사용합니다.
 * </p>
 *
 * @param id 사용자 ID
 * @param email 이메일 (null 가능)
 * @param role 역할 (null 가능)
 */
public record RetryActor(String id, String email, String role) {

    private static final String SYSTEM_ID = "system";

    /**
     * 스케줄러가 사용하는 시스템 사용자를 반환합니다.
     *
     * @return 시스템 사용자
     */
    public static RetryActor system() {
        return new RetryActor(SYSTEM_ID, null, "SYSTEM");
    }
}
