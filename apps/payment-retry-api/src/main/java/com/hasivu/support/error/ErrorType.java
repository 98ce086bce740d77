package com.hasivu.support.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 오류 유형.
 * <p>
 * 호출자가 메시지 문자열이 아닌 유형으로 분기할 수 있도록 HTTP 상태, 오류 코드, 기본 메시지를 함께 가집니다.
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorType {
    /** 범용 에러 */
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase(), "일시적인 오류가 발생했습니다."),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, HttpStatus.BAD_REQUEST.getReasonPhrase(), "잘못된 요청입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, HttpStatus.NOT_FOUND.getReasonPhrase(), "존재하지 않는 요청입니다."),

    /** 결제 재시도 에러 */
    RETRY_NOT_ALLOWED(HttpStatus.CONFLICT, "Retry Not Allowed", "결제 재시도가 허용되지 않습니다."),
    INVALID_STATE(HttpStatus.CONFLICT, "Invalid State", "요청한 상태 전이를 수행할 수 없습니다."),
    GATEWAY_ERROR(HttpStatus.BAD_GATEWAY, HttpStatus.BAD_GATEWAY.getReasonPhrase(), "결제 게이트웨이 요청에 실패했습니다.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
