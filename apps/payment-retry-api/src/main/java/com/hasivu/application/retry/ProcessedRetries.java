package com.hasivu.application.retry;

/**
 * 실행 예정 재시도 일괄 처리 결과.
 *
 * @param processed 처리 대상 수
 * @param successful 성공 수
 * @param failed 실패 수
 */
public record ProcessedRetries(int processed, int successful, int failed) {
}
