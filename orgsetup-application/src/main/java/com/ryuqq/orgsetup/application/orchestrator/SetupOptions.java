package com.ryuqq.orgsetup.application.orchestrator;

import java.time.Duration;

/**
 * 셋업 실행 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>idempotencyKey: 호출자 지정 키 (null이면 요청 내용으로 생성)</li>
 *   <li>enableRollback: 필수 단계 실패 시 롤백 여부 (기본 true)</li>
 *   <li>enableRetry: 일시적 오류 재시도 여부 (기본 true)</li>
 *   <li>timeout: 전체 실행 마감 시간 (null이면 제한 없음)</li>
 * </ul>
 *
 * @param idempotencyKey 멱등성 키 (null 가능)
 * @param enableRollback 롤백 여부
 * @param enableRetry 재시도 여부
 * @param timeout 마감 시간 (null 가능, 양수여야 함)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SetupOptions(
    String idempotencyKey,
    boolean enableRollback,
    boolean enableRetry,
    Duration timeout
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException timeout이 0 이하인 경우
     */
    public SetupOptions {
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    /**
     * 기본 옵션 (키 자동 생성, 롤백/재시도 활성화, 마감 시간 없음).
     *
     * @return 기본 SetupOptions
     */
    public static SetupOptions defaults() {
        return new SetupOptions(null, true, true, null);
    }

    /**
     * idempotencyKey만 변경한 새 인스턴스 생성.
     */
    public SetupOptions withIdempotencyKey(String idempotencyKey) {
        return new SetupOptions(idempotencyKey, enableRollback, enableRetry, timeout);
    }

    /**
     * enableRollback만 변경한 새 인스턴스 생성.
     */
    public SetupOptions withEnableRollback(boolean enableRollback) {
        return new SetupOptions(idempotencyKey, enableRollback, enableRetry, timeout);
    }

    /**
     * enableRetry만 변경한 새 인스턴스 생성.
     */
    public SetupOptions withEnableRetry(boolean enableRetry) {
        return new SetupOptions(idempotencyKey, enableRollback, enableRetry, timeout);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public SetupOptions withTimeout(Duration timeout) {
        return new SetupOptions(idempotencyKey, enableRollback, enableRetry, timeout);
    }
}
