package com.ryuqq.orgsetup.adapter.runner;

/**
 * 재시도 관점의 오류 분류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorClass {

    /** 일시적 오류: 백오프 후 재시도 */
    RETRYABLE,

    /** 영구 오류: 즉시 실패 */
    NON_RETRYABLE,

    /** 충돌(409): 재시도 대신 ConflictResolver가 처리 */
    CONFLICT_RETRYABLE
}
