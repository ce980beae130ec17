package com.ryuqq.orgsetup.core.report;

/**
 * 리소스 하나에 대한 보상 동작 결과 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CompensationStatus {

    /** 보상 호출 성공 (또는 이미 존재하지 않음) */
    COMPENSATED,

    /** 재사용한 기존 리소스라서 건너뜀 */
    SKIPPED,

    /** 재시도 후에도 실패, 수동 정리 필요 */
    FAILED
}
