package com.ryuqq.orgsetup.core.exception;

/**
 * 실패한 셋업에 대해 호출자가 취할 수 있는 복구 방법.
 *
 * @param action 복구 동작
 * @param description 설명
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RecoveryOption(Action action, String description) {

    /**
     * 복구 동작 종류.
     */
    public enum Action {
        /** 모든 리소스가 정리되었으므로 처음부터 다시 실행 */
        FULL_RETRY,
        /** 남은 리소스를 충돌 해결로 재사용하며 같은 키로 다시 실행 */
        RESUME_WITH_SAME_KEY,
        /** 일시적 오류, 시간을 두고 다시 실행 */
        RETRY_WITH_BACKOFF,
        /** 충돌한 값(서브도메인, 이메일 등)을 바꿔서 다시 실행 */
        RETRY_WITH_ADJUSTED_INPUT,
        /** 수동 정리 보고서를 처리한 뒤 다시 실행 */
        MANUAL_CLEANUP_THEN_RETRY
    }

    public RecoveryOption {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
    }
}
