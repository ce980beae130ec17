package com.ryuqq.orgsetup.core.statemachine;

import com.ryuqq.orgsetup.core.model.SetupStep;

/**
 * 셋업 실행 상태.
 *
 * <p><strong>상태 전이 흐름:</strong></p>
 * <pre>
 * IDLE → CREATING_ORGANIZATION → CREATING_TENANT → CREATING_ADMIN_USER
 *      → GENERATING_API_KEY → [CONFIGURING_DOMAIN] → COMPLETED
 *
 * (진행 중 상태) → FAILED → ROLLING_BACK → ROLLED_BACK
 * </pre>
 *
 * <p>롤백을 비활성화한 경우 FAILED에서 실행이 끝납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SetupState {

    IDLE,
    CREATING_ORGANIZATION,
    CREATING_TENANT,
    CREATING_ADMIN_USER,
    GENERATING_API_KEY,
    CONFIGURING_DOMAIN,
    COMPLETED,
    FAILED,
    ROLLING_BACK,
    ROLLED_BACK;

    /**
     * 종료 상태인지 확인.
     *
     * <p>COMPLETED, ROLLED_BACK은 어떤 상태로도 전이할 수 없습니다.</p>
     *
     * @return 종료 상태 여부
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK;
    }

    /**
     * 단계를 실행 중인 상태인지 확인.
     *
     * @return 리소스 생성 단계 상태이면 true
     */
    public boolean isRunningStep() {
        return this == CREATING_ORGANIZATION
            || this == CREATING_TENANT
            || this == CREATING_ADMIN_USER
            || this == GENERATING_API_KEY
            || this == CONFIGURING_DOMAIN;
    }

    /**
     * 단계에 대응하는 실행 상태 조회.
     *
     * @param step 셋업 단계
     * @return 실행 상태
     * @throws IllegalArgumentException step이 null인 경우
     */
    public static SetupState running(SetupStep step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        return switch (step) {
            case ORGANIZATION_CREATION -> CREATING_ORGANIZATION;
            case TENANT_CREATION -> CREATING_TENANT;
            case ADMIN_USER_CREATION -> CREATING_ADMIN_USER;
            case API_KEY_GENERATION -> GENERATING_API_KEY;
            case DOMAIN_CONFIGURATION -> CONFIGURING_DOMAIN;
        };
    }
}
