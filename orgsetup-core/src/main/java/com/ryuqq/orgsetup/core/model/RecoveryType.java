package com.ryuqq.orgsetup.core.model;

/**
 * 셋업 결과가 어떤 방식으로 얻어졌는지 나타냅니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RecoveryType {

    /** 모든 리소스를 이번 실행에서 새로 생성 */
    NONE,

    /** 하나 이상의 단계가 충돌 해결로 기존 리소스를 재사용 */
    REUSED_EXISTING
}
