package com.ryuqq.orgsetup.core.model;

/**
 * 조직 셋업 단계.
 *
 * <p>선언 순서가 곧 실행 순서입니다. 각 단계는 이전 단계가 만든 ID에 의존합니다.</p>
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>ORGANIZATION_CREATION</li>
 *   <li>TENANT_CREATION (organization ID 필요)</li>
 *   <li>ADMIN_USER_CREATION (tenant ID 필요)</li>
 *   <li>API_KEY_GENERATION (admin user ID 필요)</li>
 *   <li>DOMAIN_CONFIGURATION (tenant ID 필요, 비필수 단계)</li>
 * </ol>
 *
 * <p>DOMAIN_CONFIGURATION만 비필수이며, 실패해도 롤백하지 않고 부분 성공으로 처리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SetupStep {

    ORGANIZATION_CREATION(ResourceKind.ORGANIZATION, true),
    TENANT_CREATION(ResourceKind.TENANT, true),
    ADMIN_USER_CREATION(ResourceKind.ADMIN_USER, true),
    API_KEY_GENERATION(ResourceKind.API_KEY, true),
    DOMAIN_CONFIGURATION(ResourceKind.DOMAIN, false);

    private final ResourceKind resourceKind;
    private final boolean critical;

    SetupStep(ResourceKind resourceKind, boolean critical) {
        this.resourceKind = resourceKind;
        this.critical = critical;
    }

    /**
     * 이 단계가 생성하는 리소스 종류.
     *
     * @return ResourceKind
     */
    public ResourceKind resourceKind() {
        return resourceKind;
    }

    /**
     * 필수 단계 여부.
     *
     * <p>필수 단계가 실패하면 셋업 전체가 실패하고 롤백 대상이 됩니다.</p>
     *
     * @return 필수 단계이면 true
     */
    public boolean isCritical() {
        return critical;
    }

    /**
     * 리소스 종류에 대응하는 단계 조회.
     *
     * @param kind 리소스 종류
     * @return 해당 리소스를 생성하는 단계
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public static SetupStep producing(ResourceKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        for (SetupStep step : values()) {
            if (step.resourceKind == kind) {
                return step;
            }
        }
        throw new IllegalStateException("No step produces " + kind);
    }
}
