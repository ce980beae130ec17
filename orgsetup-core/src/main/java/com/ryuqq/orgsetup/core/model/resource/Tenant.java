package com.ryuqq.orgsetup.core.model.resource;

/**
 * 테넌트 리소스. 하나의 조직에 속합니다.
 *
 * @param id 테넌트 ID
 * @param organizationId 소속 조직 ID
 * @param name 테넌트 이름
 * @param subdomain 서브도메인 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Tenant(
    String id,
    String organizationId,
    String name,
    String subdomain
) {

    public Tenant {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId cannot be null or blank");
        }
    }
}
